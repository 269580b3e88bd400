package io.databrain.schedule;

import io.databrain.config.BrainProperties;
import io.databrain.decay.DecayJob;
import io.databrain.replay.ReplayJob;
import org.jobrunr.scheduling.JobScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Registers the brain's recurring JobRunr jobs on startup: daily temporal decay and the
 * periodic replay export.
 */
@Service
public class BrainJobsService {

    private static final Logger log = LoggerFactory.getLogger(BrainJobsService.class);
    public static final String DECAY_JOB_ID = "databrain-temporal-decay";
    public static final String REPLAY_JOB_ID = "databrain-replay-export";

    private final JobScheduler jobScheduler;
    private final BrainProperties.Decay decay;
    private final BrainProperties.Replay replay;

    public BrainJobsService(JobScheduler jobScheduler, BrainProperties properties) {
        this.jobScheduler = jobScheduler;
        this.decay = properties.decay();
        this.replay = properties.replay();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (decay.enabled()) {
            jobScheduler.<DecayJob>scheduleRecurrently(DECAY_JOB_ID, decay.cron(), x -> x.execute());
            log.info("Temporal decay job registered with cron: {}", decay.cron());
        } else {
            log.info("Temporal decay disabled via configuration");
        }

        if (replay.enabled()) {
            jobScheduler.<ReplayJob>scheduleRecurrently(REPLAY_JOB_ID, replay.cron(), x -> x.execute());
            log.info("Replay export job registered with cron: {}, profiles: {}", replay.cron(), replay.profiles());
        } else {
            log.info("Replay export disabled via configuration");
        }
    }

    /**
     * Removes both recurring jobs.
     */
    public void stop() {
        jobScheduler.deleteRecurringJob(DECAY_JOB_ID);
        jobScheduler.deleteRecurringJob(REPLAY_JOB_ID);
        log.info("Brain recurring jobs removed");
    }
}
