package io.databrain.schedule;

import io.databrain.config.BrainProperties;
import org.jobrunr.jobs.RecurringJob;
import org.jobrunr.jobs.mappers.JobMapper;
import org.jobrunr.scheduling.JobScheduler;
import org.jobrunr.storage.InMemoryStorageProvider;
import org.jobrunr.utils.mapper.jackson.JacksonJsonMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Uses a real in-memory JobRunr storage so the recurring jobs are actually persisted.
 */
class BrainJobsServiceTest {

    private InMemoryStorageProvider storageProvider;
    private JobScheduler jobScheduler;

    @BeforeEach
    void setUp() {
        storageProvider = new InMemoryStorageProvider();
        storageProvider.setJobMapper(new JobMapper(new JacksonJsonMapper()));
        jobScheduler = new JobScheduler(storageProvider);
    }

    private Map<String, String> recurringJobs() {
        List<RecurringJob> jobs = storageProvider.getRecurringJobs();
        return jobs.stream().collect(Collectors.toMap(RecurringJob::getId, RecurringJob::getScheduleExpression));
    }

    @Test
    void shouldRegisterDecayAndReplayJobs() {
        new BrainJobsService(jobScheduler, BrainProperties.defaults()).start();

        Map<String, String> jobs = recurringJobs();
        assertEquals(2, jobs.size());
        assertEquals("0 2 * * *", jobs.get(BrainJobsService.DECAY_JOB_ID));
        assertEquals("0 3 * * 0", jobs.get(BrainJobsService.REPLAY_JOB_ID));
    }

    @Test
    void shouldUseConfiguredCronAndSkipDisabledJobs() {
        BrainProperties properties = new BrainProperties(null, null, null, null,
                new BrainProperties.Decay(true, "30 4 * * *", 0, 0, 0),
                new BrainProperties.Replay(false, null, null, null, 0, null, null));

        new BrainJobsService(jobScheduler, properties).start();

        assertEquals(Map.of(BrainJobsService.DECAY_JOB_ID, "30 4 * * *"), recurringJobs());
    }

    @Test
    void shouldNotDuplicateJobsOnRestart() {
        BrainJobsService service = new BrainJobsService(jobScheduler, BrainProperties.defaults());

        service.start();
        service.start();

        assertEquals(2, storageProvider.getRecurringJobs().size());
    }

    @Test
    void shouldRemoveJobsOnStop() {
        BrainJobsService service = new BrainJobsService(jobScheduler, BrainProperties.defaults());
        service.start();

        service.stop();

        assertTrue(storageProvider.getRecurringJobs().isEmpty());
    }
}
