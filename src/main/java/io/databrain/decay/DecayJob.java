package io.databrain.decay;

import org.jobrunr.jobs.annotations.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Recurring JobRunr entry point for {@link DecayScheduler#run()}.
 */
@Component
public class DecayJob {

    private static final Logger log = LoggerFactory.getLogger(DecayJob.class);

    private final DecayScheduler decayScheduler;

    public DecayJob(DecayScheduler decayScheduler) {
        this.decayScheduler = decayScheduler;
    }

    @Job(name = "Brain temporal decay")
    public void execute() {
        DecayReport report = decayScheduler.run();
        if (!report.errors().isEmpty()) {
            log.warn("Temporal decay finished with {} errors, first: {}", report.errors().size(), report.errors().get(0));
        }
    }
}
