package io.databrain.replay;

import io.databrain.config.BrainProperties;
import org.jobrunr.jobs.annotations.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Recurring JobRunr entry point exporting every configured profile.
 */
@Component
public class ReplayJob {

    private static final Logger log = LoggerFactory.getLogger(ReplayJob.class);

    private final ReplayExporter replayExporter;
    private final List<String> profiles;

    public ReplayJob(ReplayExporter replayExporter, BrainProperties properties) {
        this.replayExporter = replayExporter;
        this.profiles = properties.replay().profiles();
    }

    @Job(name = "Brain replay export")
    public void execute() {
        int written = 0;
        for (ReplayReport report : replayExporter.run(profiles)) {
            written += report.samplesWritten();
            if (!report.errors().isEmpty()) {
                log.warn("Replay export '{}' reported errors: {}", report.profile(), report.errors());
            }
        }
        log.info("Replay export job finished: {} samples across {} profiles", written, profiles.size());
    }
}
