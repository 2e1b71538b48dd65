package com.example.trackscribe.service;

import com.example.trackscribe.dto.PipelineReport;
import com.example.trackscribe.exception.PipelineAbortedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Processes the configured {@code pipeline.url} once the context is up. An aborted run fails
 * the startup.
 */
@Component
@ConditionalOnProperty(name = "pipeline.run-on-startup", havingValue = "true")
public class PipelineRunner implements ApplicationRunner {
    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineRunner.class);

    private final PipelineOrchestrator orchestrator;

    public PipelineRunner(PipelineOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run(ApplicationArguments args) {
        LOGGER.info("Pipeline starting");
        try {
            PipelineReport report = orchestrator.run();
            LOGGER.info("Pipeline completed url={} entries={}", report.sourceUrl(), report.outcomes().size());
        } catch (PipelineAbortedException e) {
            LOGGER.error("Pipeline aborted after {} entries: {}",
                    e.getPartialReport() == null ? 0 : e.getPartialReport().outcomes().size(), e.getMessage());
            throw e;
        }
    }
}
