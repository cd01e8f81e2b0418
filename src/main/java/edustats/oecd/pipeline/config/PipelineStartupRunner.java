package edustats.oecd.pipeline.config;

import edustats.oecd.pipeline.service.PipelineService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Runs the pipeline once after startup when pipeline.run-on-startup is set.
 * A failed run is logged and the application keeps serving requests.
 */
@Component
public class PipelineStartupRunner {

    private static final Logger logger = LoggerFactory.getLogger(PipelineStartupRunner.class);

    private final PipelineConfig config;
    private final PipelineService pipelineService;

    public PipelineStartupRunner(PipelineConfig config, PipelineService pipelineService) {
        this.config = config;
        this.pipelineService = pipelineService;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void runOnStartup() {
        if (!config.isRunOnStartup()) {
            logger.debug("pipeline.run-on-startup is false, waiting for API requests");
            return;
        }

        logger.info("pipeline.run-on-startup is true, starting initial run");
        try {
            pipelineService.run();
        } catch (RuntimeException e) {
            logger.error("Initial pipeline run failed: {}", e.getMessage(), e);
        }
    }
}
