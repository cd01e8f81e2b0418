package edustats.oecd.pipeline.controller;

import edustats.oecd.pipeline.dto.ErrorResponseDto;
import edustats.oecd.pipeline.dto.PipelineRunResultDto;
import edustats.oecd.pipeline.service.PipelineService;
import edustats.oecd.pipeline.service.TableStatsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Controller for pipeline runs
 * Triggers a synchronous run and reports table row counts
 */
@RestController
@RequestMapping("/api/v1/pipeline")
@Tag(name = "Pipeline", description = "Run the education statistics pipeline and inspect loaded tables")
public class PipelineController {

    private static final Logger logger = LoggerFactory.getLogger(PipelineController.class);

    @Autowired
    private PipelineService pipelineService;

    @Autowired
    private TableStatsService tableStatsService;

    /**
     * Run the pipeline once. Blocks until the run finishes.
     */
    @PostMapping("/runs")
    @Operation(
        summary = "Run pipeline",
        description = "Extract, clean and load the enrollment, graduation and spending datasets"
    )
    @ApiResponse(responseCode = "200", description = "Run completed")
    @ApiResponse(responseCode = "409", description = "A run is already in progress",
            content = @Content(schema = @Schema(implementation = ErrorResponseDto.class)))
    @ApiResponse(responseCode = "502", description = "Upstream dataset could not be fetched or decoded",
            content = @Content(schema = @Schema(implementation = ErrorResponseDto.class)))
    @ApiResponse(responseCode = "500", description = "Artifacts or database writes failed",
            content = @Content(schema = @Schema(implementation = ErrorResponseDto.class)))
    public ResponseEntity<PipelineRunResultDto> runPipeline() {
        logger.info("Pipeline run requested");
        PipelineRunResultDto result = pipelineService.run();
        return ResponseEntity.ok(result);
    }

    /**
     * Row counts of the pipeline tables.
     */
    @GetMapping("/stats")
    @Operation(
        summary = "Get table statistics",
        description = "Row count per pipeline table; a table that cannot be counted reports 0"
    )
    public ResponseEntity<Map<String, Long>> getTableStats() {
        logger.debug("Retrieving pipeline table statistics");
        return ResponseEntity.ok(tableStatsService.getTableStats());
    }
}
