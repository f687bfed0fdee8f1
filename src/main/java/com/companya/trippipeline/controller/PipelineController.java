package com.companya.trippipeline.controller;

import com.companya.trippipeline.model.DailyKpi;
import com.companya.trippipeline.model.IngestResult;
import com.companya.trippipeline.model.ObjectNotificationBatch;
import com.companya.trippipeline.service.KpiAggregationService;
import com.companya.trippipeline.service.TripIngestionService;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Triggers for the ingestion and aggregation stages.
 */
@Slf4j
@RestController
@RequestMapping("/api/pipeline")
@RequiredArgsConstructor
public class PipelineController {

    private final TripIngestionService ingestionService;
    private final KpiAggregationService aggregationService;

    /**
     * Object-created notifications for uploaded trip files.
     */
    @PostMapping("/notifications")
    public ResponseEntity<IngestResult> onObjectsCreated(@RequestBody JsonNode body) {
        IngestResult result = ingestionService.ingest(ObjectNotificationBatch.fromJson(body));
        if (IngestResult.ERROR.equals(result.status())) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result);
        }
        return ResponseEntity.ok(result);
    }

    /**
     * Runs the KPI aggregation outside its schedule.
     */
    @PostMapping("/aggregate")
    public ResponseEntity<Map<String, Object>> aggregate() {
        try {
            log.info("Manual KPI aggregation requested");
            List<DailyKpi> kpis = aggregationService.aggregate();
            return ResponseEntity.ok(Map.of("status", "done", "kpis", kpis));
        } catch (Exception e) {
            log.error("Manual KPI aggregation failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("status", "error", "message", String.valueOf(e.getMessage())));
        }
    }
}
