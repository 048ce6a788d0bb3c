package com.costwatch.anomaly.controller;

import com.costwatch.anomaly.model.AnomalyStatus;
import com.costwatch.anomaly.model.DetectionRequest;
import com.costwatch.anomaly.model.DetectionResult;
import com.costwatch.anomaly.model.StoredAnomaly;
import com.costwatch.anomaly.repository.AnomalyRepository;
import com.costwatch.anomaly.service.AnomalyDetectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/anomalies")
@Tag(name = "Anomalies", description = "Run anomaly detection and review stored anomalies")
public class AnomalyController {

    private final AnomalyDetectionService detectionService;
    private final AnomalyRepository anomalyRepository;

    public AnomalyController(AnomalyDetectionService detectionService, AnomalyRepository anomalyRepository) {
        this.detectionService = detectionService;
        this.anomalyRepository = anomalyRepository;
    }

    @Operation(summary = "Detect anomalies for a cost record",
            description = "Runs every enabled, applicable check against the record and its history. "
                    + "Unless dryRun is set, anomalies are stored and live alerts dispatched.")
    @PostMapping("/detect")
    public ResponseEntity<?> detect(
            @RequestBody DetectionRequest request,
            @Parameter(description = "Only detect; do not store or alert")
            @RequestParam(defaultValue = "false") boolean dryRun) {
        if (request.getRecord() == null) {
            return badRequest("record is required", "record");
        }
        if (request.getRecord().getId() == null || request.getRecord().getCostType() == null
                || request.getRecord().getPeriodStart() == null || request.getRecord().getPeriodEnd() == null) {
            return badRequest("record id, costType, periodStart and periodEnd are required", "record");
        }

        DetectionResult result = dryRun
                ? detectionService.detectOnly(request)
                : detectionService.process(request);
        return ResponseEntity.ok(result);
    }

    @Operation(summary = "List stored anomalies", description = "Optionally filtered by cost record.")
    @GetMapping
    public ResponseEntity<List<StoredAnomaly>> listAnomalies(
            @Parameter(description = "Cost record ID", example = "rec-2024-03")
            @RequestParam(required = false) String costRecordId) {
        return ResponseEntity.ok(costRecordId != null
                ? anomalyRepository.findByCostRecordId(costRecordId)
                : anomalyRepository.findAll());
    }

    @Operation(summary = "Get a stored anomaly by ID")
    @GetMapping("/{anomalyId}")
    public ResponseEntity<StoredAnomaly> getAnomaly(@PathVariable String anomalyId) {
        return anomalyRepository.findById(anomalyId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @Operation(summary = "Change the review status of an anomaly",
            description = "Status is one of new, acknowledged, resolved, false_positive.")
    @PutMapping("/{anomalyId}/status")
    public ResponseEntity<?> updateStatus(@PathVariable String anomalyId, @RequestBody Map<String, String> body) {
        String raw = body.get("status");
        AnomalyStatus status;
        try {
            status = raw != null ? AnomalyStatus.fromId(raw) : null;
        } catch (IllegalArgumentException e) {
            status = null;
        }
        if (status == null) {
            return badRequest("status must be one of new, acknowledged, resolved, false_positive", "status");
        }

        return anomalyRepository.updateStatus(anomalyId, status)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }
}
