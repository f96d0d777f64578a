package dao.metatx.relay.controller;

import dao.metatx.relay.chain.LocalChain;
import dao.metatx.relay.model.BatchExecutionRecord;
import dao.metatx.relay.repository.ExecutionRecordRepository;
import dao.metatx.relay.service.MetaTxGateway;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Monitoring endpoints for settled batches and gateway state.
 */
@RestController
@RequestMapping("/api/monitor")
public class MonitoringController {

    private final ExecutionRecordRepository records;
    private final MetaTxGateway gateway;
    private final LocalChain chain;

    public MonitoringController(ExecutionRecordRepository records, MetaTxGateway gateway, LocalChain chain) {
        this.records = records;
        this.gateway = gateway;
        this.chain = chain;
    }

    /**
     * GET /api/monitor/batches
     * All settled batches, optionally filtered by signer.
     */
    @GetMapping("/batches")
    public ResponseEntity<Map<String, Object>> getBatches(@RequestParam(required = false) String signer) {
        List<BatchExecutionRecord> found = signer == null ? records.findAll() : records.findBySigner(signer);

        List<Map<String, Object>> batchInfo = new ArrayList<>();
        for (BatchExecutionRecord record : found) {
            batchInfo.add(buildBatchInfo(record));
        }

        long items = found.stream().mapToLong(BatchExecutionRecord::itemCount).sum();
        long succeeded = found.stream().mapToLong(BatchExecutionRecord::successCount).sum();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("totalBatches", found.size());
        response.put("batches", batchInfo);
        response.put("statistics", Map.of(
                "totalItems", items,
                "succeededItems", succeeded,
                "failedItems", items - succeeded
        ));
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/monitor/batch/{batchId}
     */
    @GetMapping("/batch/{batchId}")
    public ResponseEntity<Map<String, Object>> getBatch(@PathVariable long batchId) {
        Map<String, Object> response = new LinkedHashMap<>();
        Optional<BatchExecutionRecord> record = records.findByBatchId(batchId);
        if (record.isEmpty()) {
            response.put("status", "NOT_FOUND");
            response.put("error", "Batch not found: " + batchId);
            return ResponseEntity.status(404).body(response);
        }
        response.put("status", "SUCCESS");
        response.put("batch", buildBatchInfo(record.get()));
        return ResponseEntity.ok(response);
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("gateway", Map.of(
                "address", gateway.getAddress(),
                "owner", gateway.getAdmin().owner(),
                "paused", gateway.getAdmin().isPaused(),
                "nativeBalance", chain.balanceOf(gateway.getAddress()).toString(),
                "relayers", gateway.getAuthorizedRelayers()
        ));
        response.put("statistics", Map.of(
                "settledBatches", gateway.batchCount(),
                "events", chain.getEvents().size()
        ));
        return ResponseEntity.ok(response);
    }

    private Map<String, Object> buildBatchInfo(BatchExecutionRecord record) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("batchId", record.batchId());
        info.put("signer", record.signer());
        info.put("relayer", record.relayer());
        info.put("itemCount", record.itemCount());
        info.put("succeeded", record.successCount());
        info.put("perItemSuccess", record.perItemSuccess());
        info.put("totalValueRequired", record.totalValueRequired().toString());
        info.put("totalValueUsed", record.totalValueUsed().toString());
        info.put("refunded", record.refunded().toString());
        info.put("executedAt", record.executedAt());
        info.put("executedAtReadable", Instant.ofEpochSecond(record.executedAt()).toString());
        return info;
    }
}
