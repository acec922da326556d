package com.facthistory.api;

import com.facthistory.contract.FactRecord;
import com.facthistory.contract.FactValue;
import com.facthistory.contract.TransactionRequest;
import com.facthistory.store.TransactionReceipt;
import com.facthistory.store.TransactionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes and point queries against the fact store.
 *
 * POST /v1/entities/{entityId}/transactions
 * GET  /v1/entities/{entityId}
 * GET  /v1/entities/{entityId}/facts
 */
@RestController
@RequestMapping("/v1/entities")
public class EntityController {

    private final TransactionService transactionService;

    public EntityController(TransactionService transactionService) {
        this.transactionService = transactionService;
    }

    /**
     * Expected request body:
     * {
     *   "assert":  { "order/operator": { "type": "string", "value": "B" } },
     *   "retract": [ "order/location" ]
     * }
     */
    @PostMapping("/{entityId}/transactions")
    public Map<String, Object> transact(@PathVariable String entityId,
                                        @RequestBody TransactionRequest request) {
        TransactionReceipt receipt = transactionService.transact(entityId, request);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", receipt.isEmpty() ? "unchanged" : "accepted");
        body.put("entity_id", entityId);
        body.put("transaction_id", receipt.transactionId());
        body.put("tx_timestamp", receipt.txTimestamp());
        body.put("fact_count", receipt.facts().size());
        return body;
    }

    @GetMapping("/{entityId}")
    public ResponseEntity<Map<String, FactValue>> current(@PathVariable String entityId) {
        return transactionService.currentState(entityId)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{entityId}/facts")
    public ResponseEntity<List<FactRecord>> facts(@PathVariable String entityId) {
        List<FactRecord> facts = transactionService.facts(entityId);
        if (facts.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(facts);
    }
}
