package com.facthistory.api;

import com.facthistory.contract.TransactionId;
import com.facthistory.reconstruction.ReconstructionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoint for reconstructed entity history.
 *
 * GET /v1/entities/{entityId}/history
 * GET /v1/entities/{entityId}/history?as_of={transactionId}
 */
@RestController
@RequestMapping("/v1/entities")
public class HistoryController {

    private final ReconstructionService reconstructionService;

    public HistoryController(ReconstructionService reconstructionService) {
        this.reconstructionService = reconstructionService;
    }

    @GetMapping("/{entityId}/history")
    public ResponseEntity<?> history(@PathVariable String entityId,
                                     @RequestParam(name = "as_of", required = false) Long asOf) {
        if (asOf != null) {
            return reconstructionService.snapshotAsOf(entityId, new TransactionId(asOf))
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
        }
        return reconstructionService.history(entityId)
            .<ResponseEntity<?>>map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }
}
