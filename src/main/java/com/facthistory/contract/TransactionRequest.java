package com.facthistory.contract;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Body of a write against one entity: attributes to set and attributes to retract.
 * Both parts are applied atomically in a single transaction.
 */
public record TransactionRequest(
    @JsonProperty("assert") Map<String, FactValue> assertions,
    @JsonProperty("retract") List<String> retractions
) {

    public TransactionRequest {
        assertions = assertions == null ? Map.of() : assertions;
        retractions = retractions == null ? List.of() : retractions;
    }
}
