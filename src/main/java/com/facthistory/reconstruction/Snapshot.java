package com.facthistory.reconstruction;

import com.facthistory.contract.FactValue;
import com.facthistory.contract.TransactionId;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Complete state of an entity immediately after a transaction.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Snapshot(
    @JsonProperty("transaction_id") TransactionId transactionId,
    @JsonProperty("tx_timestamp") Instant txTimestamp,
    @JsonProperty("state") Map<String, FactValue> state
) {

    public Snapshot {
        state = Collections.unmodifiableMap(new LinkedHashMap<>(state));
    }
}
