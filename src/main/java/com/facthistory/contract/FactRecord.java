package com.facthistory.contract;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * One row of an entity's change log: an assertion ({@code added = true}) or
 * retraction of a single attribute value, written in one transaction.
 *
 * <p>{@code txTimestamp} is the commit time reported by the store and may be null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FactRecord(
    @JsonProperty("transaction_id") TransactionId transactionId,
    @JsonProperty("attribute") String attribute,
    @JsonProperty("value") FactValue value,
    @JsonProperty("added") boolean added,
    @JsonProperty("tx_timestamp") Instant txTimestamp
) {

    public FactRecord {
        Objects.requireNonNull(transactionId, "transaction_id is required");
        Objects.requireNonNull(attribute, "attribute is required");
        Objects.requireNonNull(value, "value is required");
    }
}
