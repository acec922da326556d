package com.facthistory.store;

import com.facthistory.contract.FactRecord;
import com.facthistory.contract.TransactionId;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of a write. {@code facts} is empty when the write changed nothing,
 * in which case no transaction was recorded and {@code transactionId} is null.
 */
public record TransactionReceipt(
    String entityId,
    TransactionId transactionId,
    Instant txTimestamp,
    List<FactRecord> facts
) {

    public boolean isEmpty() {
        return facts.isEmpty();
    }
}
