package com.facthistory.reconstruction;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Reconstructed history of one entity. The last snapshot is its current state.
 */
public record EntityHistory(
    @JsonProperty("entity_id") String entityId,
    @JsonProperty("transaction_count") int transactionCount,
    @JsonProperty("snapshots") List<Snapshot> snapshots
) {

    public Snapshot current() {
        return snapshots.get(snapshots.size() - 1);
    }
}
