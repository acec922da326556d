package com.facthistory.reconstruction;

import com.facthistory.contract.FactValue;
import com.facthistory.contract.TransactionId;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds per-transaction deltas into full snapshots: each snapshot is the
 * previous one overlaid with the next delta.
 */
public class SnapshotAccumulator {

    private final RetractionPolicy retractionPolicy;

    public SnapshotAccumulator(RetractionPolicy retractionPolicy) {
        this.retractionPolicy = retractionPolicy;
    }

    /**
     * @param deltas one delta per transaction, in strictly ascending transaction order
     * @return one snapshot per delta, in the same order
     */
    public List<Snapshot> accumulate(List<Delta> deltas) {
        List<Snapshot> snapshots = new ArrayList<>(deltas.size());
        Map<String, FactValue> state = Map.of();
        TransactionId previousTx = null;

        for (Delta delta : deltas) {
            if (previousTx != null && delta.transactionId().compareTo(previousTx) <= 0) {
                throw new IllegalArgumentException("deltas out of order: transaction "
                    + delta.transactionId() + " follows " + previousTx);
            }

            state = previousTx == null
                ? new LinkedHashMap<>(delta.assertions())
                : MapOverlay.mergeInto(state, delta.assertions());
            if (retractionPolicy == RetractionPolicy.REMOVE && !delta.retractedAttributes().isEmpty()) {
                state = MapOverlay.withoutKeys(state, delta.retractedAttributes());
            }

            snapshots.add(new Snapshot(delta.transactionId(), delta.txTimestamp(), state));
            previousTx = delta.transactionId();
        }
        return snapshots;
    }
}
