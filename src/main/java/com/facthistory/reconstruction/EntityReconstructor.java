package com.facthistory.reconstruction;

import com.facthistory.contract.FactRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;

/**
 * Raw fact history to snapshot sequence: group by transaction, resolve each
 * group to a delta, fold the deltas. Stateless and safe to share.
 */
public class EntityReconstructor {

    private static final Logger log = LoggerFactory.getLogger(EntityReconstructor.class);

    private final TransactionGrouper grouper;
    private final DeltaResolver resolver;
    private final SnapshotAccumulator accumulator;

    public EntityReconstructor(TransactionGrouper grouper,
                               DeltaResolver resolver,
                               SnapshotAccumulator accumulator) {
        this.grouper = grouper;
        this.resolver = resolver;
        this.accumulator = accumulator;
    }

    public EntityReconstructor(RetractionPolicy retractionPolicy) {
        this(new TransactionGrouper(), new DeltaResolver(), new SnapshotAccumulator(retractionPolicy));
    }

    /**
     * @return one snapshot per distinct transaction, oldest first; empty when there are no facts
     */
    public List<Snapshot> reconstruct(Collection<FactRecord> facts) {
        List<TransactionGroup> groups = grouper.group(facts);
        List<Delta> deltas = groups.stream()
            .map(resolver::resolve)
            .toList();
        if (log.isDebugEnabled()) {
            deltas.forEach(d -> log.debug("transaction={} asserted={} retracted={}",
                d.transactionId(), d.assertions().keySet(), d.retractedAttributes()));
        }
        return accumulator.accumulate(deltas);
    }
}
