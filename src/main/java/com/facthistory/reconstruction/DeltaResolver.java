package com.facthistory.reconstruction;

import com.facthistory.contract.FactRecord;
import com.facthistory.contract.FactValue;

import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Collapses one transaction's assertions and retractions into the values the
 * transaction left behind. Retractions are trusted to match a prior value; they
 * only matter for attributes the transaction did not assert again.
 */
public class DeltaResolver {

    public Delta resolve(TransactionGroup group) {
        Map<String, FactValue> assertions = new HashMap<>();
        Set<String> retracted = new HashSet<>();
        Instant txTimestamp = null;

        for (FactRecord fact : group.facts()) {
            if (!fact.transactionId().equals(group.transactionId())) {
                throw new MalformedFactGroupException(group.transactionId(), fact.attribute(),
                    "fact belongs to transaction " + fact.transactionId());
            }
            if (txTimestamp == null) {
                txTimestamp = fact.txTimestamp();
            }

            if (fact.added()) {
                FactValue existing = assertions.putIfAbsent(fact.attribute(), fact.value());
                if (existing != null) {
                    throw new MalformedFactGroupException(group.transactionId(), fact.attribute(),
                        "more than one asserted value (" + existing.raw() + ", " + fact.value().raw() + ")");
                }
            } else {
                retracted.add(fact.attribute());
            }
        }

        retracted.removeAll(assertions.keySet());
        return new Delta(group.transactionId(), txTimestamp, assertions, retracted);
    }
}
