package com.facthistory.reconstruction;

import com.facthistory.contract.FactRecord;
import com.facthistory.contract.TransactionId;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Splits an entity's facts into one group per transaction, oldest first.
 * The result never depends on the order in which the store returned the facts.
 */
public class TransactionGrouper {

    public List<TransactionGroup> group(Collection<FactRecord> facts) {
        Map<TransactionId, List<FactRecord>> byTransaction = new TreeMap<>();
        for (FactRecord fact : facts) {
            if (fact == null) {
                throw new IllegalArgumentException("fact stream contains a null record");
            }
            byTransaction.computeIfAbsent(fact.transactionId(), tx -> new ArrayList<>()).add(fact);
        }

        List<TransactionGroup> groups = new ArrayList<>(byTransaction.size());
        byTransaction.forEach((tx, groupFacts) -> groups.add(new TransactionGroup(tx, groupFacts)));
        return groups;
    }
}
