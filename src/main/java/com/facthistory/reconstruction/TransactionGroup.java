package com.facthistory.reconstruction;

import com.facthistory.contract.FactRecord;
import com.facthistory.contract.TransactionId;

import java.util.List;

/**
 * All facts of one entity written by a single transaction.
 */
public record TransactionGroup(TransactionId transactionId, List<FactRecord> facts) {

    public TransactionGroup {
        facts = List.copyOf(facts);
    }
}
