package com.facthistory.reconstruction;

import com.facthistory.contract.FactValue;
import com.facthistory.contract.TransactionId;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Net effect of one transaction on an entity.
 *
 * @param assertions attributes set by the transaction, with their new values
 * @param retractedAttributes attributes retracted without a replacement value
 */
public record Delta(
    TransactionId transactionId,
    Instant txTimestamp,
    Map<String, FactValue> assertions,
    Set<String> retractedAttributes
) {

    public Delta {
        assertions = Collections.unmodifiableMap(new TreeMap<>(assertions));
        retractedAttributes = Collections.unmodifiableSet(new TreeSet<>(retractedAttributes));
    }
}
