package com.facthistory.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Store-issued transaction identifier. Ids are handed out from a single
 * monotonically increasing counter, so ordering by id is also chronological.
 */
public record TransactionId(long value) implements Comparable<TransactionId> {

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static TransactionId of(long value) {
        return new TransactionId(value);
    }

    @JsonValue
    @Override
    public long value() {
        return value;
    }

    @Override
    public int compareTo(TransactionId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
