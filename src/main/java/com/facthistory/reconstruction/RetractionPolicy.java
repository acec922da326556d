package com.facthistory.reconstruction;

/**
 * What a snapshot does with an attribute that a transaction retracted without
 * asserting a new value.
 */
public enum RetractionPolicy {
    /** Keep the last asserted value. */
    RETAIN,
    /** Drop the attribute until it is asserted again. */
    REMOVE
}
