package com.facthistory.reconstruction;

import com.facthistory.contract.TransactionId;

/**
 * A transaction group breaks the one-assertion-per-attribute rule. This points
 * at a corrupt log, never at a transient condition.
 */
public class MalformedFactGroupException extends RuntimeException {

    private final TransactionId transactionId;
    private final String attribute;

    public MalformedFactGroupException(TransactionId transactionId, String attribute, String message) {
        super("transaction " + transactionId + ", attribute " + attribute + ": " + message);
        this.transactionId = transactionId;
        this.attribute = attribute;
    }

    public TransactionId getTransactionId() {
        return transactionId;
    }

    public String getAttribute() {
        return attribute;
    }
}
