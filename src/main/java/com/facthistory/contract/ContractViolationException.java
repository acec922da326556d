package com.facthistory.contract;

/**
 * Thrown when a write request does not satisfy the transaction contract.
 */
public class ContractViolationException extends RuntimeException {

    public ContractViolationException(String message) {
        super(message);
    }
}
