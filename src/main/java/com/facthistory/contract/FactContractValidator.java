package com.facthistory.contract;

import com.facthistory.store.FactStore;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

@Component
public class FactContractValidator {

    private static final Pattern ATTRIBUTE = Pattern.compile("^[A-Za-z][A-Za-z0-9_.-]*/[A-Za-z][A-Za-z0-9_.-]*$");

    public void validate(String entityId, TransactionRequest request) {
        requireString(entityId, "entity_id is required");
        requireNonNull(request, "transaction request cannot be null");

        if (request.assertions().isEmpty() && request.retractions().isEmpty()) {
            throw new ContractViolationException("transaction must assert or retract at least one attribute");
        }

        for (Map.Entry<String, FactValue> entry : request.assertions().entrySet()) {
            validateAttribute(entry.getKey());
            if (entry.getValue() == null) {
                throw new ContractViolationException("value for " + entry.getKey() + " is required");
            }
        }

        Set<String> retracted = new HashSet<>();
        for (String attribute : request.retractions()) {
            validateAttribute(attribute);
            if (!retracted.add(attribute)) {
                throw new ContractViolationException("attribute retracted twice: " + attribute);
            }
            if (request.assertions().containsKey(attribute)) {
                throw new ContractViolationException(
                    "attribute cannot be asserted and retracted in one transaction: " + attribute);
            }
        }
    }

    private void validateAttribute(String attribute) {
        requireString(attribute, "attribute name is required");
        if (!ATTRIBUTE.matcher(attribute).matches()) {
            throw new ContractViolationException(
                "attribute must be namespaced like order/operator: " + attribute);
        }
        if (attribute.startsWith(FactStore.BOOKKEEPING_PREFIX)) {
            throw new ContractViolationException("attribute is reserved for the store: " + attribute);
        }
    }

    private void requireNonNull(Object value, String message) {
        if (value == null) {
            throw new ContractViolationException(message);
        }
    }

    private void requireString(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new ContractViolationException(message);
        }
    }
}
