package com.facthistory.contract;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FactContractValidatorTest {

    private FactContractValidator validator;

    @BeforeEach
    void setUp() {
        validator = new FactContractValidator();
    }

    @Test
    void validRequest_passes() {
        TransactionRequest request = new TransactionRequest(
            Map.of("order/operator", FactValue.of("B")), List.of("order/location"));
        assertDoesNotThrow(() -> validator.validate("ORD-1", request));
    }

    @Test
    void emptyRequest_isRejected() {
        ContractViolationException ex = assertThrows(ContractViolationException.class,
            () -> validator.validate("ORD-1", new TransactionRequest(null, null)));
        assertTrue(ex.getMessage().contains("at least one"));
    }

    @Test
    void blankEntityId_isRejected() {
        TransactionRequest request = new TransactionRequest(Map.of("order/operator", FactValue.of("B")), null);
        assertThrows(ContractViolationException.class, () -> validator.validate(" ", request));
    }

    @Nested
    @DisplayName("Attribute names")
    class AttributeNames {

        @Test
        void unqualifiedName_isRejected() {
            TransactionRequest request = new TransactionRequest(Map.of("operator", FactValue.of("B")), null);
            ContractViolationException ex = assertThrows(ContractViolationException.class,
                () -> validator.validate("ORD-1", request));
            assertTrue(ex.getMessage().contains("namespaced"));
        }

        @Test
        void bookkeepingNamespace_isReserved() {
            TransactionRequest request = new TransactionRequest(Map.of("db/id", FactValue.of("x")), null);
            ContractViolationException ex = assertThrows(ContractViolationException.class,
                () -> validator.validate("ORD-1", request));
            assertTrue(ex.getMessage().contains("reserved"));
        }

        @Test
        void retractedAttribute_isCheckedToo() {
            TransactionRequest request = new TransactionRequest(null, List.of("bad name"));
            assertThrows(ContractViolationException.class, () -> validator.validate("ORD-1", request));
        }
    }

    @Nested
    @DisplayName("Assert/retract combinations")
    class Combinations {

        @Test
        void sameAttributeAssertedAndRetracted_isRejected() {
            TransactionRequest request = new TransactionRequest(
                Map.of("order/location", FactValue.of("dock 4")), List.of("order/location"));
            assertThrows(ContractViolationException.class, () -> validator.validate("ORD-1", request));
        }

        @Test
        void duplicateRetraction_isRejected() {
            TransactionRequest request = new TransactionRequest(null, List.of("order/location", "order/location"));
            assertThrows(ContractViolationException.class, () -> validator.validate("ORD-1", request));
        }

        @Test
        void nullValue_isRejected() {
            Map<String, FactValue> assertions = new HashMap<>();
            assertions.put("order/operator", null);
            TransactionRequest request = new TransactionRequest(assertions, null);
            assertThrows(ContractViolationException.class, () -> validator.validate("ORD-1", request));
        }
    }
}
