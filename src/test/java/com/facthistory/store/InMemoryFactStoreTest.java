package com.facthistory.store;

import com.facthistory.contract.FactRecord;
import com.facthistory.contract.FactValue;
import com.facthistory.contract.TransactionId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryFactStoreTest {

    private static final Instant NOW = Instant.parse("2018-06-29T12:12:14.728Z");

    private InMemoryFactStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryFactStore(100, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void firstWrite_onlyAsserts() {
        TransactionReceipt receipt = store.transact("ORD-1",
            Map.of("order/operator", FactValue.of("A"), "order/action", FactValue.of("create")), Set.of());

        assertEquals(new TransactionId(100), receipt.transactionId());
        assertEquals(NOW, receipt.txTimestamp());
        assertEquals(2, receipt.facts().size());
        assertTrue(receipt.facts().stream().allMatch(FactRecord::added));
        assertTrue(receipt.facts().stream().allMatch(f -> NOW.equals(f.txTimestamp())));
    }

    @Test
    void overwrite_retractsOldValueInSameTransaction() {
        store.transact("ORD-1", Map.of("order/operator", FactValue.of("A")), Set.of());
        TransactionReceipt receipt = store.transact("ORD-1", Map.of("order/operator", FactValue.of("B")), Set.of());

        assertEquals(List.of(
            new FactRecord(new TransactionId(101), "order/operator", FactValue.of("A"), false, NOW),
            new FactRecord(new TransactionId(101), "order/operator", FactValue.of("B"), true, NOW)),
            receipt.facts());
        assertEquals(3, store.queryHistory("ORD-1").size());
    }

    @Test
    void assertingCurrentValue_recordsNothing() {
        store.transact("ORD-1", Map.of("order/operator", FactValue.of("A")), Set.of());
        TransactionReceipt receipt = store.transact("ORD-1", Map.of("order/operator", FactValue.of("A")), Set.of());

        assertTrue(receipt.isEmpty());
        assertNull(receipt.transactionId());
        assertEquals(100, store.getLatestTransactionId());
        assertEquals(1, store.queryHistory("ORD-1").size());
    }

    @Test
    void retraction_removesAttributeFromCurrentState() {
        store.transact("ORD-1", Map.of("order/location", FactValue.of("dock 4")), Set.of());
        TransactionReceipt receipt = store.transact("ORD-1", Map.of(), Set.of("order/location", "order/unknown"));

        assertEquals(1, receipt.facts().size());
        assertFalse(receipt.facts().get(0).added());
        assertFalse(store.queryCurrent("ORD-1").orElseThrow().containsKey("order/location"));
    }

    @Test
    void assertAndRetractSameAttribute_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> store.transact("ORD-1",
            Map.of("order/location", FactValue.of("dock 4")), Set.of("order/location")));
        assertTrue(store.queryHistory("ORD-1").isEmpty());
    }

    @Test
    void queryCurrent_includesBookkeepingId() {
        store.transact("ORD-1", Map.of("order/action", FactValue.of("create")), Set.of());

        Map<String, FactValue> current = store.queryCurrent("ORD-1").orElseThrow();
        assertEquals(FactValue.of("ORD-1"), current.get(FactStore.ENTITY_ID_ATTRIBUTE));
        assertEquals(FactValue.of("create"), current.get("order/action"));
    }

    @Test
    void unknownEntity_hasNoStateAndNoHistory() {
        assertTrue(store.queryCurrent("missing").isEmpty());
        assertTrue(store.queryHistory("missing").isEmpty());
    }

    @Test
    void transactionIds_areSharedAcrossEntities() {
        TransactionReceipt first = store.transact("ORD-1", Map.of("order/action", FactValue.of("create")), Set.of());
        TransactionReceipt second = store.transact("ORD-2", Map.of("order/action", FactValue.of("create")), Set.of());

        assertTrue(second.transactionId().compareTo(first.transactionId()) > 0);
    }
}
