package com.facthistory.store;

import com.facthistory.contract.FactRecord;
import com.facthistory.contract.FactValue;
import com.facthistory.contract.TransactionId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process fact store. Writes are serialized; each history read is a copy of
 * the log taken at one point in time.
 */
public class InMemoryFactStore implements FactStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryFactStore.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<FactRecord>> logs = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Map<String, FactValue>> current = new ConcurrentHashMap<>();
    private final AtomicLong transactionSequence;
    private final Clock clock;

    public InMemoryFactStore() {
        this(1L, Clock.systemUTC());
    }

    public InMemoryFactStore(long initialTransactionId, Clock clock) {
        this.transactionSequence = new AtomicLong(initialTransactionId - 1);
        this.clock = clock;
    }

    @Override
    public synchronized TransactionReceipt transact(String entityId,
                                                    Map<String, FactValue> assertions,
                                                    Set<String> retractions) {
        Map<String, FactValue> before = current.getOrDefault(entityId, Map.of());
        Map<String, FactValue> after = new LinkedHashMap<>(before);
        Instant txTimestamp = clock.instant();

        // Ids are only consumed by transactions that record something.
        long tx = transactionSequence.get() + 1;
        TransactionId transactionId = new TransactionId(tx);
        List<FactRecord> facts = new ArrayList<>();

        // sorted so the fact order of a transaction is stable
        for (String attribute : new TreeSet<>(assertions.keySet())) {
            FactValue value = assertions.get(attribute);
            FactValue previous = before.get(attribute);
            if (value.equals(previous)) {
                continue;
            }
            if (previous != null) {
                facts.add(new FactRecord(transactionId, attribute, previous, false, txTimestamp));
            }
            facts.add(new FactRecord(transactionId, attribute, value, true, txTimestamp));
            after.put(attribute, value);
        }

        for (String attribute : new TreeSet<>(retractions)) {
            if (assertions.containsKey(attribute)) {
                throw new IllegalArgumentException(
                    "attribute cannot be asserted and retracted in one transaction: " + attribute);
            }
            FactValue previous = before.get(attribute);
            if (previous == null) {
                continue;
            }
            facts.add(new FactRecord(transactionId, attribute, previous, false, txTimestamp));
            after.remove(attribute);
        }

        if (facts.isEmpty()) {
            log.debug("Transaction on entity={} changed nothing; not recorded", entityId);
            return new TransactionReceipt(entityId, null, txTimestamp, List.of());
        }

        transactionSequence.set(tx);
        logs.computeIfAbsent(entityId, id -> new CopyOnWriteArrayList<>()).addAll(facts);
        current.put(entityId, Collections.unmodifiableMap(after));
        log.info("Recorded transaction={} on entity={} with {} facts", tx, entityId, facts.size());
        return new TransactionReceipt(entityId, transactionId, txTimestamp, List.copyOf(facts));
    }

    @Override
    public synchronized Optional<Map<String, FactValue>> queryCurrent(String entityId) {
        if (!logs.containsKey(entityId)) {
            return Optional.empty();
        }
        Map<String, FactValue> state = new LinkedHashMap<>();
        state.put(ENTITY_ID_ATTRIBUTE, new FactValue.StringValue(entityId));
        state.putAll(current.getOrDefault(entityId, Map.of()));
        return Optional.of(state);
    }

    @Override
    public List<FactRecord> queryHistory(String entityId) {
        CopyOnWriteArrayList<FactRecord> entityLog = logs.get(entityId);
        if (entityLog == null) {
            return Collections.emptyList();
        }
        return new ArrayList<>(entityLog);
    }

    public long getLatestTransactionId() {
        return transactionSequence.get();
    }
}
