package com.facthistory.store;

import com.facthistory.contract.FactRecord;
import com.facthistory.contract.FactValue;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Append-only fact log for entities. Implementations signal an unreachable or
 * failed backend with {@link StoreUnavailableException}.
 */
public interface FactStore {

    /** Attributes under this prefix are store bookkeeping, not entity state. */
    String BOOKKEEPING_PREFIX = "db/";

    /** Bookkeeping attribute carrying the entity id in point-query results. */
    String ENTITY_ID_ATTRIBUTE = BOOKKEEPING_PREFIX + "id";

    /**
     * Atomically applies assertions and retractions to one entity.
     * Asserting over an existing value also records the retraction of the old one.
     */
    TransactionReceipt transact(String entityId, Map<String, FactValue> assertions, Set<String> retractions);

    /** Current state of the entity, or empty when it has never been written. */
    Optional<Map<String, FactValue>> queryCurrent(String entityId);

    /**
     * Every assertion and retraction ever recorded for the entity, in no particular order.
     */
    List<FactRecord> queryHistory(String entityId);
}
