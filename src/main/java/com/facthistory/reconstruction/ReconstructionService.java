package com.facthistory.reconstruction;

import com.facthistory.contract.FactRecord;
import com.facthistory.contract.TransactionId;
import com.facthistory.store.FactStore;
import com.facthistory.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Rebuilds entity snapshots from the store's fact history.
 *
 * The history is fetched with one bulk read so that every snapshot is derived
 * from the same view of the log. A failed fetch is reported immediately as
 * {@link StoreUnavailableException}; nothing is retried here.
 */
@Service
public class ReconstructionService {

    private static final Logger log = LoggerFactory.getLogger(ReconstructionService.class);

    private final FactStore factStore;
    private final EntityReconstructor reconstructor;

    public ReconstructionService(FactStore factStore, EntityReconstructor reconstructor) {
        this.factStore = factStore;
        this.reconstructor = reconstructor;
    }

    /**
     * @return the entity's snapshots, oldest first; empty when the entity has no facts
     */
    public List<Snapshot> reconstruct(String entityId) {
        List<FactRecord> facts = fetchHistory(entityId);
        List<Snapshot> snapshots = reconstructor.reconstruct(facts);
        log.info("Reconstructed entity={} from {} facts into {} snapshots",
            entityId, facts.size(), snapshots.size());
        return snapshots;
    }

    /**
     * State of the entity right after the latest transaction at or before {@code asOf}.
     */
    public Optional<Snapshot> snapshotAsOf(String entityId, TransactionId asOf) {
        Snapshot found = null;
        for (Snapshot snapshot : reconstruct(entityId)) {
            if (snapshot.transactionId().compareTo(asOf) > 0) {
                break;
            }
            found = snapshot;
        }
        return Optional.ofNullable(found);
    }

    public Optional<EntityHistory> history(String entityId) {
        List<Snapshot> snapshots = reconstruct(entityId);
        if (snapshots.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new EntityHistory(entityId, snapshots.size(), snapshots));
    }

    private List<FactRecord> fetchHistory(String entityId) {
        try {
            return factStore.queryHistory(entityId);
        } catch (StoreUnavailableException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new StoreUnavailableException("history query failed for entity " + entityId, ex);
        }
    }
}
