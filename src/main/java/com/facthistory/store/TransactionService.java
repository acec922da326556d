package com.facthistory.store;

import com.facthistory.contract.FactContractValidator;
import com.facthistory.contract.FactRecord;
import com.facthistory.contract.FactValue;
import com.facthistory.contract.TransactionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Validated access to the fact store: writes go through the transaction
 * contract, reads are passed through with store failures normalized.
 */
@Service
public class TransactionService {

    private static final Logger log = LoggerFactory.getLogger(TransactionService.class);

    private final FactContractValidator validator;
    private final FactStore factStore;

    public TransactionService(FactContractValidator validator, FactStore factStore) {
        this.validator = validator;
        this.factStore = factStore;
    }

    public TransactionReceipt transact(String entityId, TransactionRequest request) {
        validator.validate(entityId, request);
        TransactionReceipt receipt = factStore.transact(entityId,
            request.assertions(), new LinkedHashSet<>(request.retractions()));
        if (receipt.isEmpty()) {
            log.info("Transaction on entity={} was a no-op", entityId);
        }
        return receipt;
    }

    public Optional<Map<String, FactValue>> currentState(String entityId) {
        try {
            return factStore.queryCurrent(entityId);
        } catch (StoreUnavailableException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new StoreUnavailableException("current state query failed for entity " + entityId, ex);
        }
    }

    /**
     * The entity's raw fact log, ordered by transaction with assertions last in each transaction.
     */
    public List<FactRecord> facts(String entityId) {
        List<FactRecord> facts;
        try {
            facts = factStore.queryHistory(entityId);
        } catch (StoreUnavailableException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new StoreUnavailableException("history query failed for entity " + entityId, ex);
        }
        return facts.stream()
            .sorted(Comparator.comparing(FactRecord::transactionId)
                .thenComparing(FactRecord::attribute)
                .thenComparing(FactRecord::added))
            .toList();
    }
}
