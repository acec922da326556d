package com.facthistory.store;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class StoreConfiguration {

    @Bean
    public InMemoryFactStore factStore(
            @Value("${facthistory.store.initial-transaction-id:13194139534312}") long initialTransactionId) {
        return new InMemoryFactStore(initialTransactionId, Clock.systemUTC());
    }
}
