package com.facthistory.reconstruction;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ReconstructionConfiguration {

    @Bean
    public EntityReconstructor entityReconstructor(
            @Value("${facthistory.reconstruction.retraction-policy:RETAIN}") RetractionPolicy retractionPolicy) {
        return new EntityReconstructor(retractionPolicy);
    }
}
