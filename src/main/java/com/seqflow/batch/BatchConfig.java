package com.seqflow.batch;

import com.seqflow.sandbox.ContainerProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class BatchConfig {

    @Bean
    @ConditionalOnProperty(name = "seqflow.batch.backend", havingValue = "docker", matchIfMissing = true)
    public BatchBackend dockerBatchBackend(ContainerProvider containerProvider) {
        return new DockerBatchBackend(containerProvider);
    }
}
