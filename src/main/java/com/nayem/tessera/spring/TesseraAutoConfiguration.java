package com.nayem.tessera.spring;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nayem.tessera.core.BatchEngine;
import com.nayem.tessera.model.InMemoryModelSubstrate;
import com.nayem.tessera.model.ModelSubstrate;
import com.nayem.tessera.operation.BatchCodec;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

/**
 * Registers a started {@link BatchEngine} for the host's {@link ModelSubstrate}.
 * <p>
 * Without a substrate bean an {@link InMemoryModelSubstrate} is used.
 * </p>
 */
@AutoConfiguration
@EnableConfigurationProperties(TesseraProperties.class)
@ConditionalOnProperty(name = "tessera.enabled", havingValue = "true", matchIfMissing = true)
public class TesseraAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TesseraAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public ModelSubstrate tesseraModelSubstrate() {
        log.info("No ModelSubstrate bean found, using an in-memory model");
        return new InMemoryModelSubstrate();
    }

    @Bean
    @ConditionalOnMissingBean
    public BatchCodec tesseraBatchCodec(ObjectProvider<ObjectMapper> objectMapperProvider) {
        ObjectMapper mapper = objectMapperProvider.getIfAvailable();
        return mapper != null ? new BatchCodec(mapper) : new BatchCodec();
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public BatchEngine batchEngine(ModelSubstrate substrate,
            TesseraProperties properties,
            ObjectProvider<MeterRegistry> registryProvider,
            ObjectProvider<Clock> clockProvider) {
        return BatchEngine.builder()
                .substrate(substrate)
                .clock(clockProvider.getIfAvailable(Clock::systemUTC))
                .metrics(registryProvider.getIfAvailable())
                .maxChanges(properties.getMaxChanges())
                .maxSubCommandsPerChunk(properties.getMaxSubCommandsPerChunk())
                .defaultGranularity(properties.getDefaultGranularity())
                .duplicateErrorMode(properties.getDuplicateErrorMode())
                .operationFailurePolicy(properties.getOperationFailurePolicy())
                .postCommitVerification(properties.isPostCommitVerification())
                .maxQueuedJobs(properties.getMaxQueuedJobs())
                .jobTimeout(properties.getJobTimeout())
                .jobRetention(properties.getJobRetention())
                .idempotencyTtl(properties.getIdempotency().getTtl())
                .idempotencyMaxRecords(properties.getIdempotency().getMaxRecords())
                .shutdownTimeout(properties.getShutdownTimeout())
                .shutdownPollingInterval(properties.getShutdownPollingInterval())
                .threadNamePrefix(properties.getThreadNamePrefix())
                .build()
                .start();
    }
}
