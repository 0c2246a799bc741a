package com.example.allocation.config;

import com.example.allocation.exception.FeatureExtractionException;
import com.example.allocation.service.port.AllocationPublisher;
import com.example.allocation.service.port.FeatureExtractionClient;
import com.example.allocation.service.port.InMemoryRoundRepository;
import com.example.allocation.service.port.LoggingAllocationPublisher;
import com.example.allocation.service.port.RoundRepository;
import com.example.allocation.service.port.UnconfiguredFeatureExtractionClient;
import com.example.allocation.thread.MdcAwareExecutor;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Infrastructure for allocation rounds: worker pools, the retry policy around feature
 * extraction, and default implementations of the outbound ports. Any port can be replaced by
 * declaring a bean of the same type.
 */
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(AllocationProperties.class)
public class AllocationConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AllocationConfiguration.class);

    @Bean(destroyMethod = "shutdown")
    public MdcAwareExecutor scoringExecutor(AllocationProperties properties) {
        int parallelism = Math.max(1, properties.getScoring().getParallelism());
        log.info("Pair scoring pool: {} threads", parallelism);
        return new MdcAwareExecutor("alloc-score", parallelism);
    }

    /** Single thread: submitted rounds run one at a time behind the round lock anyway. */
    @Bean(destroyMethod = "shutdown")
    public MdcAwareExecutor roundExecutor() {
        return new MdcAwareExecutor("alloc-round", 1);
    }

    @Bean
    public Retry featureExtractionRetry(AllocationProperties properties) {
        AllocationProperties.Extraction extraction = properties.getExtraction();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, extraction.getMaxAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        extraction.getInitialBackoff(), extraction.getBackoffMultiplier()))
                .retryExceptions(FeatureExtractionException.class)
                .build();
        Retry retry = Retry.of("feature-extraction", config);
        retry.getEventPublisher().onRetry(event ->
                log.warn("Feature extraction retry #{} after: {}", event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() == null ? "?" : event.getLastThrowable().getMessage()));
        return retry;
    }

    @Bean
    @ConditionalOnMissingBean
    public FeatureExtractionClient featureExtractionClient() {
        return new UnconfiguredFeatureExtractionClient();
    }

    @Bean
    @ConditionalOnMissingBean
    public RoundRepository roundRepository() {
        return new InMemoryRoundRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public AllocationPublisher allocationPublisher() {
        return new LoggingAllocationPublisher();
    }
}
