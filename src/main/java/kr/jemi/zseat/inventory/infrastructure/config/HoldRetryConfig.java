package kr.jemi.zseat.inventory.infrastructure.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import kr.jemi.zseat.inventory.domain.exception.StorageConflictException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class HoldRetryConfig {

    @Bean
    public Retry holdAcquisitionRetry(@Value("${zseat.hold.retry.max-attempts}") int maxAttempts,
                                      @Value("${zseat.hold.retry.initial-backoff}") Duration initialBackoff,
                                      @Value("${zseat.hold.retry.multiplier}") double multiplier) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoff, multiplier))
                .retryExceptions(StorageConflictException.class)
                .build();
        return Retry.of("holdAcquisition", config);
    }
}
