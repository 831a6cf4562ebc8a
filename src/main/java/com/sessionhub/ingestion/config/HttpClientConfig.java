package com.sessionhub.ingestion.config;

import com.sessionhub.ingestion.service.AcquisitionStrategyException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class HttpClientConfig {

    @Value("${app.http.connect-timeout-seconds:10}")
    private long connectTimeoutSeconds;

    @Value("${app.http.read-timeout-seconds:60}")
    private long readTimeoutSeconds;

    @Value("${app.http.retry.max-attempts:3}")
    private int maxAttempts;

    @Value("${app.http.retry.initial-backoff-ms:1000}")
    private long initialBackoffMs;

    /**
     * Generic client for plain HTTP asset downloads.
     */
    @Bean
    @Primary
    public RestTemplate assetRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(connectTimeoutSeconds))
                .setReadTimeout(Duration.ofSeconds(readTimeoutSeconds))
                .build();
    }

    /**
     * Client for the structured store REST API.
     */
    @Bean
    @Qualifier("driveRestTemplate")
    public RestTemplate driveRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(connectTimeoutSeconds))
                .setReadTimeout(Duration.ofSeconds(readTimeoutSeconds))
                .build();
    }

    /**
     * Exponential backoff with jitter shared by the plain HTTP strategies. Missing files and
     * unusable responses are not retried.
     */
    @Bean("assetDownloadRetry")
    public Retry assetDownloadRetry() {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, maxAttempts))
                .intervalFunction(IntervalFunction.ofExponentialRandomBackoff(
                        Math.max(1L, initialBackoffMs), 2.0, 0.5))
                .retryExceptions(Exception.class)
                .ignoreExceptions(HttpClientErrorException.NotFound.class, AcquisitionStrategyException.class)
                .build();
        return Retry.of("asset-download", config);
    }
}
