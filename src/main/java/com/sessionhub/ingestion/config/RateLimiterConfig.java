package com.sessionhub.ingestion.config;

import com.google.common.util.concurrent.RateLimiter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RateLimiterConfig {

    @Value("${app.drive.rate-limit:5.0}") // permits per second, 0 disables
    private double driveRateLimit;

    @Bean("driveRateLimiter")
    @SuppressWarnings("UnstableApiUsage")
    public RateLimiter driveRateLimiter() {
        double effectiveQps = driveRateLimit > 0 ? driveRateLimit : Double.MAX_VALUE;
        return RateLimiter.create(effectiveQps);
    }
}
