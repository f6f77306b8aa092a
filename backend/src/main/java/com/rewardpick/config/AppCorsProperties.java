package com.rewardpick.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Browser access for the wallet front end. The admin key header is always allowed so that the
 * refresh console can call {@code /api/catalog/sync/*}.
 */
@ConfigurationProperties(prefix = "app.cors")
public record AppCorsProperties(
    List<String> allowedOrigins,
    List<String> allowedMethods,
    Duration maxAge
) {

    static final List<String> DEFAULT_ORIGINS = List.of("http://localhost:5173");
    static final List<String> DEFAULT_METHODS = List.of("GET", "POST", "DELETE", "OPTIONS");
    static final Duration DEFAULT_MAX_AGE = Duration.ofMinutes(30);

    public List<String> originsOrDefault() {
        return allowedOrigins == null || allowedOrigins.isEmpty() ? DEFAULT_ORIGINS : allowedOrigins;
    }

    public List<String> methodsOrDefault() {
        return allowedMethods == null || allowedMethods.isEmpty() ? DEFAULT_METHODS : allowedMethods;
    }

    public Duration maxAgeOrDefault() {
        return maxAge == null || maxAge.isNegative() ? DEFAULT_MAX_AGE : maxAge;
    }
}
