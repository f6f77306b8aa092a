package com.rewardpick.auth.security;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param apiKey shared secret expected in the {@code X-Admin-Key} header; admin endpoints stay
 *               closed while it is blank
 */
@ConfigurationProperties(prefix = "app.admin")
public record AdminProperties(String apiKey) {
}
