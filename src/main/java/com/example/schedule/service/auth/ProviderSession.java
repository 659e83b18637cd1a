package com.example.schedule.service.auth;

import java.time.Instant;

/**
 * A verified provider session. {@code expiresAt} is null when the verifier did not
 * report an expiry.
 */
public record ProviderSession(String providerId, Instant expiresAt) {

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
