package com.example.schedule.service.sync;

import java.time.Instant;

/**
 * Token for the single slot edit in progress. While it is held, polling and push
 * refreshes are skipped for the provider.
 */
public record EditSession(String token,
                          String providerId,
                          Long slotId,
                          Instant openedAt,
                          Instant expiresAt) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
