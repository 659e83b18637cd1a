package com.example.schedule.service.auth;

import com.example.schedule.service.exception.SessionAuthException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
@RequiredArgsConstructor
public class SessionGuard {

    private final Clock clock;

    /** Returns the provider of a live session. */
    public String requireProvider(ProviderSession session) {
        if (session == null || session.providerId() == null || session.providerId().isBlank()) {
            throw new SessionAuthException("Please login to manage your schedule");
        }
        if (session.isExpired(clock.instant())) {
            throw new SessionAuthException("Session expired. Please login again.");
        }
        return session.providerId();
    }
}
