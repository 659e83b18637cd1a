package com.example.schedule.controllers;

import com.example.schedule.config.ScheduleConfig;
import com.example.schedule.dto.SlotChange;
import com.example.schedule.service.exception.SessionAuthException;
import com.example.schedule.store.ChangeNotificationChannel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Inbound side of the booking lifecycle: external systems report slot changes here.
 * Callers authenticate with the shared webhook secret.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class SlotChangeController {

    static final String SECRET_HEADER = "X-Webhook-Secret";

    private final ChangeNotificationChannel channel;
    private final ScheduleConfig config;

    @PostMapping("/providers/{providerId}/slot-changes")
    public ResponseEntity<Void> slotChanged(@RequestHeader(value = SECRET_HEADER, required = false) String secret,
                                            @PathVariable String providerId,
                                            @RequestBody SlotChangeRequest request) {
        requireSecret(secret);
        log.debug("Slot change from outside: provider={}, slot={}, type={}", providerId, request.slotId(), request.type());
        channel.publish(new SlotChange(providerId, request.slotId(), request.type()));
        return ResponseEntity.accepted().build();
    }

    private void requireSecret(String secret) {
        String expected = config.getWebhookSecret();
        if (secret == null || expected == null || expected.isBlank()
                || !MessageDigest.isEqual(secret.getBytes(StandardCharsets.UTF_8), expected.getBytes(StandardCharsets.UTF_8))) {
            log.warn("Rejected slot change notification with missing or wrong secret");
            throw new SessionAuthException("Invalid webhook secret");
        }
    }

    public record SlotChangeRequest(Long slotId, SlotChange.ChangeType type) {}
}
