package com.example.schedule.config;

import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

@Configuration
@Data
public class ScheduleConfig {

    @Value("${schedule.days-per-page}")
    int daysPerPage;

    @Value("${schedule.max-pages}")
    int maxPages;

    /** Length of the quick setup window, starting today. */
    @Value("${schedule.setup-days}")
    int setupDays;

    @Value("${schedule.single-slot-minutes}")
    int singleSlotMinutes;

    @Value("${schedule.next-slot-step-minutes}")
    int nextSlotStepMinutes;

    @Value("${schedule.poll-interval-ms}")
    long pollIntervalMs;

    @Value("${schedule.edit-session-ttl-seconds}")
    long editSessionTtlSeconds;

    /** Provider-local zone; "today" and "now" are computed in it. */
    @Value("${schedule.zone}")
    String zone;

    /** Shared secret external booking systems send with slot change notifications. */
    @Value("${schedule.webhook-secret}")
    String webhookSecret;

    @Value("${auth.api.base-url}")
    String authApiUrl;
}
