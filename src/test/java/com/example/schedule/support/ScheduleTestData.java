package com.example.schedule.support;

import com.example.schedule.config.ScheduleConfig;
import com.example.schedule.model.Slot;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;

public final class ScheduleTestData {

    public static final String PROVIDER = "provider-1";

    /** Monday 2024-06-10, 09:15 UTC. */
    public static final Instant NOW = Instant.parse("2024-06-10T09:15:00Z");
    public static final LocalDate TODAY = LocalDate.of(2024, 6, 10);

    private ScheduleTestData() {
    }

    public static Clock clock() {
        return Clock.fixed(NOW, ZoneOffset.UTC);
    }

    public static ScheduleConfig config() {
        ScheduleConfig config = new ScheduleConfig();
        config.setDaysPerPage(8);
        config.setMaxPages(3);
        config.setSetupDays(7);
        config.setSingleSlotMinutes(60);
        config.setNextSlotStepMinutes(30);
        config.setPollIntervalMs(5000);
        config.setEditSessionTtlSeconds(300);
        config.setZone("UTC");
        config.setAuthApiUrl("http://auth.test");
        return config;
    }

    public static Slot slot(LocalDate date, String start) {
        LocalTime time = LocalTime.parse(start);
        return Slot.builder()
                .providerId(PROVIDER)
                .date(date)
                .startTime(time)
                .endTime(time.plusHours(1))
                .booked(false)
                .build();
    }

    public static Slot bookedSlot(LocalDate date, String start) {
        Slot slot = slot(date, start);
        slot.setBooked(true);
        return slot;
    }
}
