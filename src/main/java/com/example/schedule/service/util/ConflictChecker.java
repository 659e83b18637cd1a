package com.example.schedule.service.util;

import com.example.schedule.model.Slot;

import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.Objects;

public final class ConflictChecker {

    private ConflictChecker() {
    }

    /**
     * True if another slot of the day starts at the same HH:MM. Seconds are ignored on
     * both sides; {@code excludeId} is the slot being edited, or null.
     */
    public static boolean isDuplicate(Collection<Slot> daySlots, LocalTime time, Long excludeId) {
        LocalTime wanted = time.truncatedTo(ChronoUnit.MINUTES);
        return daySlots.stream()
                .filter(slot -> !Objects.equals(slot.getId(), excludeId))
                .anyMatch(slot -> slot.getStartTime().truncatedTo(ChronoUnit.MINUTES).equals(wanted));
    }

    public static boolean isDuplicate(Collection<Slot> daySlots, String time, Long excludeId) {
        return isDuplicate(daySlots, TimeFormat.parse(time), excludeId);
    }
}
