package com.example.schedule.service.util;

import com.example.schedule.service.exception.ScheduleValidationException;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a time window and a duration into slot start times. A start is emitted only
 * while {@code start + duration <= to}, so the last slot never ends after {@code to}.
 * A window shorter than one duration yields an empty list.
 */
public final class SlotGenerator {

    private SlotGenerator() {
    }

    public static List<LocalTime> generate(LocalTime from, LocalTime to, int durationMinutes) {
        validate(from, to, durationMinutes);

        int toMinutes = TimeFormat.minutesOfDay(to);
        List<LocalTime> starts = new ArrayList<>();
        for (int current = TimeFormat.minutesOfDay(from); current + durationMinutes <= toMinutes; current += durationMinutes) {
            starts.add(LocalTime.of(current / 60, current % 60));
        }
        return starts;
    }

    /** HH:MM in, HH:MM out. */
    public static List<String> generate(String from, String to, int durationMinutes) {
        return generate(TimeFormat.parse(from), TimeFormat.parse(to), durationMinutes).stream()
                .map(TimeFormat::formatShort)
                .toList();
    }

    public static void validate(LocalTime from, LocalTime to, int durationMinutes) {
        if (from == null || to == null) {
            throw new ScheduleValidationException("Start and end time are required");
        }
        if (TimeFormat.minutesOfDay(from) >= TimeFormat.minutesOfDay(to)) {
            throw new ScheduleValidationException("Start time must be earlier than end time");
        }
        if (durationMinutes <= 0) {
            throw new ScheduleValidationException("Duration must be greater than 0");
        }
    }
}
