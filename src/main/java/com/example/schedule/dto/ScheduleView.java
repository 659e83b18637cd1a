package com.example.schedule.dto;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public record ScheduleView(String providerId, int pageIndex, List<DaySchedule> days) {

    public ScheduleView {
        days = List.copyOf(days);
    }

    public Optional<DaySchedule> day(LocalDate date) {
        return days.stream().filter(d -> d.date().equals(date)).findFirst();
    }

    /**
     * Local rendering of a clear: from {@code from} onwards only booked slots remain.
     * Never stored; replaced by the next authoritative load.
     */
    public ScheduleView clearedFrom(LocalDate from) {
        List<DaySchedule> cleared = days.stream()
                .map(d -> d.date().isBefore(from) ? d : d.withBookedSlotsOnly())
                .toList();
        return new ScheduleView(providerId, pageIndex, cleared);
    }
}
