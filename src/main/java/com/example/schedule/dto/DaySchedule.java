package com.example.schedule.dto;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;

/**
 * A computed day: the working flag comes from the working-day map, never from the slots.
 */
public record DaySchedule(LocalDate date,
                          DayOfWeek dayOfWeek,
                          boolean workingDay,
                          List<SlotView> slots) {

    public DaySchedule {
        slots = List.copyOf(slots);
    }

    public DaySchedule withBookedSlotsOnly() {
        List<SlotView> booked = slots.stream().filter(SlotView::booked).toList();
        return new DaySchedule(date, dayOfWeek, !booked.isEmpty(), booked);
    }
}
