package com.example.schedule.dto;

import com.example.schedule.model.Slot;
import com.example.schedule.service.util.TimeFormat;

import java.time.LocalDate;

/**
 * Read model of one slot. {@code time} is the HH:MM label, start and end are HH:MM:SS.
 */
public record SlotView(Long id,
                       LocalDate date,
                       String time,
                       String startTime,
                       String endTime,
                       boolean booked,
                       boolean available) {

    public static SlotView from(Slot slot) {
        return new SlotView(
                slot.getId(),
                slot.getDate(),
                TimeFormat.formatShort(slot.getStartTime()),
                TimeFormat.format(slot.getStartTime()),
                TimeFormat.format(slot.getEndTime()),
                slot.isBooked(),
                !slot.isBooked()
        );
    }
}
