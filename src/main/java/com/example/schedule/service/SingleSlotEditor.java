package com.example.schedule.service;

import com.example.schedule.model.Slot;

import java.time.LocalDate;
import java.time.LocalTime;

public interface SingleSlotEditor {

    /**
     * Adds one slot. With {@code time == null} the slot goes 30 minutes after the latest
     * start of the day; the first slot of a day needs an explicit time.
     */
    Slot addSlot(String providerId, LocalDate date, LocalTime time);

    /** Loads a slot that may be edited or deleted: present, owned and not booked. */
    Slot requireEditable(String providerId, Long slotId);

    Slot editSlot(String providerId, Long slotId, LocalTime newTime);

    void deleteSlot(String providerId, Long slotId);

    /** Flips the working flag of the day and returns the new value. */
    boolean toggleDayOff(String providerId, LocalDate date);
}
