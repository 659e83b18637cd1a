package com.example.schedule.store;

import com.example.schedule.model.Slot;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;

/**
 * Authoritative slot storage. Implementations re-check the booked flag themselves;
 * a booked slot is never updated or deleted through this interface.
 */
public interface SlotStore {

    Slot create(Slot slot);

    /** Moves an unbooked slot. Fails with a conflict if the slot is booked by now. */
    Slot update(Long slotId, LocalTime startTime, LocalTime endTime);

    void delete(Long slotId);

    /** Deletes the unbooked slots dated {@code from..to} (inclusive). */
    int deleteRange(String providerId, LocalDate from, LocalDate to);

    /** Deletes every unbooked slot dated {@code from} or later. */
    int deleteFrom(String providerId, LocalDate from);

    List<Slot> listByDateRange(String providerId, LocalDate from, LocalDate to);

    Optional<Slot> find(Long slotId);

    /**
     * Deletes the unbooked slots of the range and inserts {@code slots}, all or nothing.
     * A new slot whose start is held by a surviving booked slot is skipped.
     */
    ReplaceResult replaceRange(String providerId, LocalDate from, LocalDate to, List<Slot> slots);

    /** Entry point for the booking lifecycle; not used by the schedule editor. */
    Slot markBooked(Long slotId, boolean booked);

    record ReplaceResult(int deleted, int inserted, int skipped) {
    }
}
