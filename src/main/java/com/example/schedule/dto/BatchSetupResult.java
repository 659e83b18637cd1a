package com.example.schedule.dto;

import java.time.LocalDate;
import java.util.List;

public record BatchSetupResult(Status status,
                               int existingSlots,
                               int deleted,
                               int inserted,
                               int skipped,
                               List<LocalDate> workingDates) {

    public enum Status { CONFIRMATION_REQUIRED, APPLIED }

    public static BatchSetupResult confirmationRequired(int existingSlots) {
        return new BatchSetupResult(Status.CONFIRMATION_REQUIRED, existingSlots, 0, 0, 0, List.of());
    }

    public static BatchSetupResult applied(int existingSlots, int deleted, int inserted, int skipped,
                                           List<LocalDate> workingDates) {
        return new BatchSetupResult(Status.APPLIED, existingSlots, deleted, inserted, skipped, List.copyOf(workingDates));
    }
}
