package com.example.schedule.store;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Map;
import java.util.Set;

/**
 * Per-provider map of working days. A date missing from the map is not a working day.
 * Writes touch only the dates they name, so concurrent writes to different dates do not
 * overwrite each other.
 */
public interface WorkingDayStore {

    Map<LocalDate, Boolean> get(String providerId);

    /** Sets the flag of each date in one transaction; other dates are left alone. */
    void setDates(String providerId, Collection<LocalDate> dates, boolean working);

    /** Turns off every date on or after {@code from} except {@code keep}, in one transaction. */
    void clearFrom(String providerId, LocalDate from, Set<LocalDate> keep);
}
