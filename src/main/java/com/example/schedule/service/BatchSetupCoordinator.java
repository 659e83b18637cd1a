package com.example.schedule.service;

import com.example.schedule.dto.BatchSetupPreview;
import com.example.schedule.dto.BatchSetupResult;
import com.example.schedule.dto.ClearResult;
import com.example.schedule.dto.QuickSetupRequest;

/**
 * Quick setup: regenerates the slots of the forward setup window in one atomic step.
 */
public interface BatchSetupCoordinator {

    BatchSetupPreview preview(String providerId, QuickSetupRequest request);

    /**
     * Replaces the window's slots. Returns {@code CONFIRMATION_REQUIRED} without changing
     * anything when the window already holds slots and {@code confirmed} is false.
     */
    BatchSetupResult execute(String providerId, QuickSetupRequest request, boolean confirmed);

    /** Removes every slot from today on and turns those days off. */
    ClearResult clear(String providerId);
}
