package com.example.schedule.service;

import com.example.schedule.dto.BatchSetupPreview;
import com.example.schedule.dto.BatchSetupResult;
import com.example.schedule.dto.ClearResult;
import com.example.schedule.dto.QuickSetupRequest;
import com.example.schedule.dto.ScheduleView;
import com.example.schedule.dto.SlotView;
import com.example.schedule.service.auth.ProviderSession;
import com.example.schedule.service.auth.SessionGuard;
import com.example.schedule.service.sync.EditSession;
import com.example.schedule.service.sync.SyncController;
import com.example.schedule.service.util.TimeFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Entry point of the schedule editor. Every call checks the provider session first;
 * every mutation runs through {@link SyncController} so it is followed by one reload.
 */
@Slf4j
@Service
public class ScheduleService {

    private final SessionGuard sessionGuard;
    private final CalendarWindowing calendar;
    private final SingleSlotEditor slotEditor;
    private final BatchSetupCoordinator batchSetup;
    private final ProviderVisibilityService visibility;
    private final SyncController sync;
    private final Executor executor;

    public ScheduleService(SessionGuard sessionGuard,
                           CalendarWindowing calendar,
                           SingleSlotEditor slotEditor,
                           BatchSetupCoordinator batchSetup,
                           ProviderVisibilityService visibility,
                           SyncController sync,
                           @Qualifier("scheduleExecutor") Executor executor) {
        this.sessionGuard = sessionGuard;
        this.calendar = calendar;
        this.slotEditor = slotEditor;
        this.batchSetup = batchSetup;
        this.visibility = visibility;
        this.sync = sync;
        this.executor = executor;
    }

    /** Observes the provider's schedule at {@code pageIndex} and returns the loaded page. */
    public CompletableFuture<ScheduleView> openSchedule(ProviderSession session, int pageIndex) {
        String providerId = sessionGuard.requireProvider(session);
        calendar.requirePage(pageIndex);
        return sync.observe(providerId, pageIndex);
    }

    /** Last view of the provider's observed page, including local optimistic changes. */
    public Optional<ScheduleView> currentSchedule(ProviderSession session) {
        return sync.currentView(sessionGuard.requireProvider(session));
    }

    /** Ends observation; an open edit session of the provider is dropped. */
    public void closeSchedule(ProviderSession session) {
        sync.stop(sessionGuard.requireProvider(session));
    }

    public boolean toggleDayOff(ProviderSession session, LocalDate date) {
        String providerId = sessionGuard.requireProvider(session);
        return sync.runMutation(providerId, "Toggle " + date,
                () -> slotEditor.toggleDayOff(providerId, date));
    }

    /** {@code time} may be blank to place the slot after the latest one of the day. */
    public SlotView addSlot(ProviderSession session, LocalDate date, String time) {
        String providerId = sessionGuard.requireProvider(session);
        return sync.runMutation(providerId, "Add slot on " + date, () -> {
            LocalTime start = time == null || time.isBlank() ? null : TimeFormat.parse(time);
            return SlotView.from(slotEditor.addSlot(providerId, date, start));
        });
    }

    public EditSession startEdit(ProviderSession session, Long slotId) {
        String providerId = sessionGuard.requireProvider(session);
        slotEditor.requireEditable(providerId, slotId);
        return sync.openEditSession(providerId, slotId);
    }

    /** Saves the edit. The session ends either way; a failed save needs a new edit. */
    public SlotView saveEdit(ProviderSession session, String token, String time) {
        String providerId = sessionGuard.requireProvider(session);
        EditSession edit = sync.requireSession(providerId, token);
        try {
            return sync.runMutation(providerId, "Edit slot " + edit.slotId(),
                    () -> SlotView.from(slotEditor.editSlot(providerId, edit.slotId(), TimeFormat.parse(time))));
        } finally {
            sync.releaseSession(edit);
        }
    }

    public void cancelEdit(ProviderSession session, String token) {
        String providerId = sessionGuard.requireProvider(session);
        sync.cancelSession(sync.requireSession(providerId, token));
    }

    public void deleteSlot(ProviderSession session, Long slotId) {
        String providerId = sessionGuard.requireProvider(session);
        sync.runMutation(providerId, "Delete slot " + slotId, () -> {
            slotEditor.deleteSlot(providerId, slotId);
            return slotId;
        });
    }

    public CompletableFuture<BatchSetupPreview> previewQuickSetup(ProviderSession session, QuickSetupRequest request) {
        String providerId = sessionGuard.requireProvider(session);
        return CompletableFuture.supplyAsync(() -> batchSetup.preview(providerId, request), executor);
    }

    public CompletableFuture<BatchSetupResult> quickSetup(ProviderSession session, QuickSetupRequest request,
                                                          boolean confirmed) {
        String providerId = sessionGuard.requireProvider(session);
        return CompletableFuture.supplyAsync(() -> sync.runMutation(providerId, "Quick setup",
                () -> batchSetup.execute(providerId, request, confirmed)), executor);
    }

    public CompletableFuture<ClearResult> clearQuickSetup(ProviderSession session) {
        String providerId = sessionGuard.requireProvider(session);
        sync.applyOptimisticClear(providerId, calendar.today());
        return CompletableFuture.supplyAsync(() -> sync.runMutation(providerId, "Clear schedule",
                () -> batchSetup.clear(providerId)), executor);
    }

    public boolean isVisible(ProviderSession session) {
        return visibility.isVisible(sessionGuard.requireProvider(session));
    }

    public boolean setVisible(ProviderSession session, boolean visible) {
        return visibility.setVisible(sessionGuard.requireProvider(session), visible);
    }
}
