package com.example.schedule.service.sync;

import com.example.schedule.dto.ScheduleView;
import com.example.schedule.service.ScheduleViewService;
import com.example.schedule.store.ChangeNotificationChannel;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Sync state of one provider: its observed page, edit session, views, poll task, push
 * subscription and its own reconciliation loop. Nothing here is shared between providers.
 */
@Slf4j
class ProviderSync {

    private final String providerId;
    private final ScheduleViewService viewService;
    private final Executor executor;

    private final AtomicReference<EditSession> openSession = new AtomicReference<>();
    private final AtomicReference<ScheduleView> currentView = new AtomicReference<>();
    private final AtomicReference<ScheduleView> authoritativeView = new AtomicReference<>();
    private final AtomicBoolean inFlight = new AtomicBoolean();
    private final AtomicBoolean rerun = new AtomicBoolean();
    private final AtomicBoolean foregroundPending = new AtomicBoolean();
    private final Queue<CompletableFuture<ScheduleView>> waiters = new ConcurrentLinkedQueue<>();

    private volatile boolean observing;
    private volatile int pageIndex;

    // guarded by this
    private ScheduledFuture<?> pollTask;
    private ChangeNotificationChannel.Subscription subscription;

    ProviderSync(String providerId, ScheduleViewService viewService, Executor executor) {
        this.providerId = providerId;
        this.viewService = viewService;
        this.executor = executor;
    }

    String providerId() {
        return providerId;
    }

    boolean isObserving() {
        return observing;
    }

    synchronized void startObserving(int pageIndex, ScheduledFuture<?> pollTask,
                                     ChangeNotificationChannel.Subscription subscription) {
        this.pageIndex = pageIndex;
        this.pollTask = pollTask;
        this.subscription = subscription;
        this.observing = true;
    }

    void setPage(int pageIndex) {
        this.pageIndex = pageIndex;
    }

    /** Cancels the poll and returns the push subscription to close, if any. */
    synchronized Optional<ChangeNotificationChannel.Subscription> stopObserving() {
        observing = false;
        if (pollTask != null) {
            pollTask.cancel(false);
            pollTask = null;
        }
        ChangeNotificationChannel.Subscription closed = subscription;
        subscription = null;
        EditSession session = openSession.getAndSet(null);
        if (session != null) {
            log.info("Dropping edit session {} of provider {}", session.token(), providerId);
        }
        currentView.set(null);
        authoritativeView.set(null);
        return Optional.ofNullable(closed);
    }

    Optional<ScheduleView> currentView() {
        return Optional.ofNullable(currentView.get());
    }

    Optional<EditSession> openSession() {
        return Optional.ofNullable(openSession.get());
    }

    boolean tryOpen(EditSession session) {
        return openSession.compareAndSet(null, session);
    }

    boolean release(EditSession session) {
        return openSession.compareAndSet(session, null);
    }

    void applyOptimisticClear(LocalDate from) {
        currentView.updateAndGet(view -> view == null ? null : view.clearedFrom(from));
    }

    void discardLocalState() {
        currentView.set(authoritativeView.get());
    }

    CompletableFuture<ScheduleView> requestRefresh(RefreshSource source) {
        if (!observing) {
            return CompletableFuture.completedFuture(currentView.get());
        }
        if (source.isBackground() && openSession.get() != null) {
            log.debug("Skipping {} refresh of provider {}: edit in progress", source, providerId);
            return CompletableFuture.completedFuture(currentView.get());
        }

        CompletableFuture<ScheduleView> result = new CompletableFuture<>();
        waiters.add(result);
        if (!source.isBackground()) {
            foregroundPending.set(true);
        }
        rerun.set(true);
        startDrain();
        return result;
    }

    private void startDrain() {
        if (!inFlight.compareAndSet(false, true)) {
            log.debug("Refresh of provider {} already running, coalescing request", providerId);
            return;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            inFlight.set(false);
            log.error("Refresh of provider {} rejected by executor: {}", providerId, e.getMessage());
            failWaiters(e);
        }
    }

    private void drain() {
        try {
            while (rerun.getAndSet(false)) {
                List<CompletableFuture<ScheduleView>> batch = new ArrayList<>();
                CompletableFuture<ScheduleView> waiter;
                while ((waiter = waiters.poll()) != null) {
                    batch.add(waiter);
                }
                reload(foregroundPending.getAndSet(false), batch);
            }
        } finally {
            inFlight.set(false);
        }
        // a request may have slipped in between the last check and the flag reset
        if (rerun.get()) {
            startDrain();
        }
    }

    private void reload(boolean foreground, List<CompletableFuture<ScheduleView>> batch) {
        if (!observing) {
            batch.forEach(f -> f.complete(null));
            return;
        }
        try {
            ScheduleView view = viewService.loadPage(providerId, pageIndex);
            if (!observing) {
                batch.forEach(f -> f.complete(null));
                return;
            }
            if (!foreground && openSession.get() != null) {
                log.debug("Discarding background refresh of provider {}: edit in progress", providerId);
                batch.forEach(f -> f.complete(currentView.get()));
                return;
            }
            authoritativeView.set(view);
            currentView.set(view);
            batch.forEach(f -> f.complete(view));
        } catch (RuntimeException e) {
            log.error("Failed to reload schedule of provider {}: {}", providerId, e.getMessage());
            batch.forEach(f -> f.completeExceptionally(e));
        }
    }

    private void failWaiters(Throwable error) {
        CompletableFuture<ScheduleView> waiter;
        while ((waiter = waiters.poll()) != null) {
            waiter.completeExceptionally(error);
        }
    }
}
