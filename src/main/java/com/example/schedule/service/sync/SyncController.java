package com.example.schedule.service.sync;

import com.example.schedule.config.ScheduleConfig;
import com.example.schedule.dto.ScheduleView;
import com.example.schedule.service.ScheduleViewService;
import com.example.schedule.service.exception.ScheduleValidationException;
import com.example.schedule.store.ChangeNotificationChannel;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Supplier;

/**
 * Decides when a provider's schedule is re-read from storage.
 *
 * <p>Each provider gets its own {@link ProviderSync}: poll ticks, pushed changes,
 * navigation and settled mutations of that provider become refresh requests for its
 * reconciliation loop. Only one load per provider runs at a time; requests arriving during
 * a load are coalesced into a single follow-up load. Background requests are skipped while
 * the provider has an open {@link EditSession}, and a background load that finishes after
 * a session was opened is discarded.
 *
 * <p>The current view is a rendering hint. Every mutation goes through
 * {@link #runMutation(String, String, Supplier)} and is followed by exactly one
 * authoritative load of that provider's page.
 */
@Slf4j
@Service
public class SyncController {

    private final ScheduleViewService viewService;
    private final ChangeNotificationChannel channel;
    private final TaskScheduler taskScheduler;
    private final Executor executor;
    private final ScheduleConfig config;
    private final Clock clock;

    private final Map<String, ProviderSync> providers = new ConcurrentHashMap<>();

    public SyncController(ScheduleViewService viewService,
                          ChangeNotificationChannel channel,
                          TaskScheduler taskScheduler,
                          @Qualifier("scheduleExecutor") Executor executor,
                          ScheduleConfig config,
                          Clock clock) {
        this.viewService = viewService;
        this.channel = channel;
        this.taskScheduler = taskScheduler;
        this.executor = executor;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Starts observing the provider at {@code pageIndex}, or moves an existing observation
     * to that page. Other providers are not affected.
     */
    public CompletableFuture<ScheduleView> observe(String providerId, int pageIndex) {
        ProviderSync state = state(providerId);
        synchronized (state) {
            if (providers.get(providerId) != state) {
                // stopped concurrently, start over with fresh state
                return observe(providerId, pageIndex);
            }
            if (state.isObserving()) {
                state.setPage(pageIndex);
            } else {
                ChangeNotificationChannel.Subscription subscription =
                        channel.subscribe(providerId, change -> requestRefresh(providerId, RefreshSource.PUSH));
                Duration interval = Duration.ofMillis(config.getPollIntervalMs());
                ScheduledFuture<?> poll = taskScheduler.scheduleAtFixedRate(
                        () -> requestRefresh(providerId, RefreshSource.POLL), clock.instant().plus(interval), interval);
                state.startObserving(pageIndex, poll, subscription);
                log.info("Observing schedule of provider {}", providerId);
            }
        }
        return state.requestRefresh(RefreshSource.NAVIGATION);
    }

    /** Ends observation of the provider: poll, subscription, edit session and views go away. */
    public void stop(String providerId) {
        ProviderSync state = providers.remove(providerId);
        if (state == null) {
            return;
        }
        state.stopObserving().ifPresent(channel::unsubscribe);
        log.info("Stopped observing schedule of provider {}", providerId);
    }

    @PreDestroy
    public void stopAll() {
        List.copyOf(providers.keySet()).forEach(this::stop);
    }

    public boolean isObserving(String providerId) {
        ProviderSync state = providers.get(providerId);
        return state != null && state.isObserving();
    }

    public Optional<ScheduleView> currentView(String providerId) {
        return Optional.ofNullable(providers.get(providerId)).flatMap(ProviderSync::currentView);
    }

    /**
     * Queues a load of the provider's observed page. The returned future completes with a
     * view loaded after this call, or right away with the current view when the request is
     * skipped or the provider is not observed.
     */
    public CompletableFuture<ScheduleView> requestRefresh(String providerId, RefreshSource source) {
        ProviderSync state = providers.get(providerId);
        if (state == null) {
            return CompletableFuture.completedFuture(null);
        }
        return state.requestRefresh(source);
    }

    /**
     * Runs a local mutation of the provider's schedule and always follows it with one
     * authoritative load of that provider. On failure any optimistic local state is dropped
     * before the reload.
     */
    public <T> T runMutation(String providerId, String description, Supplier<T> mutation) {
        try {
            return mutation.get();
        } catch (RuntimeException e) {
            log.warn("Provider {}: {} failed: {}", providerId, description, e.getMessage());
            Optional.ofNullable(providers.get(providerId)).ifPresent(ProviderSync::discardLocalState);
            throw e;
        } finally {
            requestRefresh(providerId, RefreshSource.MUTATION);
        }
    }

    /** Shows a clear before storage confirms it. */
    public void applyOptimisticClear(String providerId, LocalDate from) {
        Optional.ofNullable(providers.get(providerId)).ifPresent(state -> state.applyOptimisticClear(from));
    }

    public EditSession openEditSession(String providerId, Long slotId) {
        Instant now = clock.instant();
        EditSession session = new EditSession(UUID.randomUUID().toString(), providerId, slotId,
                now, now.plusSeconds(config.getEditSessionTtlSeconds()));
        if (!state(providerId).tryOpen(session)) {
            throw new ScheduleValidationException("Another slot is already being edited");
        }
        log.info("Provider {}: edit session {} opened for slot {}", providerId, session.token(), slotId);
        return session;
    }

    public EditSession requireSession(String providerId, String token) {
        return openSession(providerId)
                .filter(session -> session.token().equals(token))
                .orElseThrow(() -> new ScheduleValidationException("Edit session is not open"));
    }

    public Optional<EditSession> openSession(String providerId) {
        return Optional.ofNullable(providers.get(providerId)).flatMap(ProviderSync::openSession);
    }

    /** Ends the session; returns false if it was no longer the provider's open one. */
    public boolean releaseSession(EditSession session) {
        ProviderSync state = providers.get(session.providerId());
        boolean released = state != null && state.release(session);
        if (released) {
            log.info("Provider {}: edit session {} closed", session.providerId(), session.token());
            evictIfIdle(state);
        }
        return released;
    }

    public void cancelSession(EditSession session) {
        if (releaseSession(session)) {
            requestRefresh(session.providerId(), RefreshSource.SESSION_END);
        }
    }

    /** Releases every session that outlived its TTL; returns how many were released. */
    public int releaseExpiredSessions() {
        Instant now = clock.instant();
        int released = 0;
        for (ProviderSync state : providers.values()) {
            Optional<EditSession> session = state.openSession().filter(s -> s.isExpired(now));
            if (session.isPresent() && state.release(session.get())) {
                log.warn("Provider {}: edit session {} expired", state.providerId(), session.get().token());
                state.requestRefresh(RefreshSource.SESSION_END);
                evictIfIdle(state);
                released++;
            }
        }
        return released;
    }

    private ProviderSync state(String providerId) {
        return providers.computeIfAbsent(providerId, id -> new ProviderSync(id, viewService, executor));
    }

    // state created only to hold an edit session is dropped once the session ends
    private void evictIfIdle(ProviderSync state) {
        synchronized (state) {
            if (!state.isObserving() && state.openSession().isEmpty()) {
                providers.remove(state.providerId(), state);
            }
        }
    }
}
