package com.example.schedule.store.impl;

import com.example.schedule.dto.SlotChange;
import com.example.schedule.store.ChangeNotificationChannel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

@Slf4j
@Component
public class InProcessChangeChannel implements ChangeNotificationChannel {

    private final Map<String, Map<String, Consumer<SlotChange>>> listeners = new ConcurrentHashMap<>();

    @Override
    public Subscription subscribe(String providerId, Consumer<SlotChange> onChange) {
        Subscription subscription = new Subscription(UUID.randomUUID().toString(), providerId);
        listeners.computeIfAbsent(providerId, id -> new ConcurrentHashMap<>())
                .put(subscription.id(), onChange);
        log.debug("Subscribed {} to slot changes of provider {}", subscription.id(), providerId);
        return subscription;
    }

    @Override
    public void unsubscribe(Subscription subscription) {
        listeners.computeIfPresent(subscription.providerId(), (id, byId) -> {
            byId.remove(subscription.id());
            return byId.isEmpty() ? null : byId;
        });
        log.debug("Unsubscribed {} from provider {}", subscription.id(), subscription.providerId());
    }

    @Override
    public void publish(SlotChange change) {
        Map<String, Consumer<SlotChange>> byId = listeners.getOrDefault(change.providerId(), Map.of());
        byId.values().forEach(listener -> {
            try {
                listener.accept(change);
            } catch (RuntimeException e) {
                log.warn("Slot change listener failed for provider {}: {}", change.providerId(), e.getMessage());
            }
        });
    }

    public int subscriberCount(String providerId) {
        return listeners.getOrDefault(providerId, Map.of()).size();
    }
}
