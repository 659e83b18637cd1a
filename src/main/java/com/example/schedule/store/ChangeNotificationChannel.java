package com.example.schedule.store;

import com.example.schedule.dto.SlotChange;

import java.util.function.Consumer;

/**
 * Push notifications about slot mutations made outside this engine, scoped per provider.
 */
public interface ChangeNotificationChannel {

    Subscription subscribe(String providerId, Consumer<SlotChange> onChange);

    void unsubscribe(Subscription subscription);

    void publish(SlotChange change);

    record Subscription(String id, String providerId) {
    }
}
