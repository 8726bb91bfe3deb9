package com.kotsin.hotspot.store;

import com.kotsin.hotspot.model.EventCategory;
import com.kotsin.hotspot.model.TrackedEvent;

import java.util.List;

/**
 * Persistence for the tracked event set of one (category, region) pair.
 *
 * Implementations never throw from {@link #load}: a missing or unreadable
 * store is an empty store.
 */
public interface EventStoreRepository {

    List<TrackedEvent> load(EventCategory category, String regionKey);

    /**
     * Replaces the stored set.
     *
     * @throws StorePersistenceException when the write fails
     */
    void save(EventCategory category, String regionKey, List<TrackedEvent> events);

    static String storeKey(String prefix, EventCategory category, String regionKey) {
        return prefix + ":" + category.getWireValue() + ":" + regionKey;
    }
}
