package com.kotsin.hotspot.store;

import com.kotsin.hotspot.config.TrackingProperties;
import com.kotsin.hotspot.model.EventCategory;
import com.kotsin.hotspot.model.TrackedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local event store, selected with tracking.store.type=memory.
 *
 * Holds the serialized form so reads go through the same codec as Redis.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "tracking.store", name = "type", havingValue = "memory")
public class InMemoryEventStoreRepository implements EventStoreRepository {

    private final EventStoreCodec codec;
    private final TrackingProperties properties;

    private final Map<String, String> documents = new ConcurrentHashMap<>();

    @Override
    public List<TrackedEvent> load(EventCategory category, String regionKey) {
        return codec.read(documents.get(keyFor(category, regionKey)));
    }

    @Override
    public void save(EventCategory category, String regionKey, List<TrackedEvent> events) {
        String key = keyFor(category, regionKey);
        documents.put(key, codec.write(events));
        log.debug("[EVENT_STORE] Saved {} events to {} (memory)", events.size(), key);
    }

    private String keyFor(EventCategory category, String regionKey) {
        return EventStoreRepository.storeKey(properties.getStore().getKeyPrefix(), category, regionKey);
    }
}
