package com.kotsin.hotspot.store;

import com.kotsin.hotspot.config.TrackingProperties;
import com.kotsin.hotspot.model.EventCategory;
import com.kotsin.hotspot.model.TrackedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.Collections;
import java.util.List;

/**
 * RedisEventStoreRepository - Redis-backed event set per (category, region)
 *
 * Redis Key Pattern:
 * - hotspot:events:{category}:{regionKey} - JSON array of tracked events (String)
 *
 * TTL: the stale retention window, refreshed on every save. A store whose
 * region stops being scanned expires once every event in it would have been
 * evicted anyway.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "tracking.store", name = "type", havingValue = "redis", matchIfMissing = true)
public class RedisEventStoreRepository implements EventStoreRepository {

    private final StringRedisTemplate redisTemplate;
    private final EventStoreCodec codec;
    private final TrackingProperties properties;

    @Override
    public List<TrackedEvent> load(EventCategory category, String regionKey) {
        String key = keyFor(category, regionKey);
        String json;
        try {
            json = redisTemplate.opsForValue().get(key);
        } catch (RuntimeException e) {
            log.warn("[EVENT_STORE] Read failed for {}, starting from an empty store: {}", key, e.getMessage());
            return Collections.emptyList();
        }

        List<TrackedEvent> events = codec.read(json);
        log.debug("[EVENT_STORE] Loaded {} events from {}", events.size(), key);
        return events;
    }

    @Override
    public void save(EventCategory category, String regionKey, List<TrackedEvent> events) {
        String key = keyFor(category, regionKey);
        String json = codec.write(events);
        try {
            redisTemplate.opsForValue().set(key, json, retention());
        } catch (RuntimeException e) {
            throw new StorePersistenceException("Failed to write " + key, e);
        }
        log.debug("[EVENT_STORE] Saved {} events to {} with TTL {}h",
                events.size(), key, properties.getKeepStaleHours());
    }

    String keyFor(EventCategory category, String regionKey) {
        return EventStoreRepository.storeKey(properties.getStore().getKeyPrefix(), category, regionKey);
    }

    private Duration retention() {
        return Duration.ofHours(Math.max(1, properties.getKeepStaleHours()));
    }
}
