package com.kotsin.hotspot.tracking;

import com.kotsin.hotspot.model.EventCategory;

import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Stable event ids: {category}_{epochMillis base36}_{6 random base36 chars}
 */
public class EventIdGenerator {

    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int SUFFIX_LENGTH = 6;

    public String next(EventCategory category, Instant now) {
        String prefix = category == null ? "event" : category.getWireValue();
        StringBuilder id = new StringBuilder(prefix)
                .append('_')
                .append(Long.toString(now.toEpochMilli(), 36))
                .append('_');
        ThreadLocalRandom random = ThreadLocalRandom.current();
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            id.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return id.toString();
    }
}
