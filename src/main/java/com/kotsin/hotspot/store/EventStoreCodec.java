package com.kotsin.hotspot.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kotsin.hotspot.model.EventCategory;
import com.kotsin.hotspot.model.Severity;
import com.kotsin.hotspot.model.TrackedEvent;
import com.kotsin.hotspot.time.InstantCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reads and writes the stored event set (a JSON array of events).
 *
 * Reading is tolerant: a document that is not an array reads as empty,
 * events missing id, category, coordinates or severity are skipped, and
 * history points whose t does not parse are dropped.
 */
@Slf4j
@Component
public class EventStoreCodec {

    private final ObjectMapper objectMapper;

    public EventStoreCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String write(List<TrackedEvent> events) {
        try {
            return objectMapper.writeValueAsString(events);
        } catch (JsonProcessingException e) {
            throw new StorePersistenceException("Failed to serialize " + events.size() + " events", e);
        }
    }

    public List<TrackedEvent> read(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyList();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("[EVENT_STORE] Unreadable store document, treating as empty: {}", e.getOriginalMessage());
            return Collections.emptyList();
        }
        if (root == null || !root.isArray()) {
            log.warn("[EVENT_STORE] Store document is not an array, treating as empty");
            return Collections.emptyList();
        }

        List<TrackedEvent> events = new ArrayList<>();
        for (JsonNode node : root) {
            if (!isUsable(node)) {
                log.debug("[EVENT_STORE] Skipping invalid stored event: {}", node);
                continue;
            }
            ObjectNode copy = ((ObjectNode) node).deepCopy();
            copy.set("history", validHistory(copy.get("history")));
            try {
                events.add(objectMapper.treeToValue(copy, TrackedEvent.class));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.debug("[EVENT_STORE] Skipping unmappable stored event {}: {}",
                        node.path("id").asText(), e.getMessage());
            }
        }
        return events;
    }

    private static boolean isUsable(JsonNode node) {
        if (node == null || !node.isObject()) {
            return false;
        }
        JsonNode id = node.get("id");
        if (id == null || !id.isTextual() || id.asText().isBlank()) {
            return false;
        }
        JsonNode category = node.get("category");
        if (category == null || !category.isTextual() || EventCategory.fromWire(category.asText()) == null) {
            return false;
        }
        JsonNode severity = node.get("severity");
        if (severity == null || !severity.isTextual() || Severity.fromWire(severity.asText()) == null) {
            return false;
        }
        return isFiniteNumber(node.get("latitude")) && isFiniteNumber(node.get("longitude"));
    }

    private static boolean isFiniteNumber(JsonNode node) {
        return node != null && node.isNumber() && Double.isFinite(node.asDouble());
    }

    private ArrayNode validHistory(JsonNode history) {
        ArrayNode kept = objectMapper.createArrayNode();
        if (history == null || !history.isArray()) {
            return kept;
        }
        for (JsonNode point : history) {
            JsonNode t = point.get("t");
            if (point.isObject() && t != null && t.isTextual() && InstantCodec.parse(t.asText()).isPresent()) {
                kept.add(point);
            }
        }
        return kept;
    }
}
