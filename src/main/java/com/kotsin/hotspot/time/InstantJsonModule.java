package com.kotsin.hotspot.time;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;

import java.io.IOException;
import java.time.Instant;

/**
 * Jackson bindings for {@link Instant} backed by {@link InstantCodec}.
 *
 * Unparseable text and non-string tokens read as null. Register after
 * JavaTimeModule so these bindings win.
 */
public class InstantJsonModule extends SimpleModule {

    public InstantJsonModule() {
        super("InstantJsonModule");
        addSerializer(Instant.class, new CodecSerializer());
        addDeserializer(Instant.class, new LenientDeserializer());
    }

    static class CodecSerializer extends JsonSerializer<Instant> {
        @Override
        public void serialize(Instant value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeString(InstantCodec.format(value));
        }
    }

    static class LenientDeserializer extends JsonDeserializer<Instant> {
        @Override
        public Instant deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (p.currentToken() == JsonToken.VALUE_STRING) {
                return InstantCodec.parse(p.getText()).orElse(null);
            }
            p.skipChildren();
            return null;
        }
    }
}
