package com.mycelium.core.bridge;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.mycelium.core.model.ActionKind;
import com.mycelium.core.model.Envelope;

import java.io.IOException;

/**
 * JSON wire form of an {@link Envelope}. Field names follow the record components;
 * payloads carry a {@code type} discriminator and actions travel as
 * {@code capability:NAME}.
 */
public class EnvelopeCodec {

    private final ObjectMapper objectMapper;

    public EnvelopeCodec(ActionCatalog catalog) {
        SimpleModule actions = new SimpleModule("mycelium-actions");
        actions.addSerializer(ActionKind.class, new JsonSerializer<ActionKind>() {
            @Override
            public void serialize(ActionKind value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
                gen.writeString(value.qualifiedName());
            }
        });
        actions.addDeserializer(ActionKind.class, new JsonDeserializer<ActionKind>() {
            @Override
            public ActionKind deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
                String name = p.getValueAsString();
                if (name == null || !catalog.contains(name)) {
                    return (ActionKind) ctxt.handleWeirdStringValue(ActionKind.class, name, "unknown action");
                }
                return catalog.resolve(name);
            }
        });
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .registerModule(actions)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String encode(Envelope envelope) {
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode envelope " + envelope.id() + ": " + e.getOriginalMessage(), e);
        }
    }

    /**
     * @throws IllegalArgumentException if the frame is not a valid envelope
     */
    public Envelope decode(String frame) {
        try {
            return objectMapper.readValue(frame, Envelope.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot decode envelope: " + e.getOriginalMessage(), e);
        }
    }
}
