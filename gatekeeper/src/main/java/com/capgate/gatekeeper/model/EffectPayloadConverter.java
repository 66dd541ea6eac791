package com.capgate.gatekeeper.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores an {@link EffectPayload} as JSON text in the approvals table.
 *
 * Uses its own mapper because JPA instantiates converters outside the
 * Spring context.
 */
@Converter
public class EffectPayloadConverter implements AttributeConverter<EffectPayload, String> {

    private static final ObjectMapper JSON = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(EffectPayload payload) {
        if (payload == null) return null;
        try {
            return JSON.writerFor(EffectPayload.class).writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize approval payload", e);
        }
    }

    @Override
    public EffectPayload convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) return null;
        try {
            return JSON.readValue(json, EffectPayload.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored approval payload is not valid JSON", e);
        }
    }
}
