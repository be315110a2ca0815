package com.example.dsr.models;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Map;
import software.amazon.awssdk.enhanced.dynamodb.AttributeConverter;
import software.amazon.awssdk.enhanced.dynamodb.AttributeValueType;
import software.amazon.awssdk.enhanced.dynamodb.EnhancedType;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Stores open key/value documents (request metadata, item results, audit details) as a single
 * JSON string attribute so nested plans and row samples keep their shape.
 */
public class JsonStringMapAttributeConverter implements AttributeConverter<Map<String, Object>> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public AttributeValue transformFrom(Map<String, Object> input) {
        if (input == null) {
            return AttributeValue.builder().nul(true).build();
        }
        return AttributeValue.builder().s(toJsonString(input)).build();
    }

    @Override
    public Map<String, Object> transformTo(AttributeValue attributeValue) {
        if (attributeValue == null || Boolean.TRUE.equals(attributeValue.nul())) {
            return null;
        }
        String json = attributeValue.s();
        if (json == null) {
            return null;
        }
        try {
            return MAPPER.readValue(
                    json,
                    MAPPER.getTypeFactory().constructMapType(Map.class, String.class, Object.class)
            );
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid JSON in document attribute", e);
        }
    }

    @Override
    public EnhancedType<Map<String, Object>> type() {
        return EnhancedType.mapOf(String.class, Object.class);
    }

    @Override
    public AttributeValueType attributeValueType() {
        return AttributeValueType.S;
    }

    static String toJsonString(Map<String, Object> input) {
        try {
            return MAPPER.writeValueAsString(input == null ? Map.of() : input);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize document attribute", e);
        }
    }
}
