package com.example.dsr.service;

import com.example.dsr.models.DeletionOptions;
import com.example.dsr.models.DeletionPlan;
import com.example.dsr.models.Request;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;

/**
 * Converts between typed values and the open JSON documents kept in {@code metadata} and
 * {@code result_data}. Documents read back from DynamoDB are plain maps and lists.
 */
final class RequestDocuments {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> DOCUMENT = new TypeReference<>() { };
    private static final TypeReference<List<Map<String, Object>>> ROWS = new TypeReference<>() { };

    private RequestDocuments() {
    }

    static Map<String, Object> toDocument(Object value) {
        return MAPPER.convertValue(value, DOCUMENT);
    }

    static DeletionPlan deletionPlan(Request request) {
        Object plan = request.getMetadata() == null ? null : request.getMetadata().get(Request.META_DELETION_PLAN);
        return plan == null ? null : MAPPER.convertValue(plan, DeletionPlan.class);
    }

    static DeletionOptions options(Request request) {
        Object options = request.getMetadata() == null ? null : request.getMetadata().get(Request.META_OPTIONS);
        return options == null ? DeletionOptions.DEFAULTS : MAPPER.convertValue(options, DeletionOptions.class);
    }

    static List<Map<String, Object>> rows(Object value) {
        return value == null ? List.of() : MAPPER.convertValue(value, ROWS);
    }

    static long serializedSize(Object value) {
        try {
            return MAPPER.writeValueAsString(value).length();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize export document", e);
        }
    }

    static String toJson(Object value) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize export document", e);
        }
    }
}
