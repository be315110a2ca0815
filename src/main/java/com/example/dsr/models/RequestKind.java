package com.example.dsr.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum RequestKind {
    EXPORT,
    DELETE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RequestKind fromValue(String v) {
        for (RequestKind k : values()) {
            if (k.name().equalsIgnoreCase(v)) {
                return k;
            }
        }
        throw new IllegalArgumentException("Unknown request kind: " + v);
    }
}
