package com.example.dsr.service;

import java.util.Locale;

public enum ExportFormat {
    JSON("application/json", "json"),
    CSV("text/csv", "csv");

    private final String mediaType;
    private final String extension;

    ExportFormat(String mediaType, String extension) {
        this.mediaType = mediaType;
        this.extension = extension;
    }

    public String mediaType() {
        return mediaType;
    }

    public String extension() {
        return extension;
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ExportFormat fromValue(String v) {
        if (v != null) {
            for (ExportFormat f : values()) {
                if (f.name().equalsIgnoreCase(v.trim())) {
                    return f;
                }
            }
        }
        throw DsrException.unsupportedExportFormat(v);
    }
}
