package com.example.dsr.service;

import com.example.dsr.models.RequestKind;
import com.example.dsr.models.RequestStatus;
import lombok.Getter;

public class DsrException extends RuntimeException {

    public enum Code {
        REQUEST_NOT_FOUND,
        INVALID_STATUS_TRANSITION,
        UNSUPPORTED_EXPORT_FORMAT,
        UNKNOWN
    }

    @Getter
    private final Code code;

    private DsrException(Code code, String message) {
        super(message);
        this.code = code;
    }

    public static DsrException requestNotFound(RequestKind kind, long requestId) {
        String label = kind == RequestKind.DELETE ? "Deletion" : "Export";
        return new DsrException(Code.REQUEST_NOT_FOUND,
                label + " request " + requestId + " not found");
    }

    public static DsrException requestNotFound(long requestId) {
        return new DsrException(Code.REQUEST_NOT_FOUND,
                "Request " + requestId + " not found");
    }

    public static DsrException invalidTransition(String action, RequestStatus current) {
        return new DsrException(Code.INVALID_STATUS_TRANSITION,
                "Cannot " + action + " request with status: " + current.value());
    }

    public static DsrException unsupportedExportFormat(String format) {
        return new DsrException(Code.UNSUPPORTED_EXPORT_FORMAT,
                "Export format " + format + " is not supported");
    }
}
