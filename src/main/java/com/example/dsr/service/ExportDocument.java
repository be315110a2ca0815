package com.example.dsr.service;

/**
 * A rendered export ready to be handed to the data subject.
 */
public record ExportDocument(
        String fileName,
        ExportFormat format,
        String content
) { }
