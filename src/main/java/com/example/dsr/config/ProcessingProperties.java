package com.example.dsr.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the background processing executor (dsr.processing.*).
 * Each worker runs one request at a time; items inside a request never run in parallel.
 */
@Component
@ConfigurationProperties(prefix = "dsr.processing")
@Data
public class ProcessingProperties {

    private int corePoolSize = 2;
    private int maxPoolSize = 4;
    private int queueCapacity = 100;
}
