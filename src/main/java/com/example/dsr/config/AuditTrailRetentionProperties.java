package com.example.dsr.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for purging the audit trails of finished requests (dsr.audit-retention.*).
 * A trail becomes eligible once its request is terminal and its newest event is older than
 * {@code retentionDays}.
 */
@Component
@ConfigurationProperties(prefix = "dsr.audit-retention")
@Data
public class AuditTrailRetentionProperties {

    private boolean enabled = false;
    private String schedule = "0 0 3 * * *";
    private int retentionDays = 2190;  // six years after the request finished
}
