package com.example.dsr.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the queued-request reconciliation sweep (dsr.reconciler.*).
 * To enable the sweep, set dsr.reconciler.enabled=true in application.yml.
 */
@Component
@ConfigurationProperties(prefix = "dsr.reconciler")
@Data
public class ReconcilerProperties {

    private boolean enabled = false;
    private String schedule = "0 */5 * * * *";  // Every 5 minutes by default
    private int graceMinutes = 10;  // How long a scheduled request may wait before it is re-dispatched
}
