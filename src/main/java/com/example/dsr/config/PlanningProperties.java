package com.example.dsr.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for discovery and deletion planning (dsr.planning.*).
 * The defaults below serve as fallbacks if properties are missing from YAML.
 */
@Component
@ConfigurationProperties(prefix = "dsr.planning")
@Data
public class PlanningProperties {

    private double minExportConfidence = 0.3;
    private long largeDeletionThreshold = 10_000L;
    private List<String> criticalTablePatterns = new ArrayList<>(List.of(
            "payment", "billing", "invoice", "financial",
            "audit", "compliance", "legal",
            "system", "config", "admin"));
}
