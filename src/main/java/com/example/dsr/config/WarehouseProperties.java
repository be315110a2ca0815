package com.example.dsr.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the warehouse connector (dsr.warehouse.*).
 * Only the simulated connector ships with this service; real connectors plug in as beans.
 */
@Component
@ConfigurationProperties(prefix = "dsr.warehouse")
@Data
public class WarehouseProperties {

    private String mode = "simulated";
    private List<String> unavailableTables = new ArrayList<>();  // qualified names that fail on access
}
