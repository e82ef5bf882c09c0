package com.example.accesslog.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for access log retention.
 * These values are bound from application.yml (access-log.retention.*).
 * To enable retention, set access-log.retention.enabled=true in application.yml.
 */
@Component
@ConfigurationProperties(prefix = "access-log.retention")
@Data
public class LogRetentionProperties {

    private boolean enabled = false;
    private String schedule = "0 0 3 * * *";
    private int retentionDays = 365;
}
