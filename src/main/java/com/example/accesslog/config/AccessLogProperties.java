package com.example.accesslog.config;

import com.example.accesslog.models.RemoteOrigins;
import java.net.InetAddress;
import java.util.Optional;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the access log store.
 * These values are bound from application.yml (access-log.*).
 * The defaults below serve as fallbacks if properties are missing from YAML.
 */
@Component
@ConfigurationProperties(prefix = "access-log")
@Data
public class AccessLogProperties {

    public static final String TABLE_NAME = "access_logs";

    private String tablePrefix = "";
    private String defaultRemoteOrigin;
    private int scopeLength = 16;
    private boolean install = false;

    public String tableName() {
        return (tablePrefix == null ? "" : tablePrefix) + TABLE_NAME;
    }

    /**
     * Parsed form of {@code access-log.default-remote-origin}; empty when not configured.
     */
    public Optional<InetAddress> parsedDefaultRemoteOrigin() {
        if (defaultRemoteOrigin == null || defaultRemoteOrigin.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(RemoteOrigins.parse(defaultRemoteOrigin));
    }
}
