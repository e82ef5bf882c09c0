package com.example.accesslog.config;

import com.example.accesslog.access.AccessLogAccess;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Creates the access log table on startup when access-log.install=true.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(value = "access-log.install", havingValue = "true")
public class AccessLogTableInstaller implements ApplicationRunner {

    private final AccessLogAccess accessLogAccess;
    private final AccessLogProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        log.info("Ensuring table {} exists", properties.tableName());
        accessLogAccess.install();
    }
}
