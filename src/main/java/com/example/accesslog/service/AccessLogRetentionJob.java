package com.example.accesslog.service;

import com.example.accesslog.config.LogRetentionProperties;
import java.time.Clock;
import java.time.Instant;
import java.util.OptionalLong;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Scheduled job that prunes access logs older than the configured retention period.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(value = "access-log.retention.enabled", havingValue = "true")
public class AccessLogRetentionJob {

    private static final long SECONDS_PER_DAY = 86400L;

    private final Clock clock;
    private final LogRetentionProperties properties;
    private final AccessLogService accessLogService;

    @Scheduled(cron = "${access-log.retention.schedule:0 0 3 * * *}")
    public int enforceRetentionPolicy() {
        long startTime = clock.millis();
        long cutoff = clock.instant().getEpochSecond() - properties.getRetentionDays() * SECONDS_PER_DAY;
        log.info("Starting access log retention job (retention period: {} days, cutoff: {})",
                properties.getRetentionDays(), Instant.ofEpochSecond(cutoff));

        int deleted = accessLogService.prune(OptionalLong.of(cutoff));

        long duration = clock.millis() - startTime;
        log.info("Completed access log retention job in {}ms: deleted={}", duration, deleted);
        return deleted;
    }
}
