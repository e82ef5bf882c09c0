package com.example.accesslog.service;

import com.example.accesslog.config.AccessLogProperties;
import com.example.accesslog.models.Identifier;
import com.example.accesslog.models.LogFilter;
import java.net.InetAddress;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Service;

/**
 * Rate-limit checks over the access log. An actor is in cooldown once it has {@code amount} events
 * of a scope inside the trailing window, counted separately per remote origin and per subject;
 * reaching the limit on either axis is enough.
 */
@Service
public class CooldownService {

    private final AccessLogService accessLogService;
    private final Clock clock;
    private final Optional<InetAddress> defaultRemoteOrigin;

    public CooldownService(AccessLogService accessLogService,
                           AccessLogProperties properties,
                           Clock clock) {
        this.accessLogService = accessLogService;
        this.clock = clock;
        this.defaultRemoteOrigin = properties.parsedDefaultRemoteOrigin();
    }

    /**
     * @param scope scope to count
     * @param amount number of events that triggers the cooldown
     * @param periodSeconds length of the trailing window in seconds
     * @param remoteOrigin origin to check; falls back to the configured default origin
     * @param subjectId subject to check; the subject axis is skipped when empty
     */
    public boolean cooldown(String scope,
                            long amount,
                            long periodSeconds,
                            Optional<InetAddress> remoteOrigin,
                            Optional<Identifier> subjectId) {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(remoteOrigin, "remoteOrigin");
        Objects.requireNonNull(subjectId, "subjectId");

        long windowStart = clock.instant().getEpochSecond() - periodSeconds;

        Optional<InetAddress> origin = remoteOrigin.or(() -> defaultRemoteOrigin);
        if (origin.isPresent()) {
            LogFilter byOrigin = LogFilter.builder()
                    .scopes(Set.of(scope))
                    .createdAfter(windowStart)
                    .remoteOrigins(Set.of(origin.get()))
                    .build();
            if (accessLogService.count(byOrigin) >= amount) {
                return true;
            }
        }

        if (subjectId.isPresent()) {
            LogFilter bySubject = LogFilter.builder()
                    .scopes(Set.of(scope))
                    .createdAfter(windowStart)
                    .subjectIds(Set.of(subjectId.get()))
                    .build();
            return accessLogService.count(bySubject) >= amount;
        }
        return false;
    }
}
