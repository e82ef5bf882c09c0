package com.example.accesslog.service;

import com.example.accesslog.access.AccessLogAccess;
import com.example.accesslog.config.AccessLogProperties;
import com.example.accesslog.models.Identifier;
import com.example.accesslog.models.LogCollection;
import com.example.accesslog.models.LogEntry;
import com.example.accesslog.models.LogFilter;
import com.example.accesslog.models.LogSort;
import com.example.accesslog.models.Pagination;
import com.example.accesslog.models.RemoteOrigins;
import com.example.accesslog.requests.CreateLogServiceRequest;
import java.net.InetAddress;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.SortedSet;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;

/**
 * Create, read, search and delete operations over the access log. Filtering is pushed down to
 * the store; ordering and pagination are applied here so every backend sorts the same way.
 */
@Service
@Slf4j
public class AccessLogService {

    private final AccessLogAccess accessLogAccess;
    private final Clock clock;
    private final Optional<InetAddress> defaultRemoteOrigin;
    private final int scopeLength;

    public AccessLogService(AccessLogAccess accessLogAccess,
                            AccessLogProperties properties,
                            Clock clock) {
        this.accessLogAccess = accessLogAccess;
        this.clock = clock;
        this.defaultRemoteOrigin = properties.parsedDefaultRemoteOrigin();
        this.scopeLength = properties.getScopeLength();
    }

    public LogEntry create(CreateLogServiceRequest request) {
        Objects.requireNonNull(request, "request");

        String scope = request.scope() == null ? "" : request.scope();
        if (scope.length() > scopeLength) {
            throw new IllegalArgumentException("scope must be at most " + scopeLength + " characters");
        }

        LogEntry entry = LogEntry.builder()
                .id(request.id() != null ? request.id() : Identifier.generate())
                .creationTime(request.creationTime() != null
                        ? request.creationTime()
                        : clock.instant().getEpochSecond())
                .scope(scope)
                .remoteOrigin(request.remoteOrigin() != null
                        ? request.remoteOrigin()
                        : defaultRemoteOrigin.orElse(RemoteOrigins.LOOPBACK))
                .subjectId(request.subjectId() != null ? request.subjectId() : Identifier.ZERO)
                .objectId(request.objectId() != null ? request.objectId() : Identifier.ZERO)
                .build();

        // Preflight check for an existing id; the conditional insert below stays authoritative.
        if (accessLogAccess.count(LogFilter.byId(entry.getId())) > 0) {
            throw AccessLogException.logIdCollision(entry.getId().toString());
        }
        try {
            accessLogAccess.insert(entry);
        } catch (ConditionalCheckFailedException ex) {
            throw AccessLogException.logIdCollision(entry.getId().toString());
        }

        log.debug("Created log {} in scope '{}'", entry.getId(), entry.getScope());
        return entry;
    }

    public Optional<LogEntry> get(Identifier id) {
        Objects.requireNonNull(id, "id");
        return search(LogFilter.byId(id), LogSort.defaults(), Pagination.all()).get(id);
    }

    public long count(LogFilter filter) {
        Objects.requireNonNull(filter, "filter");
        return accessLogAccess.count(filter);
    }

    public LogCollection search(LogFilter filter) {
        return search(filter, LogSort.defaults(), Pagination.all());
    }

    public LogCollection search(LogFilter filter, LogSort sort, Pagination pagination) {
        Objects.requireNonNull(filter, "filter");
        Objects.requireNonNull(sort, "sort");
        Objects.requireNonNull(pagination, "pagination");

        List<LogEntry> sorted = accessLogAccess.find(filter)
                .stream()
                .sorted(sort.comparator())
                .collect(Collectors.toList());

        return LogCollection.of(pagination.apply(sorted));
    }

    public void delete(Identifier id) {
        Objects.requireNonNull(id, "id");
        accessLogAccess.deleteById(id);
    }

    /**
     * Deletes dated entries created before the cutoff, or every dated entry when no cutoff is
     * given. Entries with a creation time of 0 are never pruned.
     *
     * @return number of entries deleted
     */
    public int prune(OptionalLong createdBefore) {
        Objects.requireNonNull(createdBefore, "createdBefore");
        int deleted = accessLogAccess.deleteCreatedBefore(createdBefore);
        if (createdBefore.isPresent()) {
            log.info("Pruned {} logs created before {}", deleted, createdBefore.getAsLong());
        } else {
            log.info("Pruned all {} dated logs", deleted);
        }
        return deleted;
    }

    public SortedSet<String> uniqueScopes() {
        return accessLogAccess.findScopes();
    }
}
