package com.example.accesslog.models;

import java.net.InetAddress;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import lombok.Builder;

/**
 * Search criteria over the log table. Every field is optional: a null cutoff or an empty set means
 * "no constraint". Fields combine with AND, the values inside one set combine with OR. Both time
 * cutoffs are exclusive.
 *
 * @param ids log ids to match
 * @param createdAfter keep entries with {@code creation_time > createdAfter}
 * @param createdBefore keep entries with {@code creation_time < createdBefore}
 * @param scopes exact scope values
 * @param remoteOrigins exact remote origins, compared in their 16-byte storage form
 * @param subjectIds subject ids to match
 * @param objectIds object ids to match
 */
@Builder(toBuilder = true)
public record LogFilter(
        Set<Identifier> ids,
        Long createdAfter,
        Long createdBefore,
        Set<String> scopes,
        Set<InetAddress> remoteOrigins,
        Set<Identifier> subjectIds,
        Set<Identifier> objectIds
) {
    public LogFilter {
        ids = copy(ids);
        scopes = copy(scopes);
        remoteOrigins = copy(remoteOrigins);
        subjectIds = copy(subjectIds);
        objectIds = copy(objectIds);
    }

    public static LogFilter none() {
        return LogFilter.builder().build();
    }

    public static LogFilter byId(Identifier id) {
        return LogFilter.builder().ids(Set.of(id)).build();
    }

    public boolean isEmpty() {
        return ids.isEmpty() && createdAfter == null && createdBefore == null && scopes.isEmpty()
                && remoteOrigins.isEmpty() && subjectIds.isEmpty() && objectIds.isEmpty();
    }

    /**
     * In-memory evaluation of the filter. Storage backends must select exactly the entries this
     * method accepts.
     */
    public boolean matches(LogEntry log) {
        if (!ids.isEmpty() && !ids.contains(log.getId())) {
            return false;
        }
        long created = log.getCreationTime();
        if (createdAfter != null && created <= createdAfter) {
            return false;
        }
        if (createdBefore != null && created >= createdBefore) {
            return false;
        }
        if (!scopes.isEmpty() && !scopes.contains(log.getScope())) {
            return false;
        }
        if (!remoteOrigins.isEmpty() && !containsOrigin(log.getRemoteOrigin())) {
            return false;
        }
        if (!subjectIds.isEmpty() && !subjectIds.contains(log.getSubjectId())) {
            return false;
        }
        return objectIds.isEmpty() || objectIds.contains(log.getObjectId());
    }

    private boolean containsOrigin(InetAddress origin) {
        byte[] stored = RemoteOrigins.toStorageBytes(origin);
        for (InetAddress candidate : remoteOrigins) {
            if (Arrays.equals(stored, RemoteOrigins.toStorageBytes(candidate))) {
                return true;
            }
        }
        return false;
    }

    private static <T> Set<T> copy(Collection<T> values) {
        if (values == null || values.isEmpty()) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }
}
