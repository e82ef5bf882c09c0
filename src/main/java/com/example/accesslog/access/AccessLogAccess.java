package com.example.accesslog.access;

import com.example.accesslog.models.Identifier;
import com.example.accesslog.models.LogEntry;
import com.example.accesslog.models.LogFilter;
import java.net.InetAddress;
import java.util.List;
import java.util.OptionalLong;
import java.util.SortedSet;

/**
 * Storage abstraction for the {@code access_logs} table. Every method is a single logical
 * operation against the store; ordering and pagination of search results are left to the
 * service layer.
 */
public interface AccessLogAccess {

    /**
     * Creates the table when it does not exist yet.
     */
    void install();

    void uninstall();

    /**
     * Inserts a new entry. Will fail with
     * {@link software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException}
     * if an entry with the same id already exists.
     */
    LogEntry insert(LogEntry entry);

    /**
     * Finds every entry accepted by {@link LogFilter#matches(LogEntry)}, in no particular order.
     */
    List<LogEntry> find(LogFilter filter);

    long count(LogFilter filter);

    void deleteById(Identifier id);

    /**
     * Deletes every entry with a non-zero creation time that is older than the cutoff, or every
     * entry with a non-zero creation time when no cutoff is given.
     *
     * @return number of entries deleted
     */
    int deleteCreatedBefore(OptionalLong cutoff);

    SortedSet<String> findScopes();

    /**
     * @return number of entries whose subject id was rewritten
     */
    int replaceSubjectId(Identifier oldId, Identifier newId);

    /**
     * @return number of entries whose object id was rewritten
     */
    int replaceObjectId(Identifier oldId, Identifier newId);

    /**
     * Overwrites the remote origin of one entry.
     *
     * @return false when no entry with that id exists
     */
    boolean updateRemoteOrigin(Identifier id, InetAddress remoteOrigin);
}
