package com.example.accesslog.service;

import com.example.accesslog.access.AccessLogAccess;
import com.example.accesslog.models.Identifier;
import com.example.accesslog.models.LogEntry;
import com.example.accesslog.models.RemoteOrigins;
import java.net.InetAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Scrubs identifying fields from historical entries without deleting them: subject/object ids are
 * replaced by a pseudonym and remote origins are coarsened to a network prefix.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnonymizationService {

    private final AccessLogAccess accessLogAccess;

    /**
     * Replaces {@code oldId} wherever it appears as subject or object id.
     *
     * @param newId replacement; a fresh random identifier when null
     * @return the identifier that was written
     */
    public Identifier anonymizeId(Identifier oldId, Identifier newId) {
        Objects.requireNonNull(oldId, "oldId");
        Identifier replacement = newId != null ? newId : Identifier.generate();

        int subjects = accessLogAccess.replaceSubjectId(oldId, replacement);
        int objects = accessLogAccess.replaceObjectId(oldId, replacement);

        log.info("Anonymized identifier in {} subject and {} object references", subjects, objects);
        return replacement;
    }

    /**
     * Masks the remote origin of every given entry and writes it back by id. The given entries are
     * updated in place as well.
     *
     * @return number of stored entries rewritten
     */
    public int anonymizeOrigins(Iterable<LogEntry> logs) {
        Objects.requireNonNull(logs, "logs");

        // Mask everything first so an unsupported address aborts before any write.
        List<LogEntry> targets = new ArrayList<>();
        List<InetAddress> masked = new ArrayList<>();
        for (LogEntry entry : logs) {
            targets.add(entry);
            masked.add(RemoteOrigins.anonymize(entry.getRemoteOrigin()));
        }

        int updated = 0;
        for (int i = 0; i < targets.size(); i++) {
            LogEntry target = targets.get(i);
            if (accessLogAccess.updateRemoteOrigin(target.getId(), masked.get(i))) {
                updated++;
            }
            target.setRemoteOrigin(masked.get(i));
        }

        log.info("Anonymized remote origins of {} of {} logs", updated, targets.size());
        return updated;
    }
}
