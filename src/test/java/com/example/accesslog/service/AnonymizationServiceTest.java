package com.example.accesslog.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import com.example.accesslog.config.AccessLogProperties;
import com.example.accesslog.models.Identifier;
import com.example.accesslog.models.LogCollection;
import com.example.accesslog.models.LogEntry;
import com.example.accesslog.models.LogFilter;
import com.example.accesslog.models.RemoteOrigins;
import com.example.accesslog.requests.CreateLogServiceRequest;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AnonymizationServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-10-02T08:00:00Z"), ZoneOffset.UTC);

    private AccessLogService accessLogService;
    private AnonymizationService anonymizationService;

    @BeforeEach
    void setUp() {
        InMemoryAccessLogAccess access = new InMemoryAccessLogAccess();
        accessLogService = new AccessLogService(access, new AccessLogProperties(), CLOCK);
        anonymizationService = new AnonymizationService(access);
    }

    @Test
    @DisplayName("anonymizeId leaves no reference to the old id")
    void anonymizeIdReplacesEverywhere() {
        Identifier old = Identifier.generate();
        Identifier other = Identifier.generate();
        LogEntry asSubject = create(old, other);
        LogEntry asObject = create(other, old);
        LogEntry asBoth = create(old, old);

        Identifier replacement = anonymizationService.anonymizeId(old, null);

        assertFalse(replacement.isZero());
        assertEquals(0, accessLogService.count(LogFilter.builder().subjectIds(Set.of(old)).build()));
        assertEquals(0, accessLogService.count(LogFilter.builder().objectIds(Set.of(old)).build()));
        assertEquals(2, accessLogService.count(LogFilter.builder().subjectIds(Set.of(replacement)).build()));
        assertEquals(2, accessLogService.count(LogFilter.builder().objectIds(Set.of(replacement)).build()));

        LogEntry both = accessLogService.get(asBoth.getId()).orElseThrow();
        assertEquals(replacement, both.getSubjectId());
        assertEquals(replacement, both.getObjectId());
        assertEquals(other, accessLogService.get(asSubject.getId()).orElseThrow().getObjectId());
        assertEquals(other, accessLogService.get(asObject.getId()).orElseThrow().getSubjectId());
    }

    @Test
    @DisplayName("anonymizeId writes the supplied replacement")
    void anonymizeIdWithSuppliedReplacement() {
        Identifier old = Identifier.generate();
        Identifier replacement = Identifier.generate();
        LogEntry entry = create(old, Identifier.ZERO);

        assertEquals(replacement, anonymizationService.anonymizeId(old, replacement));
        assertEquals(replacement, accessLogService.get(entry.getId()).orElseThrow().getSubjectId());
        assertEquals(Identifier.ZERO, accessLogService.get(entry.getId()).orElseThrow().getObjectId());
    }

    @Test
    @DisplayName("anonymizeOrigins masks stored and in-memory origins")
    void anonymizeOrigins() {
        LogEntry v4 = createFrom("1.2.3.4");
        LogEntry v6 = createFrom("2001:0db8:85a3::8a2e:0370:7334");
        LogEntry untouched = createFrom("9.8.7.6");

        LogCollection selected = accessLogService.search(LogFilter.builder()
                .ids(Set.of(v4.getId(), v6.getId()))
                .build());
        assertEquals(2, anonymizationService.anonymizeOrigins(selected));

        assertEquals("1.2.0.0", accessLogService.get(v4.getId()).orElseThrow().getRemoteOrigin().getHostAddress());
        assertEquals(RemoteOrigins.parse("2001:db8:85a3::"),
                accessLogService.get(v6.getId()).orElseThrow().getRemoteOrigin());
        assertEquals("9.8.7.6", accessLogService.get(untouched.getId()).orElseThrow().getRemoteOrigin().getHostAddress());
        assertEquals("1.2.0.0", selected.get(v4.getId()).orElseThrow().getRemoteOrigin().getHostAddress());
    }

    @Test
    @DisplayName("anonymizeOrigins skips entries no longer stored")
    void anonymizeOriginsSkipsDeleted() {
        LogEntry kept = createFrom("1.2.3.4");
        LogEntry deleted = createFrom("5.6.7.8");
        LogCollection selected = accessLogService.search(LogFilter.none());
        accessLogService.delete(deleted.getId());

        assertEquals(1, anonymizationService.anonymizeOrigins(selected));
        assertEquals("1.2.0.0", accessLogService.get(kept.getId()).orElseThrow().getRemoteOrigin().getHostAddress());
        assertEquals(0, anonymizationService.anonymizeOrigins(List.of()));
    }

    private LogEntry create(Identifier subject, Identifier object) {
        return accessLogService.create(CreateLogServiceRequest.builder()
                .subjectId(subject)
                .objectId(object)
                .build());
    }

    private LogEntry createFrom(String origin) {
        return accessLogService.create(CreateLogServiceRequest.builder()
                .remoteOrigin(RemoteOrigins.parse(origin))
                .build());
    }
}
