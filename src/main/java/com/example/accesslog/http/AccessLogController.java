package com.example.accesslog.http;

import com.example.accesslog.models.Identifier;
import com.example.accesslog.models.LogCollection;
import com.example.accesslog.models.LogEntry;
import com.example.accesslog.models.LogFilter;
import com.example.accesslog.models.LogSort;
import com.example.accesslog.models.Pagination;
import com.example.accesslog.models.RemoteOrigins;
import com.example.accesslog.requests.CreateLogHttpRequest;
import com.example.accesslog.requests.CreateLogServiceRequest;
import com.example.accesslog.service.AccessLogService;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.SortedSet;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST entry point for writing and auditing access logs. Filters are passed as query parameters
 * (see {@link LogFilterParams}); searches accept {@code sort}, {@code order}, {@code page} and
 * {@code per_page}.
 */
@RestController
public class AccessLogController {

    private final AccessLogService accessLogService;

    public AccessLogController(AccessLogService accessLogService) {
        this.accessLogService = accessLogService;
    }

    @PostMapping("/logs")
    public ResponseEntity<LogEntryResponse> createLog(@Valid @RequestBody CreateLogHttpRequest request) {
        CreateLogServiceRequest createRequest = CreateLogServiceRequest.builder()
                .id(optionalId(request.id()))
                .creationTime(request.creationTime())
                .scope(request.scope())
                .remoteOrigin(isBlank(request.remoteOrigin()) ? null : RemoteOrigins.parse(request.remoteOrigin()))
                .subjectId(optionalId(request.subjectId()))
                .objectId(optionalId(request.objectId()))
                .build();

        LogEntry entry = accessLogService.create(createRequest);

        return ResponseEntity.created(URI.create("/logs/" + entry.getId()))
                .body(map(entry));
    }

    @GetMapping("/logs/{id}")
    public ResponseEntity<LogEntryResponse> getLog(@PathVariable String id) {
        return accessLogService.get(Identifier.parse(id))
                .map(this::map)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/logs")
    public ResponseEntity<List<LogEntryResponse>> searchLogs(@RequestParam MultiValueMap<String, String> params) {
        LogFilter filter = LogFilterParams.toFilter(params);
        LogSort sort = LogSort.of(params.getFirst("sort"), params.getFirst("order"));
        Pagination pagination = pagination(params);

        LogCollection logs = accessLogService.search(filter, sort, pagination);
        List<LogEntryResponse> response = logs.values().stream()
                .map(this::map)
                .toList();
        return ResponseEntity.ok(response);
    }

    @GetMapping("/logs/count")
    public ResponseEntity<Map<String, Object>> countLogs(@RequestParam MultiValueMap<String, String> params) {
        long count = accessLogService.count(LogFilterParams.toFilter(params));
        return ResponseEntity.ok(Map.of("count", count));
    }

    @GetMapping("/logs/scopes")
    public ResponseEntity<SortedSet<String>> uniqueScopes() {
        return ResponseEntity.ok(accessLogService.uniqueScopes());
    }

    @DeleteMapping("/logs/{id}")
    public ResponseEntity<Void> deleteLog(@PathVariable String id) {
        accessLogService.delete(Identifier.parse(id));
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/logs")
    public ResponseEntity<Map<String, Object>> pruneLogs(
            @RequestParam(value = "created_before", required = false) Long createdBefore
    ) {
        int pruned = accessLogService.prune(createdBefore == null
                ? OptionalLong.empty()
                : OptionalLong.of(createdBefore));
        return ResponseEntity.ok(Map.of("pruned", pruned));
    }

    private Pagination pagination(MultiValueMap<String, String> params) {
        Long perPage = LogFilterParams.number(params, "per_page");
        if (perPage == null) {
            return Pagination.all();
        }
        Long page = LogFilterParams.number(params, "page");
        return Pagination.of(page == null ? 0 : Math.toIntExact(page), Math.toIntExact(perPage));
    }

    private static Identifier optionalId(String raw) {
        return isBlank(raw) ? null : Identifier.parse(raw);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private LogEntryResponse map(LogEntry entry) {
        return new LogEntryResponse(
                entry.getId().toString(),
                entry.getCreationTime(),
                entry.getScope(),
                entry.getRemoteOrigin().getHostAddress(),
                entry.getSubjectId().toString(),
                entry.getObjectId().toString()
        );
    }
}
