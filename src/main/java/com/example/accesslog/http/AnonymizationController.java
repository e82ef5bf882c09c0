package com.example.accesslog.http;

import com.example.accesslog.models.Identifier;
import com.example.accesslog.models.LogCollection;
import com.example.accesslog.models.LogFilter;
import com.example.accesslog.requests.AnonymizeIdHttpRequest;
import com.example.accesslog.service.AccessLogService;
import com.example.accesslog.service.AnonymizationService;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST entry point for privacy maintenance: replacing a subject/object identifier with a pseudonym
 * and coarsening the remote origins of matching logs.
 */
@RestController
public class AnonymizationController {

    private final AnonymizationService anonymizationService;
    private final AccessLogService accessLogService;

    public AnonymizationController(AnonymizationService anonymizationService,
                                   AccessLogService accessLogService) {
        this.anonymizationService = anonymizationService;
        this.accessLogService = accessLogService;
    }

    @PostMapping("/anonymize/ids/{id}")
    public ResponseEntity<Map<String, Object>> anonymizeId(
            @PathVariable String id,
            @RequestBody(required = false) AnonymizeIdHttpRequest request
    ) {
        Identifier newId = request == null || request.newId() == null || request.newId().isBlank()
                ? null
                : Identifier.parse(request.newId());

        Identifier replacement = anonymizationService.anonymizeId(Identifier.parse(id), newId);
        return ResponseEntity.ok(Map.of("new_id", replacement.toString()));
    }

    @PostMapping("/anonymize/origins")
    public ResponseEntity<Map<String, Object>> anonymizeOrigins(@RequestParam MultiValueMap<String, String> params) {
        LogFilter filter = LogFilterParams.toFilter(params);
        if (filter.isEmpty()) {
            throw new IllegalArgumentException("at least one filter parameter is required");
        }

        LogCollection logs = accessLogService.search(filter);
        int anonymized = anonymizationService.anonymizeOrigins(logs);
        return ResponseEntity.ok(Map.of("anonymized", anonymized));
    }
}
