package com.example.accesslog.http;

import com.example.accesslog.models.Identifier;
import com.example.accesslog.models.LogFilter;
import com.example.accesslog.models.RemoteOrigins;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import org.springframework.util.MultiValueMap;

/**
 * Builds a {@link LogFilter} from query parameters. Set-valued parameters may be repeated or
 * comma separated; parameters that are not filter keys are ignored.
 */
final class LogFilterParams {

    static final String IDS = "ids";
    static final String CREATED_AFTER = "created_after";
    static final String CREATED_BEFORE = "created_before";
    static final String SCOPES = "scopes";
    static final String REMOTE_ORIGINS = "remote_origins";
    static final String SUBJECT_IDS = "subject_ids";
    static final String OBJECT_IDS = "object_ids";

    private LogFilterParams() {
    }

    static LogFilter toFilter(MultiValueMap<String, String> params) {
        return LogFilter.builder()
                .ids(values(params, IDS, Identifier::parse))
                .createdAfter(number(params, CREATED_AFTER))
                .createdBefore(number(params, CREATED_BEFORE))
                .scopes(values(params, SCOPES, Function.identity()))
                .remoteOrigins(values(params, REMOTE_ORIGINS, RemoteOrigins::parse))
                .subjectIds(values(params, SUBJECT_IDS, Identifier::parse))
                .objectIds(values(params, OBJECT_IDS, Identifier::parse))
                .build();
    }

    static Long number(MultiValueMap<String, String> params, String key) {
        String raw = params.getFirst(key);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be an integer", ex);
        }
    }

    private static <T> Set<T> values(MultiValueMap<String, String> params, String key, Function<String, T> parser) {
        List<String> raw = params.getOrDefault(key, List.of());
        List<String> tokens = new ArrayList<>();
        for (String value : raw) {
            for (String token : value.split(",")) {
                if (!token.isBlank()) {
                    tokens.add(token.trim());
                }
            }
        }
        Set<T> parsed = new LinkedHashSet<>();
        for (String token : tokens) {
            parsed.add(parser.apply(token));
        }
        return parsed;
    }
}
