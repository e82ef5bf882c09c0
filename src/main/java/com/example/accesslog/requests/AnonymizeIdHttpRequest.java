package com.example.accesslog.requests;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Optional body of POST /anonymize/ids/{id}. Omitting {@code new_id} lets the service pick a
 * random pseudonym.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnonymizeIdHttpRequest(
        @JsonProperty("new_id") String newId
) {}
