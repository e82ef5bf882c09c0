package com.example.accesslog.requests;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * HTTP-layer payload captured from client POST /logs requests. Identifiers are in their canonical
 * text form and the remote origin is an IP literal; omitted fields take the store defaults. The
 * scope length limit is configurable and enforced by the service.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreateLogHttpRequest(
        @JsonProperty("id") String id,
        @JsonProperty("creation_time") @PositiveOrZero Long creationTime,
        @JsonProperty("scope") String scope,
        @JsonProperty("remote_origin") String remoteOrigin,
        @JsonProperty("subject_id") String subjectId,
        @JsonProperty("object_id") String objectId
) {}
