package com.example.accesslog.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LogEntryResponse(
        @JsonProperty("id") String id,
        @JsonProperty("creation_time") Long creationTime,
        @JsonProperty("scope") String scope,
        @JsonProperty("remote_origin") String remoteOrigin,
        @JsonProperty("subject_id") String subjectId,
        @JsonProperty("object_id") String objectId
) { }
