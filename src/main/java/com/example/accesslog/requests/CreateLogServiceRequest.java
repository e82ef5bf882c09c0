package com.example.accesslog.requests;

import com.example.accesslog.models.Identifier;
import java.net.InetAddress;
import lombok.Builder;

/**
 * Service command for creating a log entry. Every field is optional; the service fills in the
 * generated id, the current time, the default origin and the zero subject/object ids.
 */
@Builder
public record CreateLogServiceRequest(
        Identifier id,
        Long creationTime,
        String scope,
        InetAddress remoteOrigin,
        Identifier subjectId,
        Identifier objectId
) {
    public CreateLogServiceRequest {
        if (creationTime != null && creationTime < 0) {
            throw new IllegalArgumentException("creationTime must be >= 0");
        }
    }
}
