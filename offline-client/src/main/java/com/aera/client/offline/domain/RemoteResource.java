package com.aera.client.offline.domain;

import java.time.Instant;
import java.util.Map;

/**
 * Server copy of a resource. {@code lastModified} may be {@code null} when the server
 * does not report it, in which case no conflict is assumed.
 */
public record RemoteResource(String type, String id, Map<String, Object> fields, Instant lastModified) {

    public RemoteResource {
        fields = fields == null ? Map.of() : Map.copyOf(fields);
    }
}
