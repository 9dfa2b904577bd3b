package com.aera.client.offline.application;

import java.util.Map;
import java.util.Optional;

import com.aera.client.offline.domain.RemoteResource;

/**
 * Network side of the queue. Every method throws {@link RemoteCallException} on failure.
 */
public interface RemoteResourceGateway {

    boolean exists(String resourceType, String resourceId);

    Optional<RemoteResource> fetch(String resourceType, String resourceId);

    void create(String resourceType, String resourceId, Map<String, Object> payload);

    void update(String resourceType, String resourceId, Map<String, Object> payload);

    /**
     * Deleting a resource that is already gone succeeds.
     */
    void delete(String resourceType, String resourceId);
}
