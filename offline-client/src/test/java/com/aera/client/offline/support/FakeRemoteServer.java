package com.aera.client.offline.support;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import com.aera.client.offline.application.RemoteCallException;
import com.aera.client.offline.application.RemoteResourceGateway;
import com.aera.client.offline.domain.RemoteResource;

/**
 * In-memory server shared by several device queues. Every write stamps {@code lastModified}
 * from the server clock.
 */
public class FakeRemoteServer implements RemoteResourceGateway {

    private final Clock clock;
    private final Map<String, RemoteResource> resources = new ConcurrentHashMap<>();
    private final Deque<RemoteCallException> scriptedFailures = new ArrayDeque<>();
    private final List<String> calls = new ArrayList<>();

    public FakeRemoteServer(Clock clock) {
        this.clock = clock;
    }

    public synchronized void seed(String type, String id, Map<String, Object> fields) {
        resources.put(key(type, id), new RemoteResource(type, id, fields, clock.instant()));
    }

    public synchronized void failNext(RemoteCallException failure) {
        scriptedFailures.addLast(failure);
    }

    public Optional<RemoteResource> resource(String type, String id) {
        return Optional.ofNullable(resources.get(key(type, id)));
    }

    public synchronized List<String> calls() {
        return List.copyOf(calls);
    }

    @Override
    public synchronized boolean exists(String resourceType, String resourceId) {
        call("EXISTS", resourceType, resourceId);
        return resources.containsKey(key(resourceType, resourceId));
    }

    @Override
    public synchronized Optional<RemoteResource> fetch(String resourceType, String resourceId) {
        call("GET", resourceType, resourceId);
        return resource(resourceType, resourceId);
    }

    @Override
    public synchronized void create(String resourceType, String resourceId, Map<String, Object> payload) {
        call("POST", resourceType, resourceId);
        write(resourceType, resourceId, payload);
    }

    @Override
    public synchronized void update(String resourceType, String resourceId, Map<String, Object> payload) {
        call("PUT", resourceType, resourceId);
        if (!resources.containsKey(key(resourceType, resourceId))) {
            throw new RemoteCallException(false, 404, "not found");
        }
        write(resourceType, resourceId, payload);
    }

    @Override
    public synchronized void delete(String resourceType, String resourceId) {
        call("DELETE", resourceType, resourceId);
        resources.remove(key(resourceType, resourceId));
    }

    private void call(String method, String type, String id) {
        calls.add(method + " " + type + "/" + id);
        RemoteCallException failure = scriptedFailures.pollFirst();
        if (failure != null) {
            throw failure;
        }
    }

    private void write(String type, String id, Map<String, Object> payload) {
        resources.put(key(type, id), new RemoteResource(type, id, new LinkedHashMap<>(payload), clock.instant()));
    }

    private static String key(String type, String id) {
        return type + "/" + id;
    }
}
