package com.aera.client.offline.application;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.aera.client.offline.domain.ConflictStrategy;
import com.aera.client.offline.domain.SyncResult;

/**
 * Decides what to send when the server copy changed after the local edit.
 */
public class ConflictResolver {

    static final String UPDATED_AT_FIELD = "updatedAt";

    private final Clock clock;

    public ConflictResolver(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Resolution resolve(
            Map<String, Object> serverFields,
            Map<String, Object> clientFields,
            ConflictStrategy strategy
    ) {
        Map<String, Object> server = serverFields == null ? Map.of() : serverFields;
        Map<String, Object> client = clientFields == null ? Map.of() : clientFields;
        return switch (strategy) {
            case SERVER_WINS -> new Resolution(new LinkedHashMap<>(server), false, SyncResult.SERVER_KEPT);
            case CLIENT_WINS -> new Resolution(new LinkedHashMap<>(client), true, SyncResult.CLIENT_OVERWROTE);
            case MERGE -> {
                Map<String, Object> merged = new LinkedHashMap<>(server);
                merged.putAll(client);
                merged.put(UPDATED_AT_FIELD, clock.instant().toString());
                yield new Resolution(merged, true, SyncResult.MERGED);
            }
        };
    }

    public record Resolution(Map<String, Object> payload, boolean applyToServer, SyncResult outcome) {
    }
}
