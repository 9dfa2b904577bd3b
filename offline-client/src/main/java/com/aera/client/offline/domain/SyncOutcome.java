package com.aera.client.offline.domain;

import java.time.Instant;
import java.util.UUID;

/**
 * What happened to one mutation during a sync pass.
 */
public record SyncOutcome(
        UUID mutationId,
        MutationKind kind,
        String resourceType,
        String resourceId,
        SyncResult result,
        String detail,
        Instant at
) {
}
