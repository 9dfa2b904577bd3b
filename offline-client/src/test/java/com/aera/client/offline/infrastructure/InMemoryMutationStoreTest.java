package com.aera.client.offline.infrastructure;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.aera.client.offline.application.QueueSnapshot;
import com.aera.client.offline.domain.ConflictStrategy;
import com.aera.client.offline.domain.MutationKind;
import com.aera.client.offline.domain.QueuedMutation;

import org.junit.jupiter.api.Test;

class InMemoryMutationStoreTest {

    @Test
    void savedSnapshotIsDetachedFromCallerObjects() {
        InMemoryMutationStore store = new InMemoryMutationStore();
        QueuedMutation mutation = new QueuedMutation(UUID.randomUUID(), Instant.parse("2025-03-01T00:00:00Z"), 0,
                MutationKind.UPDATE, "help-requests", "h-1", Map.of("status", "safe"), ConflictStrategy.CLIENT_WINS);

        store.save(new QueueSnapshot(List.of(mutation), List.of(), 1));
        mutation.markInFlight();

        QueueSnapshot loaded = store.load();
        assertThat(loaded.pending()).singleElement()
                .satisfies(stored -> assertThat(stored.getState().name()).isEqualTo("PENDING"));
        assertThat(loaded.nextSequence()).isEqualTo(1);
    }
}
