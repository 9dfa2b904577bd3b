package com.aera.client.offline.infrastructure;

import java.util.concurrent.atomic.AtomicReference;

import com.aera.client.offline.application.MutationStore;
import com.aera.client.offline.application.QueueSnapshot;
import com.aera.client.offline.domain.QueuedMutation;

/**
 * Non-durable store for tests and for devices without writable storage.
 */
public class InMemoryMutationStore implements MutationStore {

    private final AtomicReference<QueueSnapshot> snapshot = new AtomicReference<>(QueueSnapshot.empty());

    @Override
    public QueueSnapshot load() {
        return detach(snapshot.get());
    }

    @Override
    public void save(QueueSnapshot next) {
        snapshot.set(detach(next));
    }

    private static QueueSnapshot detach(QueueSnapshot source) {
        return new QueueSnapshot(
                source.pending().stream().map(QueuedMutation::copy).toList(),
                source.failed().stream().map(QueuedMutation::copy).toList(),
                source.nextSequence()
        );
    }
}
