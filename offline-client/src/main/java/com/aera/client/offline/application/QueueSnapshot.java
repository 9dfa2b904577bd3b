package com.aera.client.offline.application;

import java.util.List;

import com.aera.client.offline.domain.QueuedMutation;

public record QueueSnapshot(List<QueuedMutation> pending, List<QueuedMutation> failed, long nextSequence) {

    public QueueSnapshot {
        pending = pending == null ? List.of() : List.copyOf(pending);
        failed = failed == null ? List.of() : List.copyOf(failed);
    }

    public static QueueSnapshot empty() {
        return new QueueSnapshot(List.of(), List.of(), 0L);
    }
}
