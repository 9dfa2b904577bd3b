package com.aera.client.offline.application;

/**
 * Durable storage for the device queue. Implementations replace the whole snapshot on save.
 */
public interface MutationStore {

    QueueSnapshot load();

    void save(QueueSnapshot snapshot);
}
