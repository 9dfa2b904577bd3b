package com.aera.client.offline.domain;

public enum SyncResult {
    APPLIED,
    SKIPPED_EXISTING,
    MERGED,
    CLIENT_OVERWROTE,
    SERVER_KEPT,
    SERVER_MISSING,
    RETRY_SCHEDULED,
    DEAD_LETTERED
}
