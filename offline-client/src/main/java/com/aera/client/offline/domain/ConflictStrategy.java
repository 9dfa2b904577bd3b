package com.aera.client.offline.domain;

public enum ConflictStrategy {
    /** Drop the local change when the server moved on. */
    SERVER_WINS,
    /** Overwrite the server; used for safety status and precise location. */
    CLIENT_WINS,
    /** Shallow union of both versions, local fields taking precedence. */
    MERGE
}
