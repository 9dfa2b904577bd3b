package com.aera.client.offline.domain;

public enum MutationKind {
    CREATE,
    UPDATE,
    DELETE
}
