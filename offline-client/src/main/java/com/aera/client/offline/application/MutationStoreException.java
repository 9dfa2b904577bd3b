package com.aera.client.offline.application;

public class MutationStoreException extends RuntimeException {

    public MutationStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
