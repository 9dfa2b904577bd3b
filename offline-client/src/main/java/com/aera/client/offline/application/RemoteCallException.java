package com.aera.client.offline.application;

public class RemoteCallException extends RuntimeException {

    /** Status used when no HTTP response was received. */
    public static final int NO_RESPONSE = 0;

    private final boolean retryable;
    private final int status;

    public RemoteCallException(boolean retryable, int status, String message) {
        this(retryable, status, message, null);
    }

    public RemoteCallException(boolean retryable, int status, String message, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
        this.status = status;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public int getStatus() {
        return status;
    }
}
