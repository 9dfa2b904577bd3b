package com.aera.client.offline.application;

public interface ConnectivityMonitor {

    boolean isOnline();

    /**
     * Registers a callback invoked each time the device goes from offline to online.
     */
    void addReconnectListener(Runnable listener);

    void removeReconnectListener(Runnable listener);
}
