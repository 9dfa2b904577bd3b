package com.aera.client.offline.infrastructure;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import com.aera.client.offline.application.ConnectivityMonitor;

/**
 * Connectivity flag driven by the host application (for example from the platform's network
 * callback). Listeners fire only on an offline to online transition.
 */
public class ManualConnectivityMonitor implements ConnectivityMonitor {

    private final AtomicBoolean online;
    private final List<Runnable> reconnectListeners = new CopyOnWriteArrayList<>();

    public ManualConnectivityMonitor(boolean initiallyOnline) {
        this.online = new AtomicBoolean(initiallyOnline);
    }

    @Override
    public boolean isOnline() {
        return online.get();
    }

    @Override
    public void addReconnectListener(Runnable listener) {
        reconnectListeners.add(listener);
    }

    @Override
    public void removeReconnectListener(Runnable listener) {
        reconnectListeners.remove(listener);
    }

    public void setOnline(boolean value) {
        boolean previous = online.getAndSet(value);
        if (value && !previous) {
            reconnectListeners.forEach(Runnable::run);
        }
    }
}
