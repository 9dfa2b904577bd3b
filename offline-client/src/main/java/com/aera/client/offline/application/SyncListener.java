package com.aera.client.offline.application;

import com.aera.client.offline.domain.SyncOutcome;

@FunctionalInterface
public interface SyncListener {

    void onOutcome(SyncOutcome outcome);
}
