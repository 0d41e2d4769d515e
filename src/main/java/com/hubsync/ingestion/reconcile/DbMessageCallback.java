package com.hubsync.ingestion.reconcile;

import com.hubsync.domain.Message;

@FunctionalInterface
public interface DbMessageCallback {

    void onDbMessage(Message message, boolean missingInHub);
}
