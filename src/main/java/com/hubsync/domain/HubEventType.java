package com.hubsync.domain;

import java.util.Arrays;

public enum HubEventType {
    MERGE_MESSAGE(1, "HUB_EVENT_TYPE_MERGE_MESSAGE"),
    PRUNE_MESSAGE(2, "HUB_EVENT_TYPE_PRUNE_MESSAGE"),
    REVOKE_MESSAGE(3, "HUB_EVENT_TYPE_REVOKE_MESSAGE"),
    MERGE_USERNAME_PROOF(6, "HUB_EVENT_TYPE_MERGE_USERNAME_PROOF"),
    MERGE_ON_CHAIN_EVENT(9, "HUB_EVENT_TYPE_MERGE_ON_CHAIN_EVENT");

    private final int code;
    private final String wireName;

    HubEventType(int code, String wireName) {
        this.code = code;
        this.wireName = wireName;
    }

    public int getCode() {
        return code;
    }

    public String getWireName() {
        return wireName;
    }

    public static HubEventType fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(wireName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown hub event type: " + wireName));
    }
}
