package com.hubsync.domain;

import java.util.Arrays;

public enum OnChainEventType {
    SIGNER(1, "EVENT_TYPE_SIGNER", "signerEventBody"),
    SIGNER_MIGRATED(2, "EVENT_TYPE_SIGNER_MIGRATED", "signerMigratedEventBody"),
    ID_REGISTER(3, "EVENT_TYPE_ID_REGISTER", "idRegisterEventBody"),
    STORAGE_RENT(4, "EVENT_TYPE_STORAGE_RENT", "storageRentEventBody");

    private final int code;
    private final String wireName;
    private final String bodyField;

    OnChainEventType(int code, String wireName, String bodyField) {
        this.code = code;
        this.wireName = wireName;
        this.bodyField = bodyField;
    }

    public int getCode() {
        return code;
    }

    public String getWireName() {
        return wireName;
    }

    public String getBodyField() {
        return bodyField;
    }

    public static OnChainEventType fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(wireName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown on-chain event type: " + wireName));
    }
}
