package com.hubsync.domain;

import java.util.Arrays;

public enum UserNameType {
    FNAME(1, "USERNAME_TYPE_FNAME"),
    ENS_L1(2, "USERNAME_TYPE_ENS_L1");

    private final int code;
    private final String wireName;

    UserNameType(int code, String wireName) {
        this.code = code;
        this.wireName = wireName;
    }

    public int getCode() {
        return code;
    }

    public String getWireName() {
        return wireName;
    }

    public static UserNameType fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(wireName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown username type: " + wireName));
    }

    public static UserNameType fromCode(int code) {
        return Arrays.stream(values())
                .filter(t -> t.code == code)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown username type code: " + code));
    }
}
