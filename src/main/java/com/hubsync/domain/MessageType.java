package com.hubsync.domain;

import java.util.Arrays;

/**
 * Hub message kinds with their wire names, numeric codes (stored in {@code messages.type}) and JSON body field.
 */
public enum MessageType {
    CAST_ADD(1, "MESSAGE_TYPE_CAST_ADD", "castAddBody"),
    CAST_REMOVE(2, "MESSAGE_TYPE_CAST_REMOVE", "castRemoveBody"),
    REACTION_ADD(3, "MESSAGE_TYPE_REACTION_ADD", "reactionBody"),
    REACTION_REMOVE(4, "MESSAGE_TYPE_REACTION_REMOVE", "reactionBody"),
    LINK_ADD(5, "MESSAGE_TYPE_LINK_ADD", "linkBody"),
    LINK_REMOVE(6, "MESSAGE_TYPE_LINK_REMOVE", "linkBody"),
    VERIFICATION_ADD_ETH_ADDRESS(7, "MESSAGE_TYPE_VERIFICATION_ADD_ETH_ADDRESS", "verificationAddAddressBody"),
    VERIFICATION_REMOVE(8, "MESSAGE_TYPE_VERIFICATION_REMOVE", "verificationRemoveBody"),
    USER_DATA_ADD(11, "MESSAGE_TYPE_USER_DATA_ADD", "userDataBody"),
    USERNAME_PROOF(12, "MESSAGE_TYPE_USERNAME_PROOF", "usernameProofBody"),
    FRAME_ACTION(13, "MESSAGE_TYPE_FRAME_ACTION", "frameActionBody"),
    LINK_COMPACT_STATE(14, "MESSAGE_TYPE_LINK_COMPACT_STATE", "linkCompactStateBody");

    private final int code;
    private final String wireName;
    private final String bodyField;

    MessageType(int code, String wireName, String bodyField) {
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

    /** Remove-type messages delete the message they target; their own merge moves state to DELETED. */
    public boolean isRemove() {
        return this == CAST_REMOVE || this == REACTION_REMOVE || this == LINK_REMOVE || this == VERIFICATION_REMOVE;
    }

    public static MessageType fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(wireName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown message type: " + wireName));
    }

    public static MessageType fromCode(int code) {
        return Arrays.stream(values())
                .filter(t -> t.code == code)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown message type code: " + code));
    }
}
