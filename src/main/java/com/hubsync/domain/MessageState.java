package com.hubsync.domain;

/**
 * Store-visible lifecycle of a message. Only moves CREATED to DELETED.
 */
public enum MessageState {
    CREATED,
    DELETED
}
