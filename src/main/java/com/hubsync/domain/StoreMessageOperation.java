package com.hubsync.domain;

/**
 * Write performed on the messages table for one message.
 */
public enum StoreMessageOperation {
    MERGE,
    DELETE
}
