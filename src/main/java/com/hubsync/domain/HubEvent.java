package com.hubsync.domain;

import java.util.Objects;

/**
 * One entry of the Hub's event log. Ids increase monotonically; immutable once emitted.
 */
public record HubEvent(long id, HubEventBody body) {

    public HubEvent {
        Objects.requireNonNull(body, "body");
    }

    public HubEventType type() {
        return body.type();
    }

    public long fid() {
        return body.fid();
    }
}
