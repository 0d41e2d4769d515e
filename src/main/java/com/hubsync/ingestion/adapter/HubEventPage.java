package com.hubsync.ingestion.adapter;

import com.hubsync.domain.HubEvent;

import java.util.List;

/**
 * One page of the Hub event feed.
 *
 * @param lastEventId   highest event id seen on the page, including events of unknown type (0 if empty)
 * @param nextPageEventId id to request next; 0 when the Hub did not return one
 */
public record HubEventPage(List<HubEvent> events, long lastEventId, long nextPageEventId) {

    public HubEventPage {
        events = List.copyOf(events);
    }

    public boolean isEmpty() {
        return lastEventId == 0;
    }
}
