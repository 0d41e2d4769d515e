package com.hubsync.ingestion.adapter;

import com.hubsync.domain.Message;

import java.util.List;

/**
 * One page of a by-fid message query. {@code nextPageToken} is null on the last page.
 */
public record MessagePage(List<Message> messages, String nextPageToken) {

    public MessagePage {
        messages = List.copyOf(messages);
        nextPageToken = nextPageToken == null || nextPageToken.isEmpty() ? null : nextPageToken;
    }

    public boolean hasNext() {
        return nextPageToken != null;
    }
}
