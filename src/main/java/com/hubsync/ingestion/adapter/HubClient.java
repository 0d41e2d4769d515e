package com.hubsync.ingestion.adapter;

import com.hubsync.domain.UserNameProof;

import java.util.List;

/**
 * Source-of-truth Hub. Every method throws {@link HubConnectionException} when the Hub cannot be reached,
 * answers with an error, or does not answer within the configured timeout.
 */
public interface HubClient {

    HubInfo getInfo();

    /**
     * Events with id {@code >= fromEventId}, oldest first. Ordering across calls follows event ids.
     */
    HubEventPage getEvents(long fromEventId);

    MessagePage getMessagesByFid(HubMessageQuery query, long fid, String pageToken, int pageSize);

    List<UserNameProof> getUserNameProofsByFid(long fid);
}
