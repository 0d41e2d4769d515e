package com.hubsync.ingestion.adapter;

import com.hubsync.domain.MessageType;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * By-fid message sets the Hub HTTP API exposes, each yielding messages of one type.
 */
public enum HubMessageQuery {
    CASTS("/v1/castsByFid", Map.of(), MessageType.CAST_ADD),
    REACTION_LIKES("/v1/reactionsByFid", Map.of("reaction_type", "REACTION_TYPE_LIKE"), MessageType.REACTION_ADD),
    REACTION_RECASTS("/v1/reactionsByFid", Map.of("reaction_type", "REACTION_TYPE_RECAST"), MessageType.REACTION_ADD),
    LINKS("/v1/linksByFid", Map.of(), MessageType.LINK_ADD),
    VERIFICATIONS("/v1/verificationsByFid", Map.of(), MessageType.VERIFICATION_ADD_ETH_ADDRESS),
    USER_DATA("/v1/userDataByFid", Map.of(), MessageType.USER_DATA_ADD);

    private final String path;
    private final Map<String, Object> extraParams;
    private final MessageType messageType;

    HubMessageQuery(String path, Map<String, Object> extraParams, MessageType messageType) {
        this.path = path;
        this.extraParams = extraParams;
        this.messageType = messageType;
    }

    public String getPath() {
        return path;
    }

    public Map<String, Object> getExtraParams() {
        return extraParams;
    }

    public MessageType getMessageType() {
        return messageType;
    }

    /** Message types covered by reconciliation when no explicit types are given. */
    public static Set<MessageType> reconcilableTypes() {
        return Arrays.stream(values()).map(HubMessageQuery::getMessageType).collect(Collectors.toSet());
    }

    public static List<HubMessageQuery> forTypes(Set<MessageType> types) {
        return Arrays.stream(values()).filter(q -> types.contains(q.messageType)).toList();
    }
}
