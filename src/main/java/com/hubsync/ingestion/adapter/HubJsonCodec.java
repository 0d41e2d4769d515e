package com.hubsync.ingestion.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hubsync.domain.HubEvent;
import com.hubsync.domain.HubEventBody;
import com.hubsync.domain.HubEventBody.MergeMessageBody;
import com.hubsync.domain.HubEventBody.MergeOnChainEventBody;
import com.hubsync.domain.HubEventBody.MergeUsernameProofBody;
import com.hubsync.domain.HubEventBody.PruneMessageBody;
import com.hubsync.domain.HubEventBody.RevokeMessageBody;
import com.hubsync.domain.HubEventType;
import com.hubsync.domain.Message;
import com.hubsync.domain.MessageType;
import com.hubsync.domain.OnChainEvent;
import com.hubsync.domain.OnChainEventType;
import com.hubsync.domain.UserNameProof;
import com.hubsync.domain.UserNameType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads and writes Hub HTTP API JSON (events, messages, on-chain events, username proofs).
 * The durable stream stores events in this same form.
 */
@Slf4j
public class HubJsonCodec {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final ObjectMapper objectMapper;

    public HubJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JsonNode readTree(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed Hub JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parses one event node. Event types this service does not handle (block confirmations, merge failures)
     * come back empty.
     */
    public Optional<HubEvent> parseEvent(JsonNode node) {
        String wireType = node.path("type").asText();
        HubEventType type;
        try {
            type = HubEventType.fromWireName(wireType);
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring hub event {} of unhandled type {}", node.path("id").asLong(), wireType);
            return Optional.empty();
        }
        long id = node.path("id").asLong();
        HubEventBody body = switch (type) {
            case MERGE_MESSAGE -> {
                JsonNode merge = node.path("mergeMessageBody");
                List<Message> deleted = new ArrayList<>();
                for (JsonNode d : merge.path("deletedMessages")) {
                    deleted.add(parseMessage(d));
                }
                yield new MergeMessageBody(parseMessage(merge.path("message")), deleted);
            }
            case PRUNE_MESSAGE -> new PruneMessageBody(parseMessage(node.path("pruneMessageBody").path("message")));
            case REVOKE_MESSAGE -> new RevokeMessageBody(parseMessage(node.path("revokeMessageBody").path("message")));
            case MERGE_ON_CHAIN_EVENT ->
                    new MergeOnChainEventBody(parseOnChainEvent(node.path("mergeOnChainEventBody").path("onChainEvent")));
            case MERGE_USERNAME_PROOF -> {
                JsonNode merge = node.path("mergeUsernameProofBody");
                UserNameProof proof = merge.hasNonNull("usernameProof") ? parseUserNameProof(merge.get("usernameProof")) : null;
                UserNameProof deleted = merge.hasNonNull("deletedUsernameProof")
                        ? parseUserNameProof(merge.get("deletedUsernameProof")) : null;
                yield new MergeUsernameProofBody(proof, deleted);
            }
        };
        return Optional.of(new HubEvent(id, body));
    }

    public Message parseMessage(JsonNode node) {
        JsonNode data = node.path("data");
        if (data.isMissingNode() || !data.has("type")) {
            throw new IllegalArgumentException("Message without data: " + node);
        }
        MessageType type = MessageType.fromWireName(data.path("type").asText());
        JsonNode body = data.has(type.getBodyField()) ? data.get(type.getBodyField()) : NODES.objectNode();
        return new Message(
                node.path("hash").asText(),
                data.path("fid").asLong(),
                type,
                data.path("timestamp").asLong(),
                textOrNull(node, "signer"),
                textOrNull(node, "signature"),
                body);
    }

    public OnChainEvent parseOnChainEvent(JsonNode node) {
        OnChainEventType type = OnChainEventType.fromWireName(node.path("type").asText());
        JsonNode body = node.has(type.getBodyField()) ? node.get(type.getBodyField()) : NODES.objectNode();
        return new OnChainEvent(
                node.path("chainId").asLong(),
                node.path("blockNumber").asLong(),
                node.path("blockTimestamp").asLong(),
                node.path("logIndex").asInt(),
                node.path("transactionHash").asText(),
                type,
                node.path("fid").asLong(),
                body);
    }

    public UserNameProof parseUserNameProof(JsonNode node) {
        return new UserNameProof(
                node.path("name").asText(),
                node.path("fid").asLong(),
                node.path("owner").asText(),
                UserNameType.fromWireName(node.path("type").asText()),
                node.path("timestamp").asLong(),
                textOrNull(node, "signature"));
    }

    public String writeEvent(HubEvent event) {
        ObjectNode node = NODES.objectNode();
        node.put("type", event.type().getWireName());
        node.put("id", event.id());
        HubEventBody body = event.body();
        if (body instanceof MergeMessageBody merge) {
            ObjectNode m = node.putObject("mergeMessageBody");
            m.set("message", writeMessage(merge.message()));
            ArrayNode deleted = m.putArray("deletedMessages");
            merge.deletedMessages().forEach(d -> deleted.add(writeMessage(d)));
        } else if (body instanceof PruneMessageBody prune) {
            node.putObject("pruneMessageBody").set("message", writeMessage(prune.message()));
        } else if (body instanceof RevokeMessageBody revoke) {
            node.putObject("revokeMessageBody").set("message", writeMessage(revoke.message()));
        } else if (body instanceof MergeOnChainEventBody onChain) {
            node.putObject("mergeOnChainEventBody").set("onChainEvent", writeOnChainEvent(onChain.onChainEvent()));
        } else if (body instanceof MergeUsernameProofBody proof) {
            ObjectNode p = node.putObject("mergeUsernameProofBody");
            if (proof.usernameProof() != null) {
                p.set("usernameProof", writeUserNameProof(proof.usernameProof()));
            }
            if (proof.deletedUsernameProof() != null) {
                p.set("deletedUsernameProof", writeUserNameProof(proof.deletedUsernameProof()));
            }
        }
        return node.toString();
    }

    /**
     * Reverse of {@link #writeEvent(HubEvent)}. Unlike {@link #parseEvent(JsonNode)}, an unknown type is an error:
     * only handled events are ever written to the stream.
     */
    public HubEvent readEvent(String json) {
        return parseEvent(readTree(json))
                .orElseThrow(() -> new IllegalArgumentException("Stream payload is not a handled hub event"));
    }

    public ObjectNode writeMessage(Message message) {
        ObjectNode node = NODES.objectNode();
        ObjectNode data = node.putObject("data");
        data.put("type", message.type().getWireName());
        data.put("fid", message.fid());
        data.put("timestamp", message.timestamp());
        data.set(message.type().getBodyField(), message.body() != null ? message.body() : NODES.objectNode());
        node.put("hash", message.hash());
        if (message.signer() != null) {
            node.put("signer", message.signer());
        }
        if (message.signature() != null) {
            node.put("signature", message.signature());
        }
        return node;
    }

    private ObjectNode writeOnChainEvent(OnChainEvent event) {
        ObjectNode node = NODES.objectNode();
        node.put("type", event.type().getWireName());
        node.put("chainId", event.chainId());
        node.put("blockNumber", event.blockNumber());
        node.put("blockTimestamp", event.blockTimestamp());
        node.put("logIndex", event.logIndex());
        node.put("transactionHash", event.txHash());
        node.put("fid", event.fid());
        node.set(event.type().getBodyField(), event.body() != null ? event.body() : NODES.objectNode());
        return node;
    }

    private ObjectNode writeUserNameProof(UserNameProof proof) {
        ObjectNode node = NODES.objectNode();
        node.put("timestamp", proof.timestamp());
        node.put("name", proof.name());
        node.put("owner", proof.owner());
        if (proof.signature() != null) {
            node.put("signature", proof.signature());
        }
        node.put("fid", proof.fid());
        node.put("type", proof.type().getWireName());
        return node;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }
}
