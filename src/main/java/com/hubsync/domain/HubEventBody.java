package com.hubsync.domain;

import java.util.List;
import java.util.Objects;

/**
 * Payload of a {@link HubEvent}, one variant per event type.
 */
public sealed interface HubEventBody {

    HubEventType type();

    /** Owning identity of the event. */
    long fid();

    record MergeMessageBody(Message message, List<Message> deletedMessages) implements HubEventBody {

        public MergeMessageBody {
            Objects.requireNonNull(message, "message");
            deletedMessages = deletedMessages == null ? List.of() : List.copyOf(deletedMessages);
        }

        @Override
        public HubEventType type() {
            return HubEventType.MERGE_MESSAGE;
        }

        @Override
        public long fid() {
            return message.fid();
        }
    }

    record PruneMessageBody(Message message) implements HubEventBody {

        public PruneMessageBody {
            Objects.requireNonNull(message, "message");
        }

        @Override
        public HubEventType type() {
            return HubEventType.PRUNE_MESSAGE;
        }

        @Override
        public long fid() {
            return message.fid();
        }
    }

    record RevokeMessageBody(Message message) implements HubEventBody {

        public RevokeMessageBody {
            Objects.requireNonNull(message, "message");
        }

        @Override
        public HubEventType type() {
            return HubEventType.REVOKE_MESSAGE;
        }

        @Override
        public long fid() {
            return message.fid();
        }
    }

    record MergeOnChainEventBody(OnChainEvent onChainEvent) implements HubEventBody {

        public MergeOnChainEventBody {
            Objects.requireNonNull(onChainEvent, "onChainEvent");
        }

        @Override
        public HubEventType type() {
            return HubEventType.MERGE_ON_CHAIN_EVENT;
        }

        @Override
        public long fid() {
            return onChainEvent.fid();
        }
    }

    /**
     * @param deletedUsernameProof proof replaced by this merge (name transfer), may be null
     */
    record MergeUsernameProofBody(UserNameProof usernameProof, UserNameProof deletedUsernameProof) implements HubEventBody {

        public MergeUsernameProofBody {
            if (usernameProof == null && deletedUsernameProof == null) {
                throw new IllegalArgumentException("username proof event carries neither a proof nor a deleted proof");
            }
        }

        @Override
        public HubEventType type() {
            return HubEventType.MERGE_USERNAME_PROOF;
        }

        @Override
        public long fid() {
            return usernameProof != null ? usernameProof.fid() : deletedUsernameProof.fid();
        }
    }
}
