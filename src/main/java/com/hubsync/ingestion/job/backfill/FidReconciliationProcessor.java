package com.hubsync.ingestion.job.backfill;

import com.hubsync.common.Result;
import com.hubsync.domain.Message;
import com.hubsync.ingestion.processor.HubEventProcessor;
import com.hubsync.ingestion.processor.MessageHandler;
import com.hubsync.ingestion.reconcile.MessageReconciliation;
import com.hubsync.ingestion.reconcile.ReconciliationSummary;
import com.hubsync.ingestion.reconcile.UsernameProofReconciliation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reconciles one fid: stores messages the store is missing, then compares username proofs. Other divergences
 * are logged.
 * <p>
 * Missing messages are only collected while the Hub is walked and stored once the whole walk succeeded, so a Hub
 * failure part-way (possible in streaming mode, where reports arrive page by page) leaves the store untouched.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FidReconciliationProcessor {

    private final MessageReconciliation messageReconciliation;
    private final UsernameProofReconciliation usernameProofReconciliation;
    private final HubEventProcessor hubEventProcessor;
    private final MessageHandler messageHandler;

    public Result<ReconciliationSummary> reconcileFid(long fid) {
        List<Message> missing = new ArrayList<>();
        Result<ReconciliationSummary> messages = messageReconciliation.reconcileMessagesForFid(fid,
                (message, missingInDb, prunedInDb, revokedInDb) -> {
                    if (missingInDb) {
                        missing.add(message);
                    } else if (prunedInDb) {
                        log.info("Message {} for fid {} is pruned in the store but still on the hub", message.hash(), fid);
                    } else if (revokedInDb) {
                        log.info("Message {} for fid {} is revoked in the store but still on the hub", message.hash(), fid);
                    }
                },
                (message, missingInHub) -> {
                    if (missingInHub) {
                        log.info("Message {} ({}) for fid {} is in the store but not on the hub",
                                message.hash(), message.type(), fid);
                    }
                });
        if (messages.isFailure()) {
            if (!missing.isEmpty()) {
                log.debug("Dropping {} pending repair(s) for fid {} after a failed reconciliation", missing.size(), fid);
            }
            return messages;
        }
        List<String> repairFailures = new ArrayList<>();
        for (Message message : missing) {
            repairMissing(message, repairFailures);
        }
        if (!repairFailures.isEmpty()) {
            return Result.failure("fid " + fid + ": " + repairFailures.size() + " missing message(s) not stored, first: "
                    + repairFailures.get(0));
        }

        Result<ReconciliationSummary> proofs = usernameProofReconciliation.reconcileUsernameProofsForFid(fid,
                (proof, missingInDb) -> {
                    if (missingInDb) {
                        log.info("Username proof {} ({}) for fid {} is on the hub but not in the store",
                                proof.name(), proof.type(), fid);
                    }
                },
                (proof, missingInHub) -> {
                    if (missingInHub) {
                        log.info("Username proof {} ({}) for fid {} is in the store but not on the hub",
                                proof.name(), proof.type(), fid);
                    }
                });
        if (proofs.isFailure()) {
            return proofs;
        }
        return Result.success(messages.orElseThrow());
    }

    private void repairMissing(Message message, List<String> failures) {
        Result<Boolean> stored = hubEventProcessor.handleMissingMessage(message, messageHandler);
        if (stored.isFailure()) {
            failures.add(stored.getErrorMessage().orElse(message.hash()));
        } else if (stored.getValue().orElse(false)) {
            log.info("Stored missed message {} ({}) for fid {}", message.hash(), message.type(), message.fid());
        }
    }
}
