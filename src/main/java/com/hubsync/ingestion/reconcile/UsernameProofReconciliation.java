package com.hubsync.ingestion.reconcile;

import com.hubsync.common.Result;
import com.hubsync.domain.UserNameProof;
import com.hubsync.domain.UserNameType;
import com.hubsync.ingestion.adapter.HubClient;
import com.hubsync.ingestion.adapter.HubConnectionException;
import com.hubsync.ingestion.store.UsernameProofStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compares username proofs per type. Proofs match on name, owner, fid and type; the timestamp is not part of the
 * identity. When the store holds several rows for one identity only the most recent one is compared.
 * <p>
 * The Hub is queried once per call, before anything is reported, so a Hub failure reports nothing.
 * Times are Unix seconds. The store query is widened by one second on each side, the Hub side is filtered exactly.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class UsernameProofReconciliation {

    private static final long STORE_BOUND_PAD_SECONDS = 1;

    private final HubClient hubClient;
    private final UsernameProofStore usernameProofStore;

    public Result<ReconciliationSummary> reconcileUsernameProofsForFid(long fid,
                                                                       HubProofCallback onHubProof,
                                                                       DbProofCallback onDbProof) {
        return reconcileUsernameProofsForFid(fid, onHubProof, onDbProof, null, null, null);
    }

    /**
     * @param onDbProof may be null when only Hub-side reports are wanted
     * @param types     proof types to compare; null or empty means all
     */
    public Result<ReconciliationSummary> reconcileUsernameProofsForFid(long fid,
                                                                       HubProofCallback onHubProof,
                                                                       DbProofCallback onDbProof,
                                                                       Long startTime,
                                                                       Long stopTime,
                                                                       Set<UserNameType> types) {
        TimeRange range;
        try {
            range = TimeRange.of(startTime, stopTime);
        } catch (InvalidTimeRangeException e) {
            log.error("Skipping username proof reconciliation for fid {}: {}", fid, e.getMessage());
            return Result.success(ReconciliationSummary.skipped(fid));
        }
        Set<UserNameType> selected = types == null || types.isEmpty()
                ? EnumSet.allOf(UserNameType.class)
                : EnumSet.copyOf(types);
        List<UserNameProof> hubProofs;
        Map<UserNameType, Map<String, UserNameProof>> storedByType = new EnumMap<>(UserNameType.class);
        try {
            hubProofs = hubClient.getUserNameProofsByFid(fid).stream()
                    .filter(p -> selected.contains(p.type()) && range.contains(p.timestamp()))
                    .toList();
            for (UserNameType type : selected) {
                storedByType.put(type, latestByIdentity(usernameProofStore.findByFid(fid, type,
                        range.start() != null ? Instant.ofEpochSecond(range.start() - STORE_BOUND_PAD_SECONDS) : null,
                        range.stop() != null ? Instant.ofEpochSecond(range.stop() + STORE_BOUND_PAD_SECONDS) : null)));
            }
        } catch (HubConnectionException e) {
            log.error("Username proof reconciliation for fid {} failed, Hub unavailable: {}", fid, e.getMessage());
            return Result.failure("Hub unavailable for fid " + fid + ": " + e.getMessage(), e);
        } catch (DataAccessException e) {
            log.error("Username proof reconciliation for fid {} failed reading the store: {}", fid, e.getMessage());
            return Result.failure("Store unavailable for fid " + fid + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            log.error("Username proof reconciliation for fid {} failed reading proofs: {}", fid, e.getMessage());
            return Result.failure("Reconciliation failed for fid " + fid + ": " + e.getMessage(), e);
        }

        ReconciliationSummary total = new ReconciliationSummary(fid, 0, 0, 0, 0, 0, 0, false);
        try {
            for (UserNameType type : selected) {
                List<UserNameProof> hubOfType = hubProofs.stream().filter(p -> p.type() == type).toList();
                total = total.plus(report(fid, type, hubOfType, storedByType.get(type), onHubProof, onDbProof));
            }
        } catch (RuntimeException e) {
            log.error("Username proof reconciliation for fid {} failed: {}", fid, e.getMessage());
            return Result.failure("Reconciliation failed for fid " + fid + ": " + e.getMessage(), e);
        }
        return Result.success(total);
    }

    private ReconciliationSummary report(long fid, UserNameType type, List<UserNameProof> hubProofs,
                                         Map<String, UserNameProof> stored,
                                         HubProofCallback onHubProof, DbProofCallback onDbProof) {
        Set<String> hubKeys = new HashSet<>();
        int missingInDb = 0;
        int missingInHub = 0;
        for (UserNameProof proof : hubProofs) {
            hubKeys.add(proof.identityKey());
            boolean absent = !stored.containsKey(proof.identityKey());
            if (absent) {
                missingInDb++;
            }
            onHubProof.onHubProof(proof, absent);
        }
        for (UserNameProof proof : stored.values()) {
            boolean absent = !hubKeys.contains(proof.identityKey());
            if (absent) {
                missingInHub++;
            }
            if (onDbProof != null) {
                onDbProof.onDbProof(proof, absent);
            }
        }
        log.debug("Reconciled {} proofs for fid {}: hub={} db={} missingInDb={} missingInHub={}",
                type, fid, hubProofs.size(), stored.size(), missingInDb, missingInHub);
        return new ReconciliationSummary(fid, hubProofs.size(), stored.size(), missingInDb, missingInHub, 0, 0, false);
    }

    private static Map<String, UserNameProof> latestByIdentity(List<UserNameProof> rows) {
        Map<String, UserNameProof> latest = new LinkedHashMap<>();
        for (UserNameProof proof : rows) {
            UserNameProof existing = latest.get(proof.identityKey());
            if (existing == null || proof.timestamp() > existing.timestamp()) {
                latest.put(proof.identityKey(), proof);
            }
        }
        return latest;
    }
}
