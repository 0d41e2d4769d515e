package com.hubsync.ingestion.reconcile;

import com.hubsync.HubFixtures;
import com.hubsync.common.Result;
import com.hubsync.domain.UserNameProof;
import com.hubsync.domain.UserNameType;
import com.hubsync.ingestion.adapter.HubClient;
import com.hubsync.ingestion.adapter.HubConnectionException;
import com.hubsync.ingestion.store.UsernameProofStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class UsernameProofReconciliationTest {

    private static final long FID = 7;

    @Mock
    private HubClient hubClient;
    @Mock
    private UsernameProofStore usernameProofStore;

    private UsernameProofReconciliation reconciliation;
    private final List<String> hubReports = new ArrayList<>();
    private final List<String> dbReports = new ArrayList<>();

    @BeforeEach
    void setUp() {
        reconciliation = new UsernameProofReconciliation(hubClient, usernameProofStore);
        when(hubClient.getUserNameProofsByFid(FID)).thenReturn(List.of());
        when(usernameProofStore.findByFid(anyLong(), any(), any(), any())).thenReturn(List.of());
    }

    private Result<ReconciliationSummary> run(Long start, Long stop, Set<UserNameType> types) {
        return reconciliation.reconcileUsernameProofsForFid(FID,
                (proof, missingInDb) -> hubReports.add(proof.owner() + ":" + missingInDb),
                (proof, missingInHub) -> dbReports.add(proof.owner() + "@" + proof.timestamp() + ":" + missingInHub),
                start, stop, types);
    }

    @Test
    @DisplayName("of two store rows with the same identity only the most recent one is compared")
    void latestStoreProofWins() {
        UserNameProof older = HubFixtures.fname("alice", FID, "0xa", 1_000);
        UserNameProof newer = HubFixtures.fname("alice", FID, "0xa", 2_000);
        when(usernameProofStore.findByFid(eq(FID), eq(UserNameType.FNAME), any(), any())).thenReturn(List.of(newer, older));
        when(hubClient.getUserNameProofsByFid(FID)).thenReturn(List.of(HubFixtures.fname("alice", FID, "0xa", 2_000)));

        Result<ReconciliationSummary> result = run(null, null, null);

        assertThat(result.isSuccess()).isTrue();
        assertThat(hubReports).containsExactly("0xa:false");
        assertThat(dbReports).containsExactly("0xa@2000:false");
    }

    @Test
    void ownerChangeIsMissingOnBothSides() {
        when(usernameProofStore.findByFid(eq(FID), eq(UserNameType.FNAME), any(), any()))
                .thenReturn(List.of(HubFixtures.fname("alice", FID, "0xold", 1_000)));
        when(hubClient.getUserNameProofsByFid(FID)).thenReturn(List.of(HubFixtures.fname("alice", FID, "0xnew", 2_000)));

        run(null, null, Set.of(UserNameType.FNAME));

        assertThat(hubReports).containsExactly("0xnew:true");
        assertThat(dbReports).containsExactly("0xold@1000:true");
    }

    @Test
    void storeProofsReportedEvenWhenHubHasNone() {
        when(usernameProofStore.findByFid(eq(FID), eq(UserNameType.FNAME), any(), any()))
                .thenReturn(List.of(HubFixtures.fname("alice", FID, "0xa", 1_000)));

        run(null, null, Set.of(UserNameType.FNAME));

        assertThat(hubReports).isEmpty();
        assertThat(dbReports).containsExactly("0xa@1000:true");
    }

    @Test
    @DisplayName("hub failure surfaces without any report or store query")
    void hubFailure_reportsNothing() {
        when(hubClient.getUserNameProofsByFid(FID)).thenThrow(new HubConnectionException("Hub unreachable"));

        Result<ReconciliationSummary> result = run(null, null, null);

        assertThat(result.isFailure()).isTrue();
        assertThat(hubReports).isEmpty();
        assertThat(dbReports).isEmpty();
        verify(usernameProofStore, never()).findByFid(anyLong(), any(), any(), any());
    }

    @Test
    void unparseableHubProof_isFailureResult() {
        when(hubClient.getUserNameProofsByFid(FID))
                .thenThrow(new IllegalArgumentException("Unknown username type: USERNAME_TYPE_BASENAME"));

        Result<ReconciliationSummary> result = run(null, null, null);

        assertThat(result.isFailure()).isTrue();
        assertThat(result.getCause()).containsInstanceOf(IllegalArgumentException.class);
        assertThat(hubReports).isEmpty();
    }

    @Test
    void unreadableStoreRow_isFailureResult() {
        when(usernameProofStore.findByFid(eq(FID), eq(UserNameType.ENS_L1), any(), any()))
                .thenThrow(new IllegalArgumentException("Unknown username type code: 3"));

        Result<ReconciliationSummary> result = run(null, null, null);

        assertThat(result.isFailure()).isTrue();
        assertThat(dbReports).isEmpty();
    }

    @Test
    void timeRange_exactOnHubPaddedOnStore() {
        UserNameProof inRange = HubFixtures.fname("alice", FID, "0xa", 1_500);
        UserNameProof before = HubFixtures.fname("bob", FID, "0xb", 999);
        when(hubClient.getUserNameProofsByFid(FID)).thenReturn(List.of(inRange, before));

        run(1_000L, 2_000L, Set.of(UserNameType.FNAME));

        assertThat(hubReports).containsExactly("0xa:true");
        verify(usernameProofStore).findByFid(FID, UserNameType.FNAME, Instant.ofEpochSecond(999), Instant.ofEpochSecond(2_001));
    }

    @Test
    void typesFilterHubProofs() {
        when(hubClient.getUserNameProofsByFid(FID)).thenReturn(List.of(
                HubFixtures.fname("alice", FID, "0xa", 1_000),
                new UserNameProof("alice.eth", FID, "0xa", UserNameType.ENS_L1, 1_000, null)));

        run(null, null, Set.of(UserNameType.ENS_L1));

        assertThat(hubReports).containsExactly("0xa:true");
        verify(usernameProofStore, never()).findByFid(anyLong(), eq(UserNameType.FNAME), any(), any());
    }

    @Test
    void invalidRange_isSkipped() {
        Result<ReconciliationSummary> result = run(-5L, null, null);

        assertThat(result.orElseThrow().skipped()).isTrue();
        verifyNoInteractions(hubClient, usernameProofStore);
    }

    @Test
    void onDbProofIsOptional() {
        when(usernameProofStore.findByFid(eq(FID), eq(UserNameType.FNAME), any(), any()))
                .thenReturn(List.of(HubFixtures.fname("alice", FID, "0xa", 1_000)));

        Result<ReconciliationSummary> result = reconciliation.reconcileUsernameProofsForFid(FID,
                (proof, missingInDb) -> hubReports.add(proof.owner()), null, null, null, null);

        assertThat(result.orElseThrow().missingInHub()).isEqualTo(1);
    }
}
