package com.hubsync.ingestion.reconcile;

import com.hubsync.domain.UserNameProof;

@FunctionalInterface
public interface HubProofCallback {

    void onHubProof(UserNameProof proof, boolean missingInDb);
}
