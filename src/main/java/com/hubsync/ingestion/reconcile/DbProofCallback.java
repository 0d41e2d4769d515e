package com.hubsync.ingestion.reconcile;

import com.hubsync.domain.UserNameProof;

@FunctionalInterface
public interface DbProofCallback {

    void onDbProof(UserNameProof proof, boolean missingInHub);
}
