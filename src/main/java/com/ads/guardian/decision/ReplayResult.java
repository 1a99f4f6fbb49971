package com.ads.guardian.decision;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class ReplayResult {

    private EntityStateView finalState;
    private int decisionsReplayed;

    // ids of guardian records whose recorded outcome differs from the recomputed one
    private List<Long> mismatchedDecisionIds;

    public boolean isConsistent() {
        return mismatchedDecisionIds.isEmpty();
    }
}
