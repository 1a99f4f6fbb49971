package com.ads.guardian.decision;

public enum DecisionSource {
    GUARDIAN,
    OPERATOR
}
