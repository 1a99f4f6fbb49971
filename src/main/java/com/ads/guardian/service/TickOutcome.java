package com.ads.guardian.service;

public enum TickOutcome {

    COMPLETED,

    // a previous tick was still in flight
    SKIPPED,

    // tick-wide failure, nothing but the tick record was committed
    ABORTED,

    // guardian switched off by the operator
    DISABLED
}
