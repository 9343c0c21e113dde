package com.phillippitts.callbridge.domain;

/** Why a function stream ended for good. */
public enum StreamTermination {
    /** Remote side closed with a normal-closure code; the call itself ended. */
    CALL_ENDED,
    /** A terminal control event stopped the stream. */
    CANCELLED,
    /** Abnormal disconnects outlasted the reconnect budget. */
    RECONNECTS_EXHAUSTED
}
