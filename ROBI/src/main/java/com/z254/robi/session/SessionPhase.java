package com.z254.robi.session;

/**
 * Lifecycle of one duplex session.
 */
public enum SessionPhase {
    CONNECTING,
    AUTHENTICATING,
    ACTIVE,
    CLOSED
}
