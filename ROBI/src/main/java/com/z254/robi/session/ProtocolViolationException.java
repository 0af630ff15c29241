package com.z254.robi.session;

/**
 * Raised when a client breaks the handshake. The connection is closed with a policy
 * violation code and nothing else is read from it.
 */
public class ProtocolViolationException extends RuntimeException {

    public ProtocolViolationException(String message) {
        super(message);
    }
}
