package com.z254.robi.api.websocket;

/**
 * Codes carried by {@code error} messages.
 */
public enum ErrorCode {
    EMPTY_TEXT(true),
    EMPTY_AUDIO(true),
    INVALID_MEDIA(true),
    INVALID_MESSAGE(true),
    UNKNOWN_MESSAGE_TYPE(true),
    ALREADY_AUTHENTICATED(true),
    AGENT_ERROR(true),
    INTERNAL_ERROR(false);

    private final boolean recoverable;

    ErrorCode(boolean recoverable) {
        this.recoverable = recoverable;
    }

    /**
     * Whether the session stays open after this error.
     */
    public boolean isRecoverable() {
        return recoverable;
    }
}
