package com.obelisk.session;

/**
 * Thrown when an operation names a session that was never registered or was cleaned up.
 */
public class SessionNotFoundException extends RuntimeException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super(String.format("Session %s not registered", sessionId));
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
