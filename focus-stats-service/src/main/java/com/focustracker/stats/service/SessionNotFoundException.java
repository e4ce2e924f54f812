package com.focustracker.stats.service;

public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(Long sessionId) {
        super("Session not found: " + sessionId);
    }
}
