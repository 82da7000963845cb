package com.weave.graph.service.session;

import lombok.Getter;

/**
 * Thrown when a read targets a chat that is neither open nor persisted.
 */
@Getter
public class SessionNotFoundException extends RuntimeException {

    private final String chatId;

    public SessionNotFoundException(String chatId) {
        super("Session not found: " + chatId);
        this.chatId = chatId;
    }
}
