package com.skilldeck.tools;

/**
 * Per-call context handed to tools. {@code sessionKey} identifies the conversation the call
 * belongs to; it is null for calls made outside any session.
 */
public record ToolContext(String sessionKey) {

    public boolean hasSession() {
        return sessionKey != null && !sessionKey.isBlank();
    }
}
