package com.example.sessionguard.domain.entity;

/**
 * A freshly established session as handed back to the caller that authenticated the user.
 */
public record CreatedSession(
    String sessionId,
    String csrfToken,
    long createdAt,
    boolean tracked
) {}
