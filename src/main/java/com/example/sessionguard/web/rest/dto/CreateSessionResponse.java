package com.example.sessionguard.web.rest.dto;

import com.example.sessionguard.domain.entity.CreatedSession;

/**
 * The new session id is returned only to the trusted caller, which sets it as the session cookie.
 */
public record CreateSessionResponse(String sessionId, String csrfToken, long createdAt) {

  public static CreateSessionResponse from(CreatedSession session) {
    return new CreateSessionResponse(session.sessionId(), session.csrfToken(), session.createdAt());
  }
}
