package com.example.sessionguard.domain.entity;

/**
 * Result of applying the TTL policy to the session presented with a request.
 */
public record SessionCheck(Status status, String sessionId, SessionPayload payload) {

  public enum Status {
    /** No usable session: missing, idle-expired, malformed id or payload. */
    ABSENT,
    /** Within both the idle and the absolute window. */
    ACTIVE,
    /** Older than the absolute timeout; the session has been destroyed. */
    EXPIRED
  }

  public static SessionCheck absent(String sessionId) {
    return new SessionCheck(Status.ABSENT, sessionId, null);
  }

  public static SessionCheck active(String sessionId, SessionPayload payload) {
    return new SessionCheck(Status.ACTIVE, sessionId, payload);
  }

  public static SessionCheck expired(String sessionId) {
    return new SessionCheck(Status.EXPIRED, sessionId, null);
  }

  public boolean isActive() {
    return status == Status.ACTIVE;
  }
}
