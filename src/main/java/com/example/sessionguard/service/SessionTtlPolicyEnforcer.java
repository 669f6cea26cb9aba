package com.example.sessionguard.service;

import com.example.sessionguard.domain.entity.SessionCheck;
import com.example.sessionguard.domain.entity.SessionPayload;
import com.example.sessionguard.domain.policy.SessionPolicy;
import com.example.sessionguard.util.LogMasking;
import java.time.Clock;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Applies the two session clocks to a presented session.
 * <p>
 * Idle expiry belongs to the store: a session whose record has expired is simply absent.
 * Absolute expiry is checked here against {@code createdAt}, on every request and regardless of
 * how recently the session was used. A session seen without {@code createdAt} is stamped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionTtlPolicyEnforcer {

  private final SessionService sessionService;
  private final SessionPolicy sessionPolicy;
  private final Clock clock;

  public SessionCheck enforce(String sessionId) {
    Optional<SessionPayload> found = sessionService.findSession(sessionId);
    if (found.isEmpty()) {
      return SessionCheck.absent(sessionId);
    }

    SessionPayload payload = found.get();
    long now = clock.millis();

    if (!payload.hasCreatedAt()) {
      Optional<SessionPayload> stamped = sessionService.stampCreatedAt(sessionId, now);
      if (stamped.isEmpty()) {
        return SessionCheck.absent(sessionId);
      }
      payload = stamped.get();
      log.debug("Stamped createdAt on session {}", LogMasking.maskSessionId(sessionId));
    }

    if (isAbsolutelyExpired(payload, now)) {
      sessionService.invalidateSession(sessionId, payload.ownerId());
      log.info("Session {} for user {} exceeded the absolute timeout of {}",
               LogMasking.maskSessionId(sessionId), payload.ownerId(), sessionPolicy.absoluteTimeout());
      return SessionCheck.expired(sessionId);
    }
    return SessionCheck.active(sessionId, payload);
  }

  public boolean isAbsolutelyExpired(SessionPayload payload, long nowMillis) {
    return payload.hasCreatedAt()
        && nowMillis - payload.createdAt() > sessionPolicy.absoluteTimeout().toMillis();
  }

  public long absoluteExpiresAt(SessionPayload payload) {
    return payload.createdAt() + sessionPolicy.absoluteTimeout().toMillis();
  }
}
