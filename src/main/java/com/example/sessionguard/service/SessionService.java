package com.example.sessionguard.service;

import com.example.sessionguard.domain.entity.CreatedSession;
import com.example.sessionguard.domain.entity.SessionPayload;
import com.example.sessionguard.domain.entity.SessionUser;
import com.example.sessionguard.domain.policy.SessionKeys;
import com.example.sessionguard.domain.policy.SessionPolicy;
import com.example.sessionguard.util.CookieUtil;
import com.example.sessionguard.util.LogMasking;
import com.example.sessionguard.util.SessionPayloadCodec;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Base64;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Session record store.
 * Each session is a JSON document at {@code sess:{sessionId}} whose idle expiry is managed by Redis.
 * <p>
 * Reads never refresh the expiry: only writes re-arm the idle window, so anonymous or read-only
 * traffic does not cause a store write per request.
 */
@Service
@Slf4j
public class SessionService {

  private static final int SESSION_ID_ENTROPY_BYTES = 32;
  private static final SecureRandom SECURE_RANDOM = new SecureRandom();

  private final RedisTemplate<String, String> redisTemplate;
  private final SessionIndexService sessionIndexService;
  private final SessionPayloadCodec payloadCodec;
  private final SessionKeys sessionKeys;
  private final SessionPolicy sessionPolicy;
  private final Clock clock;

  public SessionService(
      RedisTemplate<String, String> redisTemplate,
      SessionIndexService sessionIndexService,
      SessionPayloadCodec payloadCodec,
      SessionKeys sessionKeys,
      SessionPolicy sessionPolicy,
      Clock clock) {
    this.redisTemplate = redisTemplate;
    this.sessionIndexService = sessionIndexService;
    this.payloadCodec = payloadCodec;
    this.sessionKeys = sessionKeys;
    this.sessionPolicy = sessionPolicy;
    this.clock = clock;
  }

  /**
   * Persist a new session for an authenticated user and register it in the user's index.
   * Indexing is best-effort: its failure is logged and never fails the login.
   */
  public CreatedSession createAuthenticatedSession(SessionUser user) {
    if (user == null || !StringUtils.hasText(user.id())) {
      throw new IllegalArgumentException("Session user id must not be empty");
    }
    String sessionId = generateSecureSessionId();
    String csrfToken = UUID.randomUUID().toString();
    long createdAt = clock.millis();

    writeSession(sessionId, SessionPayload.create(user, createdAt, csrfToken));

    boolean tracked = true;
    try {
      sessionIndexService.trackUserSession(user.id(), sessionId);
    } catch (RuntimeException e) {
      tracked = false;
      log.warn("Could not index session {} for user {}; revocation will need the fallback scan",
               LogMasking.maskSessionId(sessionId), user.id(), e);
    }
    log.info("Created session {} for user {}", LogMasking.maskSessionId(sessionId), user.id());
    return new CreatedSession(sessionId, csrfToken, createdAt, tracked);
  }

  /**
   * Load a session without touching its expiry. Missing, expired or malformed sessions are empty.
   */
  public Optional<SessionPayload> findSession(String sessionId) {
    if (!isValidSessionId(sessionId)) {
      return Optional.empty();
    }
    String json = redisTemplate.opsForValue().get(sessionKeys.session(sessionId));
    if (json == null) {
      return Optional.empty();
    }
    Optional<SessionPayload> payload = payloadCodec.decode(json);
    if (payload.isEmpty()) {
      log.warn("Session {} holds a payload that does not match the session schema",
               LogMasking.maskSessionId(sessionId));
    }
    return payload;
  }

  /**
   * Stamp {@code createdAt} on a session stored without one, keeping the rest of the stored
   * document as written. This is a state-changing write and re-arms the idle window.
   * The record is only replaced while it still exists, so a session deleted since it was read
   * stays deleted.
   *
   * @return the stamped payload, or empty if the session is gone or no longer matches the schema
   */
  public Optional<SessionPayload> stampCreatedAt(String sessionId, long createdAt) {
    if (!isValidSessionId(sessionId)) {
      return Optional.empty();
    }
    String json = redisTemplate.opsForValue().get(sessionKeys.session(sessionId));
    if (json == null) {
      return Optional.empty();
    }
    Optional<String> stamped = payloadCodec.stampCreatedAt(json, createdAt);
    if (stamped.isEmpty()) {
      return Optional.empty();
    }
    if (!replaceSession(sessionId, stamped.get())) {
      log.info("Session {} was deleted before createdAt could be stamped", LogMasking.maskSessionId(sessionId));
      return Optional.empty();
    }
    return payloadCodec.decode(stamped.get());
  }

  /**
   * Destroy one session: its record, its owner pointer and its index membership.
   */
  public void invalidateSession(String sessionId, String ownerId) {
    if (!isValidSessionId(sessionId)) return;
    String sessionKey = sessionKeys.session(sessionId);
    String ownerKey = sessionKeys.owner(sessionId);

    redisTemplate.executePipelined(new SessionCallback<Object>() {
      @Override
      public Object execute(@NonNull RedisOperations operations) {
        @SuppressWarnings("unchecked")
        RedisOperations<String, String> redisOps = (RedisOperations<String, String>) operations;
        redisOps.delete(sessionKey);
        redisOps.delete(ownerKey);
        if (StringUtils.hasLength(ownerId)) {
          redisOps.opsForSet().remove(sessionKeys.userIndex(ownerId), sessionId);
        }
        return null;
      }
    });
    log.debug("Invalidated session {}", LogMasking.maskSessionId(sessionId));
  }

  /**
   * Destroy one session, looking up its owner first. Used by logout where only the id is known.
   */
  public void invalidateSession(String sessionId) {
    if (!isValidSessionId(sessionId)) return;
    String ownerId = findSession(sessionId)
        .map(SessionPayload::ownerId)
        .orElseGet(() -> sessionIndexService.ownerOf(sessionId));
    invalidateSession(sessionId, ownerId);
  }

  public boolean isValidSessionId(String sessionId) {
    return CookieUtil.isValidSessionId(sessionId);
  }

  private void writeSession(String sessionId, SessionPayload payload) {
    redisTemplate.opsForValue().set(
        sessionKeys.session(sessionId), payloadCodec.encode(payload), sessionPolicy.idleTimeout());
  }

  private boolean replaceSession(String sessionId, String json) {
    Boolean written = redisTemplate.opsForValue()
        .setIfPresent(sessionKeys.session(sessionId), json, sessionPolicy.idleTimeout());
    return Boolean.TRUE.equals(written);
  }

  private String generateSecureSessionId() {
    byte[] randomBytes = new byte[SESSION_ID_ENTROPY_BYTES];
    SECURE_RANDOM.nextBytes(randomBytes);
    return Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes);
  }
}
