package com.example.sessionguard.service;

import com.example.sessionguard.domain.entity.RevocationOutcome;
import com.example.sessionguard.domain.policy.RevocationPolicy;
import com.example.sessionguard.domain.policy.SessionKeys;
import com.example.sessionguard.util.SessionPayloadCodec;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.util.Assert;

/**
 * Destroys every session owned by a user after a security event such as a password reset.
 * <p>
 * The per-user index is the fast path. When it is empty and the fallback is enabled, the
 * session key space is scanned for payloads owned by the user, inspecting at most
 * {@link RevocationPolicy#scanBudget()} keys. A scan that runs out of budget may leave
 * sessions behind; the outcome reports it and a warning is logged.
 * <p>
 * Store failures propagate: a failed revocation must never be reported as safe. Deletes are
 * pipelined, not transactional, so a retry after a partial failure is safe and idempotent.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionRevocationService {

  private static final String BUDGET_PROPERTY = "app.session.revocation.scan-max-keys";

  private final RedisTemplate<String, String> redisTemplate;
  private final SessionKeys sessionKeys;
  private final RevocationPolicy revocationPolicy;
  private final SessionPayloadCodec payloadCodec;

  /**
   * @return number of session records actually deleted
   */
  public long revokeUserSessions(String userId) {
    return revoke(userId).revoked();
  }

  public RevocationOutcome revoke(String userId) {
    Assert.hasText(userId, "userId must not be empty");
    String indexKey = sessionKeys.userIndex(userId);

    Set<String> trackedSessionIds = redisTemplate.opsForSet().members(indexKey);
    if (trackedSessionIds != null && !trackedSessionIds.isEmpty()) {
      return revokeIndexed(userId, indexKey, new ArrayList<>(trackedSessionIds));
    }

    if (!revocationPolicy.scanFallbackEnabled()) {
      redisTemplate.delete(indexKey);
      log.info("Revoked 0 sessions for user {} (index-empty, scan fallback disabled)", userId);
      return RevocationOutcome.indexEmpty(userId);
    }

    RevocationOutcome outcome = revokeByScan(userId);
    redisTemplate.delete(indexKey);
    return outcome;
  }

  private RevocationOutcome revokeIndexed(String userId, String indexKey, List<String> sessionIds) {
    List<Object> results = redisTemplate.executePipelined(new SessionCallback<Object>() {
      @Override
      public Object execute(@NonNull RedisOperations operations) {
        @SuppressWarnings("unchecked")
        RedisOperations<String, String> redisOps = (RedisOperations<String, String>) operations;
        for (String sessionId : sessionIds) {
          redisOps.delete(sessionKeys.session(sessionId));
          redisOps.delete(sessionKeys.owner(sessionId));
        }
        redisOps.delete(indexKey);
        return null;
      }
    });

    // Results alternate session-delete, owner-delete; only the former count
    long deleted = 0;
    for (int i = 0; i < sessionIds.size(); i++) {
      if (isHit(results.get(i * 2))) {
        deleted++;
      }
    }
    log.info("Revoked {} sessions for user {} (indexed, {} tracked)", deleted, userId, sessionIds.size());
    return RevocationOutcome.indexed(userId, deleted);
  }

  private RevocationOutcome revokeByScan(String userId) {
    int budget = revocationPolicy.scanBudget();
    int pageSize = revocationPolicy.scanPageSize();
    ScanOptions options = ScanOptions.scanOptions()
        .match(sessionKeys.sessionPattern())
        .count(pageSize)
        .build();

    long deleted = 0;
    int inspected = 0;
    boolean budgetExhausted;

    try (Cursor<String> cursor = redisTemplate.scan(options)) {
      List<String> page = new ArrayList<>(pageSize);
      while (inspected + page.size() < budget && cursor.hasNext()) {
        page.add(cursor.next());
        if (page.size() == pageSize) {
          deleted += deleteOwnedBy(userId, page);
          inspected += page.size();
          page.clear();
        }
      }
      if (!page.isEmpty()) {
        deleted += deleteOwnedBy(userId, page);
        inspected += page.size();
      }
      budgetExhausted = inspected >= budget && cursor.hasNext();
    }

    if (budgetExhausted) {
      log.warn("Legacy session scan for user {} stopped after {} keys; sessions may remain. Raise {} to scan further",
               userId, inspected, BUDGET_PROPERTY);
    }
    log.info("Revoked {} sessions for user {} (scan-fallback, {} keys inspected)", deleted, userId, inspected);
    return RevocationOutcome.scanned(userId, deleted, inspected, budgetExhausted);
  }

  /**
   * Read one page of payloads and delete those owned by {@code userId}. Malformed payloads are skipped.
   */
  private long deleteOwnedBy(String userId, List<String> keys) {
    List<String> payloads = redisTemplate.opsForValue().multiGet(keys);
    if (payloads == null) {
      return 0;
    }

    List<String> keysToDelete = new ArrayList<>();
    for (int i = 0; i < keys.size() && i < payloads.size(); i++) {
      String owner = payloadCodec.readOwner(payloads.get(i)).orElse(null);
      if (Objects.equals(owner, userId)) {
        keysToDelete.add(keys.get(i));
      }
    }
    if (keysToDelete.isEmpty()) {
      return 0;
    }

    List<Object> results = redisTemplate.executePipelined(new SessionCallback<Object>() {
      @Override
      public Object execute(@NonNull RedisOperations operations) {
        @SuppressWarnings("unchecked")
        RedisOperations<String, String> redisOps = (RedisOperations<String, String>) operations;
        for (String key : keysToDelete) {
          redisOps.delete(key);
        }
        return null;
      }
    });
    return results.stream().filter(SessionRevocationService::isHit).count();
  }

  private static boolean isHit(Object deleteResult) {
    if (deleteResult instanceof Number number) {
      return number.longValue() > 0;
    }
    return Boolean.TRUE.equals(deleteResult);
  }
}
