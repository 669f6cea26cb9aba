package com.example.sessionguard.service;

import com.example.sessionguard.domain.policy.SessionKeys;
import com.example.sessionguard.domain.policy.SessionPolicy;
import com.example.sessionguard.util.LogMasking;
import java.util.Collections;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Per-user index of session ids plus a reverse owner pointer per session.
 * Both carry the tracking TTL so they expire on their own if never cleaned up.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionIndexService {

  private final RedisTemplate<String, String> redisTemplate;
  private final SessionKeys sessionKeys;
  private final SessionPolicy sessionPolicy;

  /**
   * Register {@code sessionId} under {@code userId} in one pipelined batch. No-op if either is empty.
   * Store failures propagate; callers on the login path swallow them.
   */
  public void trackUserSession(String userId, String sessionId) {
    if (!StringUtils.hasLength(userId) || !StringUtils.hasLength(sessionId)) {
      return;
    }
    String indexKey = sessionKeys.userIndex(userId);
    String ownerKey = sessionKeys.owner(sessionId);

    redisTemplate.executePipelined(new SessionCallback<Object>() {
      @Override
      public Object execute(@NonNull RedisOperations operations) {
        @SuppressWarnings("unchecked")
        RedisOperations<String, String> redisOps = (RedisOperations<String, String>) operations;
        redisOps.opsForSet().add(indexKey, sessionId);
        redisOps.expire(indexKey, sessionPolicy.trackingTtl());
        redisOps.opsForValue().set(ownerKey, userId, sessionPolicy.trackingTtl());
        return null;
      }
    });
    log.debug("Tracked session {} for user {}", LogMasking.maskSessionId(sessionId), userId);
  }

  /**
   * Drop a single session from its owner's index, e.g. on logout.
   */
  public void untrackUserSession(String userId, String sessionId) {
    if (!StringUtils.hasLength(sessionId)) {
      return;
    }
    String ownerKey = sessionKeys.owner(sessionId);

    redisTemplate.executePipelined(new SessionCallback<Object>() {
      @Override
      public Object execute(@NonNull RedisOperations operations) {
        @SuppressWarnings("unchecked")
        RedisOperations<String, String> redisOps = (RedisOperations<String, String>) operations;
        if (StringUtils.hasLength(userId)) {
          redisOps.opsForSet().remove(sessionKeys.userIndex(userId), sessionId);
        }
        redisOps.delete(ownerKey);
        return null;
      }
    });
  }

  public Set<String> trackedSessions(String userId) {
    Set<String> members = redisTemplate.opsForSet().members(sessionKeys.userIndex(userId));
    return members != null ? members : Collections.emptySet();
  }

  public String ownerOf(String sessionId) {
    return redisTemplate.opsForValue().get(sessionKeys.owner(sessionId));
  }
}
