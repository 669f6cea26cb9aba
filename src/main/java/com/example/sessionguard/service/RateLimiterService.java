package com.example.sessionguard.service;

import com.example.sessionguard.domain.entity.RateLimitPurpose;
import com.example.sessionguard.domain.policy.RateLimitPolicies;
import com.example.sessionguard.domain.policy.RateLimitPolicy;
import com.example.sessionguard.domain.policy.SessionKeys;
import com.example.sessionguard.util.LogMasking;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;

/**
 * Fixed-window rate limiter for sensitive actions, keyed by purpose and normalized identity.
 * <p>
 * Every attempt is counted, successful or not. Store failures propagate to the caller, which
 * must treat them as a denial.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RateLimiterService {

  private static final long NO_EXPIRY = -1L;

  private final RedisTemplate<String, String> redisTemplate;
  private final SessionKeys sessionKeys;
  private final RateLimitPolicies policies;

  /**
   * Count one attempt for {@code key} and report whether it fits in the current window.
   * <p>
   * The increment and the expiry check are two commands. Concurrent first attempts may both
   * see no expiry and both arm it to the same window, which is harmless. A burst straddling a
   * window boundary can admit up to twice the limit; this throttling is advisory.
   *
   * @param key      rate limit key without the store prefix, e.g. {@code login:user@example.com}
   * @param limit    maximum attempts per window
   * @param windowMs window length in milliseconds
   * @return true if the post-increment count is within {@code limit}
   */
  public boolean isAllowed(String key, int limit, long windowMs) {
    String redisKey = sessionKeys.rateLimit(key);

    List<Object> results = redisTemplate.executePipelined(new SessionCallback<Object>() {
      @Override
      public Object execute(@NonNull RedisOperations operations) {
        @SuppressWarnings("unchecked")
        RedisOperations<String, String> redisOps = (RedisOperations<String, String>) operations;
        redisOps.opsForValue().increment(redisKey);
        redisOps.getExpire(redisKey, TimeUnit.MILLISECONDS);
        return null;
      }
    });

    long count = toLong(results.get(0));
    Long ttl = (Long) results.get(1);

    // Arm the window only on its first increment so later attempts never extend it
    if (ttl != null && ttl == NO_EXPIRY) {
      redisTemplate.expire(redisKey, windowMs, TimeUnit.MILLISECONDS);
    }

    return count <= limit;
  }

  /**
   * Attempts left in the current window, without counting one.
   */
  public int getRemainingAttempts(String key, int limit) {
    String count = redisTemplate.opsForValue().get(sessionKeys.rateLimit(key));
    if (count == null) {
      return limit;
    }
    return (int) Math.max(0, limit - Long.parseLong(count));
  }

  public boolean isAllowed(RateLimitPurpose purpose, String identity) {
    RateLimitPolicy policy = policies.forPurpose(purpose);
    boolean allowed = isAllowed(purposeKey(purpose, identity), policy.limit(), policy.windowMillis());
    if (!allowed) {
      log.info("Rate limit exceeded for {} ({}): limit {} per {}",
               purpose.pathValue(), LogMasking.maskEmail(normalize(identity)), policy.limit(), policy.window());
    }
    return allowed;
  }

  public int getRemainingAttempts(RateLimitPurpose purpose, String identity) {
    return getRemainingAttempts(purposeKey(purpose, identity), policies.forPurpose(purpose).limit());
  }

  public RateLimitPolicy policyFor(RateLimitPurpose purpose) {
    return policies.forPurpose(purpose);
  }

  /**
   * Password reset requests: 3 per email per hour by default
   */
  public boolean checkPasswordResetLimit(String email) {
    return isAllowed(RateLimitPurpose.PASSWORD_RESET, email);
  }

  /**
   * Email verification requests: 3 per email per hour by default
   */
  public boolean checkEmailVerificationLimit(String email) {
    return isAllowed(RateLimitPurpose.EMAIL_VERIFICATION, email);
  }

  /**
   * Login attempts: 10 per email per 15 minutes by default
   */
  public boolean checkLoginLimit(String email) {
    return isAllowed(RateLimitPurpose.LOGIN, email);
  }

  static String purposeKey(RateLimitPurpose purpose, String identity) {
    return purpose.keySegment() + ":" + normalize(identity);
  }

  static String normalize(String identity) {
    return identity == null ? "" : identity.trim().toLowerCase(Locale.ROOT);
  }

  private long toLong(Object value) {
    if (value instanceof Number number) {
      return number.longValue();
    }
    throw new IllegalStateException("Unexpected INCR result: " + value);
  }
}
