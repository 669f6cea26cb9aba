package com.example.sessionguard.domain.policy;

import com.example.sessionguard.domain.entity.RateLimitPurpose;
import com.example.sessionguard.properties.ApplicationProperties;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-purpose rate limit policies.
 */
public final class RateLimitPolicies {

  private final Map<RateLimitPurpose, RateLimitPolicy> policies;

  private RateLimitPolicies(Map<RateLimitPurpose, RateLimitPolicy> policies) {
    this.policies = Collections.unmodifiableMap(new EnumMap<>(policies));
  }

  public static RateLimitPolicies defaults() {
    Map<RateLimitPurpose, RateLimitPolicy> policies = new EnumMap<>(RateLimitPurpose.class);
    for (RateLimitPurpose purpose : RateLimitPurpose.values()) {
      policies.put(purpose, new RateLimitPolicy(purpose.defaultLimit(), purpose.defaultWindow()));
    }
    return new RateLimitPolicies(policies);
  }

  public static RateLimitPolicies from(ApplicationProperties.RateLimitProperties rateLimit) {
    Map<RateLimitPurpose, RateLimitPolicy> policies = new EnumMap<>(RateLimitPurpose.class);
    policies.put(RateLimitPurpose.LOGIN, resolve(RateLimitPurpose.LOGIN, rateLimit.login()));
    policies.put(RateLimitPurpose.PASSWORD_RESET, resolve(RateLimitPurpose.PASSWORD_RESET, rateLimit.passwordReset()));
    policies.put(RateLimitPurpose.EMAIL_VERIFICATION,
                 resolve(RateLimitPurpose.EMAIL_VERIFICATION, rateLimit.emailVerification()));
    return new RateLimitPolicies(policies);
  }

  public RateLimitPolicy forPurpose(RateLimitPurpose purpose) {
    return policies.get(purpose);
  }

  private static RateLimitPolicy resolve(
      RateLimitPurpose purpose, ApplicationProperties.RateLimitProperties.PolicyProperties configured) {
    int limit = configured != null && configured.limit() != null ? configured.limit() : purpose.defaultLimit();
    return new RateLimitPolicy(
        limit,
        configured != null && configured.window() != null ? configured.window() : purpose.defaultWindow());
  }
}
