package com.example.sessionguard.config;

import com.example.sessionguard.domain.policy.RateLimitPolicies;
import com.example.sessionguard.domain.policy.RevocationPolicy;
import com.example.sessionguard.domain.policy.SessionKeys;
import com.example.sessionguard.domain.policy.SessionPolicy;
import com.example.sessionguard.properties.ApplicationProperties;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Turns the bound properties into the immutable policies the services are constructed with.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@RequiredArgsConstructor
public class SessionGuardConfig {

  private final ApplicationProperties properties;

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public SessionKeys sessionKeys() {
    return SessionKeys.from(properties.keys());
  }

  @Bean
  public SessionPolicy sessionPolicy() {
    return SessionPolicy.from(properties.session());
  }

  @Bean
  public RevocationPolicy revocationPolicy() {
    RevocationPolicy policy = RevocationPolicy.from(properties.session().revocation());
    if (policy.scanBudget() != properties.session().revocation().scanMaxKeys()) {
      log.warn("Configured scan budget {} is below the minimum; using {}",
               properties.session().revocation().scanMaxKeys(), policy.scanBudget());
    }
    log.info("Session revocation fallback scan {} (budget {} keys)",
             policy.scanFallbackEnabled() ? "enabled" : "disabled", policy.scanBudget());
    return policy;
  }

  @Bean
  public RateLimitPolicies rateLimitPolicies() {
    return RateLimitPolicies.from(properties.rateLimit());
  }
}
