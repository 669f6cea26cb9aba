package com.example.sessionguard.domain.policy;

import com.example.sessionguard.properties.ApplicationProperties;

/**
 * Builds store keys from the configured prefixes.
 */
public record SessionKeys(
    String sessionPrefix,
    String indexPrefix,
    String ownerPrefix,
    String rateLimitPrefix
) {

  public static SessionKeys defaults() {
    return new SessionKeys("sess:", "user_sessions:", "session_user:", "ratelimit:");
  }

  public static SessionKeys from(ApplicationProperties.KeyProperties keys) {
    return new SessionKeys(keys.sessionPrefix(), keys.indexPrefix(), keys.ownerPrefix(), keys.rateLimitPrefix());
  }

  public String session(String sessionId) {
    return sessionPrefix + sessionId;
  }

  public String userIndex(String userId) {
    return indexPrefix + userId;
  }

  public String owner(String sessionId) {
    return ownerPrefix + sessionId;
  }

  public String rateLimit(String key) {
    return rateLimitPrefix + key;
  }

  public String sessionPattern() {
    return sessionPrefix + "*";
  }
}
