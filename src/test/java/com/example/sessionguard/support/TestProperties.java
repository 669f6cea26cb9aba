package com.example.sessionguard.support;

import com.example.sessionguard.properties.ApplicationProperties;
import com.example.sessionguard.properties.ApplicationProperties.InternalApiProperties;
import com.example.sessionguard.properties.ApplicationProperties.KeyProperties;
import com.example.sessionguard.properties.ApplicationProperties.RateLimitProperties;
import com.example.sessionguard.properties.ApplicationProperties.RateLimitProperties.PolicyProperties;
import com.example.sessionguard.properties.ApplicationProperties.RedisProperties;
import com.example.sessionguard.properties.ApplicationProperties.RedisProperties.PoolProperties;
import com.example.sessionguard.properties.ApplicationProperties.SessionProperties;
import com.example.sessionguard.properties.ApplicationProperties.SessionProperties.CookieProperties;
import com.example.sessionguard.properties.ApplicationProperties.SessionProperties.RevocationProperties;
import java.time.Duration;

/**
 * Builds the bound configuration tree with the defaults from application.yml.
 */
public final class TestProperties {

  public static final String API_KEY = "test-internal-api-key-0123456789abcdef";

  private TestProperties() {}

  public static ApplicationProperties defaults() {
    return withSession(session(Duration.ofHours(1), Duration.ofDays(14), Duration.ofDays(14)));
  }

  public static ApplicationProperties withSession(SessionProperties session) {
    return new ApplicationProperties(redis(), session, keys(), rateLimit(), new InternalApiProperties(API_KEY));
  }

  public static ApplicationProperties withKeys(KeyProperties keys) {
    return new ApplicationProperties(redis(), defaults().session(), keys, rateLimit(), new InternalApiProperties(API_KEY));
  }

  public static ApplicationProperties withApiKey(String apiKey) {
    return new ApplicationProperties(redis(), defaults().session(), keys(), rateLimit(), new InternalApiProperties(apiKey));
  }

  public static SessionProperties session(Duration idle, Duration absolute, Duration tracking) {
    return new SessionProperties(
        idle, absolute, tracking,
        new CookieProperties("sid", false, null, "Lax"),
        new RevocationProperties(false, 5000, 100));
  }

  public static RedisProperties redis() {
    return new RedisProperties(
        "redis://localhost:6379", Duration.ofSeconds(2), Duration.ofSeconds(2),
        new PoolProperties(16, 8, 4, Duration.ofSeconds(2), Duration.ofSeconds(30)));
  }

  public static KeyProperties keys() {
    return new KeyProperties("sess:", "user_sessions:", "session_user:", "ratelimit:");
  }

  public static RateLimitProperties rateLimit() {
    return new RateLimitProperties(
        new PolicyProperties(null, null),
        new PolicyProperties(null, null),
        new PolicyProperties(null, null));
  }
}
