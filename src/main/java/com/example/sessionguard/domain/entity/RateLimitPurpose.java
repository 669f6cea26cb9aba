package com.example.sessionguard.domain.entity;

import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;

/**
 * Throttled actions. The key segment is part of the stored counter key
 * ({@code ratelimit:{keySegment}:{identity}}) and must stay stable across deploys.
 */
public enum RateLimitPurpose {

  LOGIN("login", "login", 10, Duration.ofMinutes(15)),
  PASSWORD_RESET("password-reset", "pwreset", 3, Duration.ofHours(1)),
  EMAIL_VERIFICATION("email-verification", "emailverify", 3, Duration.ofHours(1));

  private final String pathValue;
  private final String keySegment;
  private final int defaultLimit;
  private final Duration defaultWindow;

  RateLimitPurpose(String pathValue, String keySegment, int defaultLimit, Duration defaultWindow) {
    this.pathValue = pathValue;
    this.keySegment = keySegment;
    this.defaultLimit = defaultLimit;
    this.defaultWindow = defaultWindow;
  }

  public String pathValue() {
    return pathValue;
  }

  public String keySegment() {
    return keySegment;
  }

  public int defaultLimit() {
    return defaultLimit;
  }

  public Duration defaultWindow() {
    return defaultWindow;
  }

  public static Optional<RateLimitPurpose> fromPathValue(String value) {
    return Arrays.stream(values())
        .filter(purpose -> purpose.pathValue.equalsIgnoreCase(value))
        .findFirst();
  }
}
