package com.example.sessionguard.domain.policy;

import java.time.Duration;

/**
 * A fixed window: at most {@code limit} attempts per {@code window}.
 */
public record RateLimitPolicy(int limit, Duration window) {

  public long windowMillis() {
    return window.toMillis();
  }
}
