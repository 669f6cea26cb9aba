package com.example.sessionguard.exception;

import com.example.sessionguard.domain.entity.RateLimitPurpose;
import lombok.Getter;

/**
 * Rate Limit Exceeded Exception - the caller must not perform the throttled action
 */
@Getter
public class RateLimitExceededException extends RuntimeException {

  private final RateLimitPurpose purpose;
  private final int limit;

  public RateLimitExceededException(RateLimitPurpose purpose, int limit) {
    super("Too many %s attempts. Please wait before trying again.".formatted(purpose.pathValue()));
    this.purpose = purpose;
    this.limit = limit;
  }
}
