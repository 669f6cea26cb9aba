package com.example.sessionguard.exception;

/**
 * Unknown Rate Limit Purpose Exception - no throttled action is registered under the requested name
 */
public class UnknownRateLimitPurposeException extends RuntimeException {
  public UnknownRateLimitPurposeException(String purpose) {
    super("Unknown rate limit purpose: " + purpose);
  }
}
