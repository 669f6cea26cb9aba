package com.example.sessionguard.domain.entity;

/**
 * Result of revoking every session owned by a user.
 * {@code revoked} is informational: zero is a valid outcome, not a failure.
 */
public record RevocationOutcome(
    String userId,
    long revoked,
    RevocationPath path,
    int inspectedKeys,
    boolean budgetExhausted
) {

  public enum RevocationPath {
    /** Tracked session ids were read from the per-user index. */
    INDEXED,
    /** Index was empty and the fallback scan is disabled. */
    INDEX_EMPTY,
    /** Index was empty and the key space was scanned under a budget. */
    SCAN_FALLBACK
  }

  public static RevocationOutcome indexed(String userId, long revoked) {
    return new RevocationOutcome(userId, revoked, RevocationPath.INDEXED, 0, false);
  }

  public static RevocationOutcome indexEmpty(String userId) {
    return new RevocationOutcome(userId, 0, RevocationPath.INDEX_EMPTY, 0, false);
  }

  public static RevocationOutcome scanned(String userId, long revoked, int inspectedKeys, boolean budgetExhausted) {
    return new RevocationOutcome(userId, revoked, RevocationPath.SCAN_FALLBACK, inspectedKeys, budgetExhausted);
  }
}
