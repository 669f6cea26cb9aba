package com.example.sessionguard.domain.policy;

import com.example.sessionguard.properties.ApplicationProperties;

/**
 * Controls the legacy fallback scan used when a user's session index is empty.
 *
 * @param scanFallbackEnabled whether an empty index triggers a key-space scan
 * @param scanBudget          maximum number of session keys one scan may inspect
 * @param scanPageSize        COUNT hint per SCAN call, also the MGET batch size
 */
public record RevocationPolicy(
    boolean scanFallbackEnabled,
    int scanBudget,
    int scanPageSize
) {

  public static final int MIN_CONFIGURED_SCAN_BUDGET = 500;

  public RevocationPolicy {
    if (scanBudget < 1 || scanPageSize < 1) {
      throw new IllegalArgumentException("Scan budget and page size must be positive");
    }
  }

  /**
   * Applies the configured-budget floor. Policies built directly are not floored.
   */
  public static RevocationPolicy from(ApplicationProperties.SessionProperties.RevocationProperties revocation) {
    return new RevocationPolicy(
        revocation.scanFallbackEnabled(),
        Math.max(revocation.scanMaxKeys(), MIN_CONFIGURED_SCAN_BUDGET),
        revocation.scanPageSize());
  }
}
