package com.example.sessionguard.util;

import lombok.experimental.UtilityClass;

/**
 * Masks identifiers before they reach the logs.
 */
@UtilityClass
public class LogMasking {

  public String maskSessionId(String sessionId) {
    if (sessionId == null || sessionId.length() < 8) return "INVALID";
    return sessionId.substring(0, 8) + "...";
  }

  public String maskEmail(String email) {
    if (email == null) return "***";
    int at = email.indexOf('@');
    if (at <= 0) return "***";
    return email.charAt(0) + "***" + email.substring(at);
  }
}
