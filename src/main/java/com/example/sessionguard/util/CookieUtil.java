package com.example.sessionguard.util;

import com.example.sessionguard.properties.ApplicationProperties.SessionProperties.CookieProperties;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.web.util.WebUtils;

/**
 * Cookie Utility for the session cookie
 * Uses Spring's ResponseCookie builder for proper cookie handling
 */
@Slf4j
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class CookieUtil {

  private static final String COOKIE_PATH = "/";
  private static final Pattern SESSION_ID_PATTERN = Pattern.compile("^[A-Za-z0-9_-]{32,256}$");

  /**
   * Extract cookie by name using Spring's WebUtils
   */
  public static Optional<Cookie> getCookie(HttpServletRequest request, String name) {
    if (request == null || name == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(WebUtils.getCookie(request, name));
  }

  /**
   * Session id carried by the request, if any
   */
  public static Optional<String> getSessionId(HttpServletRequest request, CookieProperties cookie) {
    return getCookie(request, cookie.name())
        .map(Cookie::getValue)
        .filter(value -> value != null && !value.isBlank());
  }

  /**
   * Clear the session cookie with the attributes it was set with
   */
  public static void clearSessionCookie(HttpServletResponse response, CookieProperties cookie) {
    ResponseCookie.ResponseCookieBuilder cookieBuilder = ResponseCookie
        .from(cookie.name(), "")
        .httpOnly(true)
        .secure(cookie.secure())
        .path(COOKIE_PATH)
        .maxAge(0) // Immediate expiration
        .sameSite(cookie.sameSite());

    if (cookie.domain() != null && !cookie.domain().isBlank()) {
      cookieBuilder.domain(cookie.domain());
    }

    response.addHeader(HttpHeaders.SET_COOKIE, cookieBuilder.build().toString());
    log.debug("Cleared session cookie: name={}", cookie.name());
  }

  /**
   * Validate session ID format before any store lookup
   */
  public static boolean isValidSessionId(String sessionId) {
    return sessionId != null && SESSION_ID_PATTERN.matcher(sessionId).matches();
  }
}
