package com.example.sessionguard.web.rest.controller;

import com.example.sessionguard.domain.entity.SessionCheck;
import com.example.sessionguard.properties.ApplicationProperties;
import com.example.sessionguard.security.filter.SessionTtlFilter;
import com.example.sessionguard.service.SessionService;
import com.example.sessionguard.util.CookieUtil;
import com.example.sessionguard.util.LogMasking;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

/**
 * Session status and logout for the browser. Login itself is owned by the auth-flow service,
 * which creates sessions through the internal API.
 */
@RestController
@Slf4j
@RequiredArgsConstructor
public class AuthController implements AuthAPI {

  private final SessionService sessionService;
  private final ApplicationProperties properties;

  @Override
  public ResponseEntity<Map<String, Object>> logout(HttpServletRequest request, HttpServletResponse response) {
    ApplicationProperties.SessionProperties.CookieProperties cookie = properties.session().cookie();
    Optional<String> sessionId = CookieUtil.getSessionId(request, cookie);

    sessionId.ifPresent(id -> {
      sessionService.invalidateSession(id);
      log.info("Logged out session {}", LogMasking.maskSessionId(id));
    });
    CookieUtil.clearSessionCookie(response, cookie);

    return ResponseEntity.ok(Map.of(
        "message", "Logged out",
        "timestamp", System.currentTimeMillis()
                                   ));
  }

  /**
   * Reads the check already made by the TTL filter; no store call of its own
   */
  @Override
  public ResponseEntity<Map<String, Object>> status(HttpServletRequest request) {
    boolean authenticated = request.getAttribute(SessionTtlFilter.SESSION_ATTRIBUTE) instanceof SessionCheck check
        && check.isActive();

    return ResponseEntity.ok(Map.of(
        "authenticated", authenticated,
        "timestamp", System.currentTimeMillis()
                                   ));
  }
}
