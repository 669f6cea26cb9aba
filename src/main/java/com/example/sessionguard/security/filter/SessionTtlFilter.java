package com.example.sessionguard.security.filter;

import com.example.sessionguard.domain.entity.SessionCheck;
import com.example.sessionguard.properties.ApplicationProperties;
import com.example.sessionguard.service.SessionTtlPolicyEnforcer;
import com.example.sessionguard.util.CookieUtil;
import com.example.sessionguard.util.LogMasking;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Enforces the session TTL policy on every request that carries a session cookie, on every route.
 * Registered ahead of the security filter chain by SecurityConfig.
 * <p>
 * An active session is exposed to later filters through {@link #SESSION_ATTRIBUTE}. An absolutely
 * expired session is rejected with 401. If the store cannot be reached the request continues with
 * no session attached, so protected routes still reject it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionTtlFilter extends OncePerRequestFilter {

  public static final String SESSION_ATTRIBUTE = SessionTtlFilter.class.getName() + ".SESSION";

  private final SessionTtlPolicyEnforcer ttlPolicyEnforcer;
  private final ApplicationProperties properties;
  private final ObjectMapper objectMapper;

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain
                                 ) throws ServletException, IOException {

    ApplicationProperties.SessionProperties.CookieProperties cookie = properties.session().cookie();
    Optional<String> sessionId = CookieUtil.getSessionId(request, cookie);

    if (sessionId.isPresent()) {
      try {
        SessionCheck check = ttlPolicyEnforcer.enforce(sessionId.get());
        switch (check.status()) {
          case ACTIVE -> request.setAttribute(SESSION_ATTRIBUTE, check);
          case ABSENT -> {
            log.debug("No live session for {}. Clearing cookie.", LogMasking.maskSessionId(sessionId.get()));
            CookieUtil.clearSessionCookie(response, cookie);
          }
          case EXPIRED -> {
            CookieUtil.clearSessionCookie(response, cookie);
            writeSessionExpired(response);
            return;
          }
        }
      } catch (Exception e) {
        log.error("Session TTL check failed for {}; continuing without a session",
                  LogMasking.maskSessionId(sessionId.get()), e);
      }
    }

    filterChain.doFilter(request, response);
  }

  private void writeSessionExpired(HttpServletResponse response) throws IOException {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", "session_expired");
    body.put("message", "Session expired (absolute TTL)");

    response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    objectMapper.writeValue(response.getWriter(), body);
  }
}
