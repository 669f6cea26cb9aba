package com.example.sessionguard.web.rest.controller;

import com.example.sessionguard.domain.entity.SessionPayload;
import com.example.sessionguard.domain.entity.SessionUser;
import com.example.sessionguard.exception.SessionException;
import com.example.sessionguard.security.SessionAuthentication;
import com.example.sessionguard.service.SessionTtlPolicyEnforcer;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Slf4j
@RequiredArgsConstructor
public class SessionController implements SessionAPI {

  private final SessionTtlPolicyEnforcer ttlPolicyEnforcer;

  @Override
  public ResponseEntity<Map<String, Object>> getCurrentSession(SessionAuthentication authentication) {
    if (authentication == null) {
      throw new SessionException("No session found");
    }
    SessionPayload payload = authentication.getPayload();
    SessionUser user = payload.user();

    Map<String, Object> userInfo = new LinkedHashMap<>();
    userInfo.put("id", user.id());
    userInfo.put("email", user.email());
    userInfo.put("globalAdmin", user.globalAdmin());
    userInfo.put("emailVerified", user.emailVerified());
    userInfo.put("staffRole", user.staffRole());

    Map<String, Object> response = new LinkedHashMap<>();
    response.put("user", userInfo);
    response.put("sessionCreatedAt", payload.createdAt());
    response.put("absoluteExpiresAt", ttlPolicyEnforcer.absoluteExpiresAt(payload));
    return ResponseEntity.ok(response);
  }
}
