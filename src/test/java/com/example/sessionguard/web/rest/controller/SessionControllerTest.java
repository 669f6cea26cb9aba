package com.example.sessionguard.web.rest.controller;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.sessionguard.domain.entity.SessionPayload;
import com.example.sessionguard.domain.entity.SessionUser;
import com.example.sessionguard.domain.policy.SessionPolicy;
import com.example.sessionguard.security.SessionAuthentication;
import com.example.sessionguard.service.SessionService;
import com.example.sessionguard.service.SessionTtlPolicyEnforcer;
import com.example.sessionguard.web.rest.errors.GlobalErrorHandler;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class SessionControllerTest {

  private static final long CREATED_AT = 1_700_000_000_000L;

  @Mock
  private SessionService sessionService;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    SessionTtlPolicyEnforcer enforcer =
        new SessionTtlPolicyEnforcer(sessionService, SessionPolicy.defaults(), Clock.systemUTC());
    mockMvc = MockMvcBuilders.standaloneSetup(new SessionController(enforcer))
        .setControllerAdvice(new GlobalErrorHandler())
        .build();
  }

  @Test
  @DisplayName("returns the user and the absolute expiry")
  void currentSession() throws Exception {
    SessionPayload payload = SessionPayload.create(
        new SessionUser("u1", "u1@example.com", false, true, true), CREATED_AT, "csrf");
    SessionAuthentication authentication = new SessionAuthentication(
        "session-id", payload, List.of(new SimpleGrantedAuthority("ROLE_USER")));

    mockMvc.perform(get("/api/session/me").principal(authentication))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.user.id").value("u1"))
        .andExpect(jsonPath("$.user.staffRole").value(true))
        .andExpect(jsonPath("$.sessionCreatedAt").value(CREATED_AT))
        .andExpect(jsonPath("$.absoluteExpiresAt").value(CREATED_AT + Duration.ofDays(14).toMillis()));
  }

  @Test
  @DisplayName("returns 401 without a session")
  void noSession() throws Exception {
    mockMvc.perform(get("/api/session/me"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.error").value("invalid_session"));
  }
}
