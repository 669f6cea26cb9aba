package com.example.sessionguard.web.rest.controller;

import com.example.sessionguard.domain.entity.CreatedSession;
import com.example.sessionguard.domain.entity.RateLimitPurpose;
import com.example.sessionguard.domain.entity.RevocationOutcome;
import com.example.sessionguard.exception.RateLimitExceededException;
import com.example.sessionguard.exception.UnknownRateLimitPurposeException;
import com.example.sessionguard.service.RateLimiterService;
import com.example.sessionguard.service.SessionIndexService;
import com.example.sessionguard.service.SessionRevocationService;
import com.example.sessionguard.service.SessionService;
import com.example.sessionguard.util.LogMasking;
import com.example.sessionguard.web.rest.dto.CreateSessionRequest;
import com.example.sessionguard.web.rest.dto.CreateSessionResponse;
import com.example.sessionguard.web.rest.dto.RateLimitAttemptRequest;
import com.example.sessionguard.web.rest.dto.RateLimitAttemptResponse;
import com.example.sessionguard.web.rest.dto.RateLimitStatusResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

/**
 * Internal endpoints backing the auth-flow services.
 * <p>
 * Store failures are not caught here: rate-limit checks and revocations must fail closed, and
 * GlobalErrorHandler turns them into 503.
 */
@RestController
@Slf4j
@RequiredArgsConstructor
public class InternalController implements InternalAPI {

  private final RateLimiterService rateLimiterService;
  private final SessionService sessionService;
  private final SessionIndexService sessionIndexService;
  private final SessionRevocationService sessionRevocationService;

  @Override
  public ResponseEntity<RateLimitAttemptResponse> recordAttempt(String purpose, RateLimitAttemptRequest request) {
    RateLimitPurpose resolved = resolvePurpose(purpose);

    if (!rateLimiterService.isAllowed(resolved, request.identity())) {
      throw new RateLimitExceededException(resolved, rateLimiterService.policyFor(resolved).limit());
    }
    int remaining = rateLimiterService.getRemainingAttempts(resolved, request.identity());
    return ResponseEntity.ok(new RateLimitAttemptResponse(resolved.pathValue(), true, remaining));
  }

  @Override
  public ResponseEntity<RateLimitStatusResponse> remainingAttempts(String purpose, String identity) {
    RateLimitPurpose resolved = resolvePurpose(purpose);
    int limit = rateLimiterService.policyFor(resolved).limit();
    int remaining = rateLimiterService.getRemainingAttempts(resolved, identity);
    return ResponseEntity.ok(new RateLimitStatusResponse(resolved.pathValue(), remaining, limit));
  }

  @Override
  public ResponseEntity<CreateSessionResponse> createSession(CreateSessionRequest request) {
    CreatedSession session = sessionService.createAuthenticatedSession(request.toSessionUser());
    return ResponseEntity.status(HttpStatus.CREATED).body(CreateSessionResponse.from(session));
  }

  @Override
  public ResponseEntity<Void> trackSession(String userId, String sessionId) {
    try {
      sessionIndexService.trackUserSession(userId, sessionId);
    } catch (RuntimeException e) {
      log.warn("Failed to track session {} for user {}", LogMasking.maskSessionId(sessionId), userId, e);
    }
    return ResponseEntity.noContent().build();
  }

  @Override
  public ResponseEntity<RevocationOutcome> revokeUserSessions(String userId) {
    return ResponseEntity.ok(sessionRevocationService.revoke(userId));
  }

  private RateLimitPurpose resolvePurpose(String purpose) {
    return RateLimitPurpose.fromPathValue(purpose)
        .orElseThrow(() -> new UnknownRateLimitPurposeException(purpose));
  }
}
