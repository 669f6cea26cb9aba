package com.example.sessionguard.web.rest.controller;

import static com.example.sessionguard.web.rest.ApiConstants.ApiPath.*;

import com.example.sessionguard.domain.entity.RevocationOutcome;
import com.example.sessionguard.web.rest.dto.CreateSessionRequest;
import com.example.sessionguard.web.rest.dto.CreateSessionResponse;
import com.example.sessionguard.web.rest.dto.RateLimitAttemptRequest;
import com.example.sessionguard.web.rest.dto.RateLimitAttemptResponse;
import com.example.sessionguard.web.rest.dto.RateLimitStatusResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Service-to-service API used by the auth-flow services. Every call needs the
 * {@code X-Internal-Api-Key} header.
 */
@Tag(
    name = "Internal",
    description = "Rate limiting, session creation and revocation for trusted services"
)
@RequestMapping(
    value = INTERNAL_BASE,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface InternalAPI {

  @Operation(
      summary = "Record an attempt at a throttled action",
      description = "Counts the attempt whatever its outcome. The caller must not perform the action on 429."
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Attempt allowed"),
      @ApiResponse(responseCode = "400", description = "Invalid identity"),
      @ApiResponse(responseCode = "404", description = "Unknown purpose"),
      @ApiResponse(responseCode = "429", description = "Limit exceeded for the current window"),
      @ApiResponse(responseCode = "503", description = "Store unavailable; treat as denied")
  })
  @PostMapping(value = RATE_LIMIT_ATTEMPTS, consumes = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<RateLimitAttemptResponse> recordAttempt(
      @Parameter(description = "login, password-reset or email-verification", example = "login")
      @PathVariable("purpose") String purpose,
      @Valid @RequestBody RateLimitAttemptRequest request
                                                        );

  @Operation(
      summary = "Remaining attempts",
      description = "Attempts left in the current window, without counting one"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Remaining attempts returned"),
      @ApiResponse(responseCode = "404", description = "Unknown purpose")
  })
  @GetMapping(value = RATE_LIMIT_REMAINING)
  ResponseEntity<RateLimitStatusResponse> remainingAttempts(
      @PathVariable("purpose") String purpose,
      @RequestParam("identity") String identity
                                                           );

  @Operation(
      summary = "Create a session",
      description = "Creates a session for a user the caller has already authenticated"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "201", description = "Session created"),
      @ApiResponse(responseCode = "400", description = "Invalid user"),
      @ApiResponse(responseCode = "503", description = "Store unavailable")
  })
  @PostMapping(value = SESSIONS, consumes = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<CreateSessionResponse> createSession(@Valid @RequestBody CreateSessionRequest request);

  @Operation(
      summary = "Track a session",
      description = "Adds an existing session to the user's index. Best-effort: failures are logged, not returned."
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "204", description = "Tracking attempted")
  })
  @PutMapping(value = USER_SESSION)
  ResponseEntity<Void> trackSession(
      @PathVariable("userId") String userId,
      @PathVariable("sessionId") String sessionId
                                   );

  @Operation(
      summary = "Revoke all sessions of a user",
      description = "Destroys every session owned by the user, e.g. after a password reset"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Revocation completed"),
      @ApiResponse(responseCode = "503", description = "Store unavailable; sessions may remain")
  })
  @DeleteMapping(value = USER_SESSIONS)
  ResponseEntity<RevocationOutcome> revokeUserSessions(@PathVariable("userId") String userId);
}
