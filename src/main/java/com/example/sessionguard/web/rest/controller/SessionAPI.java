package com.example.sessionguard.web.rest.controller;

import static com.example.sessionguard.web.rest.ApiConstants.ApiPath.*;

import com.example.sessionguard.security.SessionAuthentication;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Session information for the signed-in browser user.
 */
@Tag(
    name = "Session",
    description = "Current session information"
)
@RequestMapping(
    value = API_BASE + SESSION,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface SessionAPI {

  @Operation(
      summary = "Get current session",
      description = "Returns the signed-in user and the session's absolute expiry"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Session returned"),
      @ApiResponse(responseCode = "401", description = "Not authenticated")
  })
  @GetMapping(value = ME)
  ResponseEntity<Map<String, Object>> getCurrentSession(SessionAuthentication authentication);
}
