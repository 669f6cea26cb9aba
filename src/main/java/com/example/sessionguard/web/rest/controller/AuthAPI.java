package com.example.sessionguard.web.rest.controller;

import static com.example.sessionguard.web.rest.ApiConstants.ApiPath.*;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@Tag(
    name = "Authentication",
    description = "Browser-facing session status and logout"
)
@RequestMapping(
    value = AUTH_BASE,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface AuthAPI {

  @Operation(
      summary = "Logout user",
      description = "Destroys the current session and clears the session cookie. Safe to repeat."
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Successfully logged out"),
      @ApiResponse(responseCode = "503", description = "Session store unavailable")
  })
  @PostMapping(value = LOGOUT)
  ResponseEntity<Map<String, Object>> logout(HttpServletRequest request, HttpServletResponse response);

  @Operation(
      summary = "Check authentication status",
      description = "Returns whether the request carries a live session"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Authentication status returned"),
      @ApiResponse(responseCode = "401", description = "Session exceeded its absolute lifetime")
  })
  @GetMapping(value = STATUS)
  ResponseEntity<Map<String, Object>> status(HttpServletRequest request);
}
