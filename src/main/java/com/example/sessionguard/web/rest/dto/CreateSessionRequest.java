package com.example.sessionguard.web.rest.dto;

import com.example.sessionguard.domain.entity.SessionUser;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Identity of a user who has just been authenticated by the caller.
 */
public record CreateSessionRequest(
    @NotBlank(message = "userId is required")
    @Size(max = 128, message = "userId must be at most 128 characters")
    String userId,
    @Email(message = "email must be a valid address")
    String email,
    boolean globalAdmin,
    boolean emailVerified,
    boolean staffRole
) {

  public SessionUser toSessionUser() {
    return new SessionUser(userId, email, globalAdmin, emailVerified, staffRole);
  }
}
