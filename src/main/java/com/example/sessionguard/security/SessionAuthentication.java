package com.example.sessionguard.security;

import com.example.sessionguard.domain.entity.SessionPayload;
import com.example.sessionguard.domain.entity.SessionUser;
import java.util.Collection;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;

/**
 * Authentication backed by a live session record
 */
public class SessionAuthentication extends AbstractAuthenticationToken {

  private final String sessionId;
  private final SessionPayload payload;

  public SessionAuthentication(
      String sessionId, SessionPayload payload, Collection<? extends GrantedAuthority> authorities) {
    super(authorities);
    this.sessionId = sessionId;
    this.payload = payload;
    setAuthenticated(true);
  }

  @Override
  public Object getCredentials() {
    return null;
  }

  @Override
  public SessionUser getPrincipal() {
    return payload.user();
  }

  @Override
  public String getName() {
    return payload.ownerId();
  }

  public String getSessionId() {
    return sessionId;
  }

  public SessionPayload getPayload() {
    return payload;
  }
}
