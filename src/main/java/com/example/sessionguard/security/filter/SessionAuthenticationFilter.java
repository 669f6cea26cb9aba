package com.example.sessionguard.security.filter;

import com.example.sessionguard.domain.entity.SessionCheck;
import com.example.sessionguard.domain.entity.SessionPayload;
import com.example.sessionguard.domain.entity.SessionUser;
import com.example.sessionguard.security.SessionAuthentication;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates the request from the session already validated by {@link SessionTtlFilter}.
 * It performs no store calls of its own.
 */
@Slf4j
@Component
public class SessionAuthenticationFilter extends OncePerRequestFilter {

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain
                                 ) throws ServletException, IOException {

    Object attribute = request.getAttribute(SessionTtlFilter.SESSION_ATTRIBUTE);
    if (attribute instanceof SessionCheck check && check.isActive()) {
      SessionPayload payload = check.payload();
      SecurityContextHolder.getContext().setAuthentication(
          new SessionAuthentication(check.sessionId(), payload, authoritiesFor(payload.user())));
      log.trace("SessionAuthenticationFilter: authenticated user {}", payload.ownerId());
    }

    filterChain.doFilter(request, response);
  }

  private List<GrantedAuthority> authoritiesFor(SessionUser user) {
    List<GrantedAuthority> authorities = new ArrayList<>();
    authorities.add(new SimpleGrantedAuthority("ROLE_USER"));
    if (user.globalAdmin()) {
      authorities.add(new SimpleGrantedAuthority("ROLE_ADMIN"));
    }
    if (user.staffRole()) {
      authorities.add(new SimpleGrantedAuthority("ROLE_STAFF"));
    }
    return authorities;
  }
}
