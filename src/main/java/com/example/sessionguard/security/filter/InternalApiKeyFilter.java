package com.example.sessionguard.security.filter;

import com.example.sessionguard.properties.ApplicationProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates service-to-service calls on {@code /internal/**} by a shared API key header.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InternalApiKeyFilter extends OncePerRequestFilter {

  public static final String API_KEY_HEADER = "X-Internal-Api-Key";
  private static final String INTERNAL_PRINCIPAL = "internal-service";

  private final ApplicationProperties properties;

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain
                                 ) throws ServletException, IOException {

    String presented = request.getHeader(API_KEY_HEADER);
    if (presented != null && matches(presented, properties.internal().apiKey())) {
      SecurityContextHolder.getContext().setAuthentication(
          new UsernamePasswordAuthenticationToken(
              INTERNAL_PRINCIPAL, null, List.of(new SimpleGrantedAuthority("ROLE_INTERNAL"))));
    } else if (presented != null) {
      log.warn("Rejected internal call to {} with an invalid API key", request.getRequestURI());
    }

    filterChain.doFilter(request, response);
  }

  private boolean matches(String presented, String expected) {
    return MessageDigest.isEqual(
        presented.getBytes(StandardCharsets.UTF_8), expected.getBytes(StandardCharsets.UTF_8));
  }
}
