package com.example.sessionguard.config;

import com.example.sessionguard.security.filter.InternalApiKeyFilter;
import com.example.sessionguard.security.filter.SessionAuthenticationFilter;
import com.example.sessionguard.security.filter.SessionTtlFilter;
import com.example.sessionguard.web.rest.errors.DelegatedAuthenticationEntryPoint;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.security.SecurityProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.annotation.web.configurers.HeadersConfigurer.FrameOptionsConfig;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.security.web.header.writers.ReferrerPolicyHeaderWriter.ReferrerPolicy;

/**
 * Security configuration for stateless, horizontally scaled instances.
 * <p>
 * The session TTL filter is a plain servlet filter ordered ahead of Spring Security, so the
 * absolute timeout is enforced on every route. The security chains then decide who may call what:
 * PUBLIC (@Order(1)): auth status/logout, health, docs.
 * INTERNAL (@Order(2)): service-to-service endpoints, API key required.
 * PROTECTED (@Order(3)): session-cookie authenticated endpoints.
 * DEFAULT (@Order(4)): deny everything else.
 */
@Configuration(proxyBeanMethods = false)
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

  private final SessionTtlFilter sessionTtlFilter;
  private final SessionAuthenticationFilter sessionAuthenticationFilter;
  private final InternalApiKeyFilter internalApiKeyFilter;
  private final DelegatedAuthenticationEntryPoint delegatedAuthenticationEntryPoint;

  @Bean
  public FilterRegistrationBean<SessionTtlFilter> sessionTtlFilterRegistration() {
    FilterRegistrationBean<SessionTtlFilter> registration = new FilterRegistrationBean<>(sessionTtlFilter);
    registration.setOrder(SecurityProperties.DEFAULT_FILTER_ORDER - 10);
    registration.addUrlPatterns("/*");
    return registration;
  }

  // The next two only run inside their security chains
  @Bean
  public FilterRegistrationBean<SessionAuthenticationFilter> sessionAuthenticationFilterRegistration() {
    FilterRegistrationBean<SessionAuthenticationFilter> registration =
        new FilterRegistrationBean<>(sessionAuthenticationFilter);
    registration.setEnabled(false);
    return registration;
  }

  @Bean
  public FilterRegistrationBean<InternalApiKeyFilter> internalApiKeyFilterRegistration() {
    FilterRegistrationBean<InternalApiKeyFilter> registration = new FilterRegistrationBean<>(internalApiKeyFilter);
    registration.setEnabled(false);
    return registration;
  }

  @Bean
  @Order(1)
  public SecurityFilterChain publicEndpointsFilterChain(HttpSecurity http) throws Exception {
    http
        .securityMatcher("/auth/**",
                         "/actuator/**",
                         "/health/**",
                         "/v3/api-docs/**",
                         "/swagger-ui/**",
                         "/swagger-ui.html")
        .authorizeHttpRequests(authorize -> authorize.anyRequest().permitAll());

    applyCommonSettings(http);
    return http.build();
  }

  @Bean
  @Order(2)
  public SecurityFilterChain internalEndpointsFilterChain(HttpSecurity http) throws Exception {
    http
        .securityMatcher("/internal/**")
        .addFilterBefore(internalApiKeyFilter, UsernamePasswordAuthenticationFilter.class)
        .authorizeHttpRequests(authorize -> authorize.anyRequest().hasRole("INTERNAL"))
        .exceptionHandling(exceptions ->
                               exceptions.authenticationEntryPoint(delegatedAuthenticationEntryPoint));

    applyCommonSettings(http);
    return http.build();
  }

  @Bean
  @Order(3)
  public SecurityFilterChain protectedEndpointsFilterChain(HttpSecurity http) throws Exception {
    http
        .securityMatcher("/api/**")
        .addFilterBefore(sessionAuthenticationFilter, UsernamePasswordAuthenticationFilter.class)
        .authorizeHttpRequests(authorize -> authorize.anyRequest().authenticated())
        // JSON 401 instead of a login page
        .exceptionHandling(exceptions ->
                               exceptions.authenticationEntryPoint(delegatedAuthenticationEntryPoint));

    applyCommonSettings(http);
    return http.build();
  }

  @Bean
  @Order(4)
  public SecurityFilterChain defaultDenyFilterChain(HttpSecurity http) throws Exception {
    http.authorizeHttpRequests(authorize -> authorize.anyRequest().denyAll());
    applyCommonSettings(http);
    return http.build();
  }

  private void applyCommonSettings(HttpSecurity http) throws Exception {
    http
        // Sessions live in Redis and are handled by our own filters
        .csrf(AbstractHttpConfigurer::disable)
        .sessionManagement(session -> session
                               .sessionCreationPolicy(SessionCreationPolicy.STATELESS)
                          )
        .headers(headers -> headers
                     .frameOptions(FrameOptionsConfig::deny)
                     .contentTypeOptions(contentType -> {
                     })
                     .referrerPolicy(referrer -> referrer
                                         .policy(ReferrerPolicy.STRICT_ORIGIN_WHEN_CROSS_ORIGIN)
                                    )
                     .httpStrictTransportSecurity(hsts -> hsts
                                                      .maxAgeInSeconds(Duration.ofDays(365).toSeconds())
                                                      .includeSubDomains(true)
                                                 )
                     .addHeaderWriter((request, response) -> {
                       response.setHeader("Cache-Control", "no-cache, no-store, must-revalidate");
                       response.setHeader("Pragma", "no-cache");
                     })
                );
  }
}
