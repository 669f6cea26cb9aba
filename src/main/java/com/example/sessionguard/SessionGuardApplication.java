package com.example.sessionguard;

import com.example.sessionguard.properties.ApplicationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Session Guard Application
 *
 * Session lifecycle and throttling service for horizontally scaled deployments:
 * - Redis-backed session records with idle and absolute timeouts
 * - Per-user session index for fast revocation
 * - Fixed-window rate limiting for sensitive actions
 */
@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
@EnableConfigurationProperties(ApplicationProperties.class)
public class SessionGuardApplication {
  public static void main(String[] args) {
    SpringApplication app = new SpringApplication(SessionGuardApplication.class);

    app.setLazyInitialization(false);
    app.setRegisterShutdownHook(true); // lets RedisLifecycleConfig disconnect the store

    app.run(args);
  }
}
