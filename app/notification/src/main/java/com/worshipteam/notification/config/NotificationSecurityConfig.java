package com.worshipteam.notification.config;

import com.worshipteam.notification.repository.UserRepository;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;

@Configuration
@EnableConfigurationProperties(InternalApiProperties.class)
public class NotificationSecurityConfig {

  @Bean
  InternalApiAuthenticationFilter internalApiAuthenticationFilter(
      InternalApiProperties properties) {
    return new InternalApiAuthenticationFilter(properties);
  }

  // Runs inside the security chain only; a second servlet registration would mark the request
  // as filtered before the chain sees it.
  @Bean
  FilterRegistrationBean<InternalApiAuthenticationFilter> internalApiAuthenticationFilterRegistration(
      InternalApiAuthenticationFilter filter) {
    final FilterRegistrationBean<InternalApiAuthenticationFilter> registration =
        new FilterRegistrationBean<>(filter);
    registration.setEnabled(false);
    return registration;
  }

  @Bean
  SecurityFilterChain securityFilterChain(
      HttpSecurity http,
      InternalApiAuthenticationFilter internalApiAuthenticationFilter,
      UserRepository userRepository)
      throws Exception {
    http.csrf(csrf -> csrf.disable())
        .httpBasic(basic -> basic.disable())
        .formLogin(form -> form.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .exceptionHandling(
            handling ->
                handling.authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED)))
        .addFilterBefore(internalApiAuthenticationFilter, AuthorizationFilter.class)
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(
                        "/",
                        "/health",
                        "/error",
                        "/actuator/health",
                        "/actuator/health/**",
                        "/actuator/info",
                        "/actuator/prometheus")
                    .permitAll()
                    // Guarded by the cron secret in CronSecretVerifier.
                    .requestMatchers(HttpMethod.POST, "/api/cron/**")
                    .permitAll()
                    .requestMatchers(HttpMethod.POST, "/api/admin/**")
                    .access(RoleTierAuthorizationManager.admin(userRepository))
                    .requestMatchers(HttpMethod.POST, "/api/events/**")
                    .access(RoleTierAuthorizationManager.manager(userRepository))
                    .anyRequest()
                    .authenticated());
    return http.build();
  }
}
