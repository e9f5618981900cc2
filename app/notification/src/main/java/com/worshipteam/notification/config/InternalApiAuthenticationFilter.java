package com.worshipteam.notification.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Trusts the user id forwarded by the gateway when the request carries the shared internal
 * token. Identity verification itself happens upstream.
 */
public class InternalApiAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger =
      LoggerFactory.getLogger(InternalApiAuthenticationFilter.class);
  private static final String USER_ROLE = "ROLE_USER";
  private static final String MDC_USER_ID = "user_id";

  private final InternalApiProperties properties;

  public InternalApiAuthenticationFilter(InternalApiProperties properties) {
    this.properties = properties;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    final String uri = request.getRequestURI();
    return uri == null || !uri.startsWith("/api/") || uri.startsWith("/api/cron/");
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final String userId = resolveUserId(request);
    if (userId == null) {
      logger.debug("internal authentication not established for path={}", request.getRequestURI());
      filterChain.doFilter(request, response);
      return;
    }
    SecurityContextHolder.getContext()
        .setAuthentication(
            new UsernamePasswordAuthenticationToken(
                userId, "N/A", List.of(new SimpleGrantedAuthority(USER_ROLE))));
    MDC.put(MDC_USER_ID, userId);
    try {
      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_USER_ID);
    }
  }

  private String resolveUserId(HttpServletRequest request) {
    if (!isValidInternalToken(request.getHeader(properties.headerName()))) {
      return null;
    }
    final String userId = request.getHeader(properties.userIdHeaderName());
    if (userId == null || userId.isBlank()) {
      logger.warn(
          "internal request without {} on path={}",
          properties.userIdHeaderName(),
          request.getRequestURI());
      return null;
    }
    return userId.trim();
  }

  private boolean isValidInternalToken(String actualToken) {
    if (actualToken == null || properties.token().isBlank()) {
      return false;
    }
    return MessageDigest.isEqual(
        actualToken.getBytes(StandardCharsets.UTF_8),
        properties.token().getBytes(StandardCharsets.UTF_8));
  }
}
