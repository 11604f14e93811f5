package com.monsoonfire.notification.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates calls forwarded by the gateway: a valid internal token plus the forwarded user id
 * establishes the principal, and a forwarded ADMIN role unlocks the operator endpoints.
 */
public class InternalApiAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger =
      LoggerFactory.getLogger(InternalApiAuthenticationFilter.class);
  private static final String INTERNAL_ROLE = "ROLE_INTERNAL";
  private static final String ADMIN_ROLE = "ROLE_ADMIN";

  private final NotificationInternalApiProperties properties;

  public InternalApiAuthenticationFilter(NotificationInternalApiProperties properties) {
    this.properties = properties;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    final String uri = request.getRequestURI();
    return uri == null || uri.equals("/") || uri.startsWith("/actuator/");
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final UsernamePasswordAuthenticationToken authentication = resolveAuthentication(request);
    if (authentication != null) {
      logger.debug(
          "internal authentication established for path={} authorities={}",
          request.getRequestURI(),
          authentication.getAuthorities());
      SecurityContextHolder.getContext().setAuthentication(authentication);
    } else {
      logger.debug(
          "internal authentication not established for path={}", request.getRequestURI());
    }
    filterChain.doFilter(request, response);
  }

  private UsernamePasswordAuthenticationToken resolveAuthentication(HttpServletRequest request) {
    if (!isValidInternalToken(request.getHeader(properties.headerName()))) {
      return null;
    }
    final String forwardedUserId = request.getHeader(properties.userIdHeaderName());
    if (forwardedUserId == null || forwardedUserId.isBlank()) {
      return null;
    }
    return new UsernamePasswordAuthenticationToken(
        forwardedUserId.trim(),
        "N/A",
        buildAuthorities(request.getHeader(properties.userRolesHeaderName())));
  }

  private boolean isValidInternalToken(String actualToken) {
    return actualToken != null
        && actualToken.equals(properties.token())
        && !properties.token().isBlank();
  }

  private List<SimpleGrantedAuthority> buildAuthorities(String forwardedRoles) {
    final List<SimpleGrantedAuthority> authorities = new ArrayList<>();
    authorities.add(new SimpleGrantedAuthority(INTERNAL_ROLE));

    if (forwardedRoles == null || forwardedRoles.isBlank()) {
      return authorities;
    }

    for (String role : forwardedRoles.split(",")) {
      final String normalized = role == null ? "" : role.trim();
      if ("ADMIN".equals(normalized) || ADMIN_ROLE.equals(normalized)) {
        authorities.add(new SimpleGrantedAuthority(ADMIN_ROLE));
      }
    }
    return authorities;
  }
}
