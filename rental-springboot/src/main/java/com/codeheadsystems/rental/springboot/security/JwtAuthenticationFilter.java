package com.codeheadsystems.rental.springboot.security;

import com.codeheadsystems.rental.server.auth.SessionTokenManager;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates requests carrying {@code Authorization: Bearer <token>}. Requests without a
 * valid token pass through unauthenticated and are rejected by the security chain where a
 * route requires authentication.
 */
public class JwtAuthenticationFilter extends OncePerRequestFilter {

  private static final String BEARER = "Bearer ";

  private final SessionTokenManager tokenManager;

  public JwtAuthenticationFilter(SessionTokenManager tokenManager) {
    this.tokenManager = tokenManager;
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {
    String authHeader = request.getHeader("Authorization");
    if (authHeader != null && authHeader.startsWith(BEARER)) {
      String token = authHeader.substring(BEARER.length()).trim();
      tokenManager.verify(token).ifPresent(username -> {
        RentalPrincipal principal = new RentalPrincipal(username, token);
        UsernamePasswordAuthenticationToken auth =
            new UsernamePasswordAuthenticationToken(principal, null, List.of());
        SecurityContextHolder.getContext().setAuthentication(auth);
      });
    }
    filterChain.doFilter(request, response);
  }
}
