package com.codeheadsystems.sendkey.springboot.security;

import com.codeheadsystems.sendkey.server.auth.TokenManager;
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
 * Servlet filter that authenticates requests carrying an {@code Authorization: Bearer <token>} header.
 * <p>
 * A verified access token populates the security context with a {@link SendKeyPrincipal}.
 * Anything else leaves the request anonymous, so protected routes answer 401.
 */
public class JwtAuthenticationFilter extends OncePerRequestFilter {

  private static final String BEARER_PREFIX = "Bearer ";

  private final TokenManager tokenManager;

  public JwtAuthenticationFilter(TokenManager tokenManager) {
    this.tokenManager = tokenManager;
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request,
                                  HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {
    String header = request.getHeader("Authorization");
    if (header != null && header.startsWith(BEARER_PREFIX)) {
      String token = header.substring(BEARER_PREFIX.length()).trim();
      tokenManager.verify(token).ifPresent(userId -> {
        UsernamePasswordAuthenticationToken auth = new UsernamePasswordAuthenticationToken(
            new SendKeyPrincipal(userId), null, List.of());
        SecurityContextHolder.getContext().setAuthentication(auth);
      });
    }
    filterChain.doFilter(request, response);
  }
}
