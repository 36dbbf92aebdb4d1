package com.chatrelay.chatstore.api;

import com.chatrelay.chatstore.api.ApiExceptionHandler.ErrorResponse;
import com.chatrelay.chatstore.config.InternalAuthProperties;
import com.chatrelay.chatstore.store.StoreConfigurationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Admits chat and message events only from the messaging client holding the shared token.
 *
 * <p>The token is required at startup: an ingestion surface without one would either be open or
 * reject every event.
 */
@Component
@Slf4j
public class InternalApiAuthFilter extends OncePerRequestFilter {

  static final String TOKEN_HEADER = "X-Internal-Token";

  private static final String PROTECTED_PREFIX = "/internal/";

  private final byte[] expectedToken;
  private final ObjectMapper objectMapper;

  public InternalApiAuthFilter(InternalAuthProperties properties, ObjectMapper objectMapper) {
    String token = properties == null ? null : properties.token();
    if (token == null || token.isBlank()) {
      throw new StoreConfigurationException(
          "internal.auth.token is required (INTERNAL_AUTH_TOKEN)");
    }
    this.expectedToken = token.trim().getBytes(StandardCharsets.UTF_8);
    this.objectMapper = objectMapper;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String path = request.getServletPath();
    return path == null || !path.startsWith(PROTECTED_PREFIX);
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    String provided = request.getHeader(TOKEN_HEADER);
    if (provided != null
        && MessageDigest.isEqual(expectedToken, provided.getBytes(StandardCharsets.UTF_8))) {
      filterChain.doFilter(request, response);
      return;
    }

    log.warn(
        "Rejected {} {}: {} internal token",
        request.getMethod(),
        request.getRequestURI(),
        provided == null ? "missing" : "wrong");
    response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    response.setCharacterEncoding(StandardCharsets.UTF_8.name());
    objectMapper.writeValue(
        response.getOutputStream(),
        ErrorResponse.of("UNAUTHORIZED", "missing or invalid " + TOKEN_HEADER + " header"));
  }
}
