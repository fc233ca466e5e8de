/*
 * どこで: MCP Bridge セキュリティ
 * 何を: /mcp の Authorization: Bearer をイントロスペクションして認証コンテキストを設定する
 * なぜ: 無効トークンを MCP 処理より前に 401 で弾き、有効なら identity をセッションへ渡すため
 */
package com.example.mcp_bridge.config;

import com.example.mcp_bridge.model.AuthContext;
import com.example.mcp_bridge.service.IntrospectionService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

public class McpBearerTokenFilter extends OncePerRequestFilter {

  static final String BEARER_PREFIX = "Bearer ";

  private static final Logger logger = LoggerFactory.getLogger(McpBearerTokenFilter.class);

  private final IntrospectionService introspectionService;
  private final OAuthServerProperties properties;

  public McpBearerTokenFilter(
      IntrospectionService introspectionService, OAuthServerProperties properties) {
    this.introspectionService = introspectionService;
    this.properties = properties;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !BridgeSecurityConfig.MCP_PATH.equals(request.getServletPath())
        && !BridgeSecurityConfig.MCP_PATH.equals(request.getRequestURI());
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
    if (authorization == null || authorization.isBlank()) {
      filterChain.doFilter(request, response);
      return;
    }
    if (!authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
      reject(response, "invalid_request", "Authorization header must use the Bearer scheme");
      return;
    }
    final String token = authorization.substring(BEARER_PREFIX.length()).trim();
    final Optional<AuthContext> authContext = introspectionService.resolveAuthContext(token);
    if (authContext.isEmpty()) {
      reject(response, "invalid_token", "The access token is invalid or expired");
      return;
    }
    if (properties.strictResource()
        && !properties.mcpResourceUrl().equals(authContext.get().resource())) {
      logger.info("bearer token audience mismatch aud={}", authContext.get().resource());
      reject(response, "invalid_token", "The access token was not issued for this resource");
      return;
    }
    SecurityContextHolder.getContext().setAuthentication(new McpAuthenticationToken(authContext.get()));
    filterChain.doFilter(request, response);
  }

  private void reject(HttpServletResponse response, String error, String description)
      throws IOException {
    response.setHeader(
        HttpHeaders.WWW_AUTHENTICATE,
        BridgeSecurityConfig.bearerChallenge(properties, error, description));
    response.sendError(HttpServletResponse.SC_UNAUTHORIZED, description);
  }
}
