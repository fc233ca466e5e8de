/*
 * どこで: MCP Bridge 設定
 * 何を: ローカル認可サーバーの issuer/有効期限/リソース検証設定を保持する
 * なぜ: トークン寿命や厳格モードを運用で調整できるようにするため
 */
package com.example.mcp_bridge.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "bridge.oauth")
public record OAuthServerProperties(
    String issuerUrl,
    String mcpResourceUrl,
    Duration accessTokenTtl,
    Duration authorizationCodeTtl,
    boolean strictResource,
    List<String> scopesSupported,
    String resourceName,
    Duration cleanupInterval) {

  public OAuthServerProperties {
    issuerUrl = issuerUrl == null || issuerUrl.isBlank() ? "http://localhost:3000" : issuerUrl;
    mcpResourceUrl =
        mcpResourceUrl == null || mcpResourceUrl.isBlank()
            ? stripTrailingSlash(issuerUrl) + "/mcp"
            : mcpResourceUrl;
    accessTokenTtl = accessTokenTtl == null ? Duration.ofHours(1) : accessTokenTtl;
    authorizationCodeTtl =
        authorizationCodeTtl == null ? Duration.ofMinutes(10) : authorizationCodeTtl;
    scopesSupported =
        scopesSupported == null || scopesSupported.isEmpty()
            ? List.of("mcp:tools")
            : List.copyOf(scopesSupported);
    resourceName = resourceName == null || resourceName.isBlank() ? "Depot MCP Bridge" : resourceName;
    cleanupInterval = cleanupInterval == null ? Duration.ofMinutes(5) : cleanupInterval;
  }

  public String endpoint(String path) {
    return stripTrailingSlash(issuerUrl) + path;
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
