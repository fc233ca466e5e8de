/*
 * どこで: MCP Bridge 設定
 * 何を: MCP セッション/ストリームの挙動とサーバー情報を保持する
 * なぜ: 認証必須化やアイドル回収を環境ごとに切り替えるため
 */
package com.example.mcp_bridge.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "bridge.mcp")
public record McpProperties(
    String serverName,
    String serverVersion,
    Boolean requireBearerToken,
    Duration sessionIdleTimeout,
    Duration reaperInterval) {

  public McpProperties {
    serverName = serverName == null || serverName.isBlank() ? "depot-mcp-bridge" : serverName;
    serverVersion = serverVersion == null || serverVersion.isBlank() ? "1.0.0" : serverVersion;
    requireBearerToken = requireBearerToken == null ? Boolean.TRUE : requireBearerToken;
    // 0 はアイドル回収なし(ストリームはセッションが閉じるまで保持)。
    sessionIdleTimeout = sessionIdleTimeout == null ? Duration.ZERO : sessionIdleTimeout;
    reaperInterval = reaperInterval == null ? Duration.ofMinutes(1) : reaperInterval;
  }

  public boolean idleReapingEnabled() {
    return !sessionIdleTimeout.isZero() && !sessionIdleTimeout.isNegative();
  }
}
