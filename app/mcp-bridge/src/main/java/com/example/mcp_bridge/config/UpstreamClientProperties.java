/*
 * どこで: MCP Bridge 設定
 * 何を: upstream(depot API)呼び出しの URL/ヘッダー/タイムアウトを保持する
 * なぜ: ベンダー API の接続先と識別子を環境ごとに切り替えられるようにするため
 */
package com.example.mcp_bridge.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "upstream")
public record UpstreamClientProperties(
    String baseUrl,
    String loginPath,
    String depotAccountPath,
    String sessionHeaderName,
    String clientId,
    String appVersion,
    Duration connectTimeout,
    Duration readTimeout) {

  public UpstreamClientProperties {
    baseUrl =
        baseUrl == null || baseUrl.isBlank()
            ? "https://api.visualtradingjournal.com/api/v1/vtj"
            : baseUrl;
    loginPath = loginPath == null || loginPath.isBlank() ? "/user/login" : loginPath;
    depotAccountPath =
        depotAccountPath == null || depotAccountPath.isBlank()
            ? "/depot/account"
            : depotAccountPath;
    sessionHeaderName =
        sessionHeaderName == null || sessionHeaderName.isBlank() ? "session" : sessionHeaderName;
    clientId = clientId == null || clientId.isBlank() ? "vtj-app" : clientId;
    appVersion = appVersion == null || appVersion.isBlank() ? "v2.5.2" : appVersion;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(3) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(10) : readTimeout;
  }
}
