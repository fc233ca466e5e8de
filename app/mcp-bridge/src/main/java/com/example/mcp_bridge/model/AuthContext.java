/*
 * どこで: app/mcp-bridge/src/main/java/com/example/mcp_bridge/model/AuthContext.java
 * 何を: bearer トークンをイントロスペクションして得た MCP 接続の認証コンテキスト
 * なぜ: ツール呼び出し時にトークン再検証なしで identity と depot を参照するため
 */
package com.example.mcp_bridge.model;

import java.util.List;

public record AuthContext(
    String token,
    String clientId,
    List<String> scopes,
    long expiresAtEpochSeconds,
    String resource,
    String identity,
    String upstreamSession,
    List<String> depotIds,
    String upstreamStatus) {

  public AuthContext {
    scopes = scopes == null ? List.of() : List.copyOf(scopes);
    depotIds = depotIds == null ? List.of() : List.copyOf(depotIds);
  }

  public boolean hasIdentity() {
    return identity != null && !identity.isBlank();
  }

  @Override
  public String toString() {
    return "AuthContext[clientId="
        + clientId
        + ", scopes="
        + scopes
        + ", identity="
        + identity
        + ", depotIds="
        + depotIds
        + ", upstreamStatus="
        + upstreamStatus
        + "]";
  }
}
