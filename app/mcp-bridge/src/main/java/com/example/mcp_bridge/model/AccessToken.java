/*
 * どこで: app/mcp-bridge/src/main/java/com/example/mcp_bridge/model/AccessToken.java
 * 何を: 発行済みアクセストークンのサーバー側レコード
 * なぜ: トークン文字列自体には何も埋め込まず、identity はここからのみ解決するため
 */
package com.example.mcp_bridge.model;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public record AccessToken(
    String token,
    String clientId,
    List<String> scopes,
    Instant expiresAt,
    String resource,
    TokenExtra extra) {

  public AccessToken {
    scopes = scopes == null ? List.of() : List.copyOf(scopes);
    extra = extra == null ? TokenExtra.EMPTY : extra;
  }

  public boolean isExpired(Instant now) {
    return !expiresAt.isAfter(now);
  }

  public Optional<String> identity() {
    return Optional.ofNullable(extra.identity());
  }

  @Override
  public String toString() {
    return "AccessToken[clientId="
        + clientId
        + ", scopes="
        + scopes
        + ", expiresAt="
        + expiresAt
        + ", resource="
        + resource
        + ", extra="
        + extra
        + "]";
  }

  /** PKCE バインディングから解決した付加情報。identity が無いトークンもある。 */
  public record TokenExtra(String identity) {
    public static final TokenExtra EMPTY = new TokenExtra(null);
  }
}
