package com.example.mcp_bridge.model;

import java.time.Instant;

/** 単回使用の認可コード。交換時に削除される。 */
public record AuthorizationCode(
    String code, String clientId, AuthorizationParams params, Instant issuedAt, Instant expiresAt) {

  public boolean isExpired(Instant now) {
    return !expiresAt.isAfter(now);
  }
}
