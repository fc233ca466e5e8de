package com.example.mcp_bridge.model;

import java.io.Serializable;
import java.util.List;

/** ログインブリッジ成功後にブラウザセッションへ保存する利用者情報。 */
public record BrowserSessionUser(
    String identity, String email, String upstreamSession, List<String> depotIds)
    implements Serializable {

  public static final String SESSION_ATTRIBUTE = BrowserSessionUser.class.getName();

  public BrowserSessionUser {
    depotIds = depotIds == null ? List.of() : List.copyOf(depotIds);
  }

  @Override
  public String toString() {
    return "BrowserSessionUser[identity=" + identity + ", email=" + email + "]";
  }
}
