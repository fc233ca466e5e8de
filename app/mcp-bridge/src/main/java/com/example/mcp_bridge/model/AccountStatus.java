/*
 * どこで: app/mcp-bridge/src/main/java/com/example/mcp_bridge/model/AccountStatus.java
 * 何を: upstream アカウント接続状態を表す列挙型
 * なぜ: 自動再ログインの可否を状態で一貫して判定するため
 */
package com.example.mcp_bridge.model;

public enum AccountStatus {
  CONNECTED,
  /** 再ログイン自体が失敗した状態。対話ログインで上書きされるまで終端。 */
  BROKEN_NEEDS_USER
}
