/*
 * どこで: MCP Bridge サービス層
 * 何を: upstream アカウント呼び出し(自動再ログイン込み)の失敗を種別付きで表す
 * なぜ: ツール側で「再ログインが必要」と「一時障害」を区別して利用者へ伝えるため
 */
package com.example.mcp_bridge.service;

public class UpstreamAccountException extends RuntimeException {

  public enum Reason {
    ACCOUNT_NOT_LINKED,
    NO_DEPOT_AVAILABLE,
    UPSTREAM_CREDENTIALS_INVALID,
    UPSTREAM_SESSION_UNRECOVERABLE,
    UPSTREAM_TRANSIENT_ERROR
  }

  private final Reason reason;

  public UpstreamAccountException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public UpstreamAccountException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }

  /** 利用者の対話ログインが必要な失敗か。 */
  public boolean requiresUserLogin() {
    return reason == Reason.UPSTREAM_CREDENTIALS_INVALID
        || reason == Reason.UPSTREAM_SESSION_UNRECOVERABLE
        || reason == Reason.ACCOUNT_NOT_LINKED;
  }
}
