package com.example.mcp_bridge.service;

/** 認可/トークン/イントロスペクションの失敗。reason は OAuth エラーコードへ対応する。 */
public class OAuthFlowException extends RuntimeException {

  public enum Reason {
    INVALID_REQUEST("invalid_request"),
    INVALID_CLIENT("invalid_client"),
    INVALID_GRANT("invalid_grant"),
    INVALID_TOKEN("invalid_token"),
    INVALID_TARGET("invalid_target"),
    UNSUPPORTED_GRANT_TYPE("unsupported_grant_type"),
    NOT_IMPLEMENTED("unsupported_grant_type");

    private final String errorCode;

    Reason(String errorCode) {
      this.errorCode = errorCode;
    }

    public String errorCode() {
      return errorCode;
    }
  }

  private final Reason reason;

  public OAuthFlowException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
