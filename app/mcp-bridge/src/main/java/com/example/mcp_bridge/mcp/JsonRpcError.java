package com.example.mcp_bridge.mcp;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JsonRpcError(int code, String message, Object data) {

  public static final int PARSE_ERROR = -32700;
  public static final int INVALID_REQUEST = -32600;
  public static final int METHOD_NOT_FOUND = -32601;
  public static final int INVALID_PARAMS = -32602;
  public static final int INTERNAL_ERROR = -32603;
  // MCP Streamable HTTP でセッション不正に使うサーバー定義コード
  public static final int SERVER_ERROR = -32000;

  public JsonRpcError(int code, String message) {
    this(code, message, null);
  }
}
