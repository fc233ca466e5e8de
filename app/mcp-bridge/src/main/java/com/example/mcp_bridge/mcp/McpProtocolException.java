package com.example.mcp_bridge.mcp;

/** HTTP 400 と JSON-RPC エラー応答で返すプロトコル違反。 */
public class McpProtocolException extends RuntimeException {

  private final int code;

  public McpProtocolException(int code, String message) {
    super(message);
    this.code = code;
  }

  public int code() {
    return code;
  }

  public JsonRpcError toError() {
    return new JsonRpcError(code, getMessage());
  }
}
