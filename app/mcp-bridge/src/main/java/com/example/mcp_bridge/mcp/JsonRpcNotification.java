package com.example.mcp_bridge.mcp;

/** サーバーからクライアントへ送る通知(id なし)。 */
public record JsonRpcNotification(String jsonrpc, String method, Object params) {

  public static JsonRpcNotification of(String method, Object params) {
    return new JsonRpcNotification(JsonRpcResponse.VERSION, method, params);
  }
}
