package com.example.mcp_bridge.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

/** 受信した JSON-RPC 2.0 メッセージ。id が無いものは通知として扱う。 */
public record JsonRpcRequest(JsonNode id, String method, JsonNode params) {

  public JsonRpcRequest {
    params = params == null ? NullNode.getInstance() : params;
  }

  public boolean isNotification() {
    return id == null;
  }
}
