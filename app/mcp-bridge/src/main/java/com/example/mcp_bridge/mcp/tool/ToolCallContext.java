package com.example.mcp_bridge.mcp.tool;

import com.example.mcp_bridge.mcp.McpStreamTransport;
import com.example.mcp_bridge.model.AuthContext;
import java.util.Optional;

/** ツール実行時のセッション情報。authContext は匿名セッションでは空。 */
public record ToolCallContext(McpStreamTransport transport, Optional<AuthContext> authContext) {

  public String sessionId() {
    return transport.sessionId();
  }
}
