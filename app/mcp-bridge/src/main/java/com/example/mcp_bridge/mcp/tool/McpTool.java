package com.example.mcp_bridge.mcp.tool;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;

/** tools/list に載り tools/call で呼ばれるツール。 */
public interface McpTool {

  String name();

  String description();

  /** JSON Schema(object 型)の入力定義。 */
  Map<String, Object> inputSchema();

  CallToolResult call(JsonNode arguments, ToolCallContext context);
}
