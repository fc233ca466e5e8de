package com.example.mcp_bridge.mcp.tool;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class GreetTool implements McpTool {

  static final String NAME = "greet";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public String description() {
    return "A simple greeting tool";
  }

  @Override
  public Map<String, Object> inputSchema() {
    return Map.of(
        "type", "object",
        "properties", Map.of("name", Map.of("type", "string", "description", "Name to greet")),
        "required", List.of("name"));
  }

  @Override
  public CallToolResult call(JsonNode arguments, ToolCallContext context) {
    final JsonNode name = arguments.path("name");
    if (!name.isTextual() || name.asText().isBlank()) {
      throw new IllegalArgumentException("name is required");
    }
    return CallToolResult.text("Hello, " + name.asText() + "!");
  }
}
