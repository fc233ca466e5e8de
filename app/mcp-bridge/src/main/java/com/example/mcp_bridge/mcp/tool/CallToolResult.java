package com.example.mcp_bridge.mcp.tool;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record CallToolResult(
    @JsonProperty("content") List<Content> content, @JsonProperty("isError") boolean isError) {

  public CallToolResult {
    content = content == null ? List.of() : List.copyOf(content);
  }

  public static CallToolResult text(String text) {
    return new CallToolResult(List.of(Content.text(text)), false);
  }

  public static CallToolResult error(String text) {
    return new CallToolResult(List.of(Content.text(text)), true);
  }

  public record Content(String type, String text) {
    public static Content text(String text) {
      return new Content("text", text);
    }
  }
}
