package com.example.mcp_bridge.mcp;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/** MCP logging の重大度。宣言順が低い順。 */
public enum McpLogLevel {
  DEBUG,
  INFO,
  NOTICE,
  WARNING,
  ERROR,
  CRITICAL,
  ALERT,
  EMERGENCY;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public boolean isAtLeast(McpLogLevel threshold) {
    return ordinal() >= threshold.ordinal();
  }

  public static Optional<McpLogLevel> fromValue(String value) {
    if (value == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(level -> level.value().equals(value)).findFirst();
  }
}
