/*
 * どこで: MCP プロトコル層
 * 何を: JSON-RPC メッセージを解析し、MCP メソッドへ振り分ける
 * なぜ: HTTP 層からプロトコル処理を切り離し、セッション無しでも単体で検証できるようにするため
 */
package com.example.mcp_bridge.mcp;

import com.example.mcp_bridge.config.McpProperties;
import com.example.mcp_bridge.mcp.tool.CallToolResult;
import com.example.mcp_bridge.mcp.tool.McpTool;
import com.example.mcp_bridge.mcp.tool.ToolCallContext;
import com.example.mcp_bridge.model.AuthContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class McpRequestDispatcher {

  public static final String METHOD_INITIALIZE = "initialize";
  static final List<String> SUPPORTED_PROTOCOL_VERSIONS =
      List.of("2025-06-18", "2025-03-26", "2024-11-05");

  private static final Logger logger = LoggerFactory.getLogger(McpRequestDispatcher.class);

  private final ObjectMapper objectMapper;
  private final McpProperties properties;
  private final Map<String, McpTool> tools;

  public McpRequestDispatcher(
      ObjectMapper objectMapper, McpProperties properties, List<McpTool> tools) {
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.tools =
        tools.stream()
            .collect(
                Collectors.toMap(
                    McpTool::name, Function.identity(), (a, b) -> a, LinkedHashMap::new));
  }

  /**
   * 役割: POST 本文を JSON-RPC メッセージとして解析する。
   *
   * <p>期待動作: JSON でなければ -32700、JSON-RPC 2.0 の形でなければ -32600 の {@link McpProtocolException}。
   * クライアントからの応答メッセージ(method なし)は空で返す。
   */
  public Optional<JsonRpcRequest> parse(String body) {
    final JsonNode root;
    try {
      root = body == null ? null : objectMapper.readTree(body);
    } catch (JsonProcessingException ex) {
      throw new McpProtocolException(JsonRpcError.PARSE_ERROR, "Parse error");
    }
    if (root == null || !root.isObject()) {
      throw new McpProtocolException(JsonRpcError.INVALID_REQUEST, "Invalid Request");
    }
    if (!JsonRpcResponse.VERSION.equals(root.path("jsonrpc").asText(null))) {
      throw new McpProtocolException(JsonRpcError.INVALID_REQUEST, "Invalid Request");
    }
    final JsonNode method = root.get("method");
    if (method == null) {
      if (root.has("result") || root.has("error")) {
        return Optional.empty();
      }
      throw new McpProtocolException(JsonRpcError.INVALID_REQUEST, "Invalid Request");
    }
    if (!method.isTextual()) {
      throw new McpProtocolException(JsonRpcError.INVALID_REQUEST, "Invalid Request");
    }
    return Optional.of(new JsonRpcRequest(root.get("id"), method.asText(), root.get("params")));
  }

  /** 通知には応答しないので空を返す。 */
  public Optional<JsonRpcResponse> dispatch(
      JsonRpcRequest request, McpStreamTransport transport, Optional<AuthContext> authContext) {
    transport.touch();
    if (request.isNotification()) {
      logger.debug("mcp notification method={} sessionId={}", request.method(), transport.sessionId());
      return Optional.empty();
    }
    try {
      final Object result =
          switch (request.method()) {
            case METHOD_INITIALIZE -> initialize(request.params());
            case "ping" -> Map.of();
            case "tools/list" -> listTools();
            case "tools/call" -> callTool(request.params(), transport, authContext);
            case "logging/setLevel" -> setLogLevel(request.params(), transport);
            default -> throw new McpProtocolException(
                JsonRpcError.METHOD_NOT_FOUND, "Method not found: " + request.method());
          };
      return Optional.of(JsonRpcResponse.success(request.id(), result));
    } catch (McpProtocolException ex) {
      return Optional.of(JsonRpcResponse.failure(request.id(), ex.toError()));
    }
  }

  private Map<String, Object> initialize(JsonNode params) {
    final String requested = params.path("protocolVersion").asText(null);
    final String negotiated =
        SUPPORTED_PROTOCOL_VERSIONS.contains(requested)
            ? requested
            : SUPPORTED_PROTOCOL_VERSIONS.get(0);
    final Map<String, Object> result = new LinkedHashMap<>();
    result.put("protocolVersion", negotiated);
    result.put(
        "capabilities", Map.of("tools", Map.of("listChanged", false), "logging", Map.of()));
    result.put(
        "serverInfo",
        Map.of("name", properties.serverName(), "version", properties.serverVersion()));
    return result;
  }

  private Map<String, Object> listTools() {
    final List<Map<String, Object>> descriptors =
        tools.values().stream()
            .map(
                tool ->
                    Map.<String, Object>of(
                        "name", tool.name(),
                        "description", tool.description(),
                        "inputSchema", tool.inputSchema()))
            .toList();
    return Map.of("tools", descriptors);
  }

  private CallToolResult callTool(
      JsonNode params, McpStreamTransport transport, Optional<AuthContext> authContext) {
    final String name = params.path("name").asText(null);
    final McpTool tool = name == null ? null : tools.get(name);
    if (tool == null) {
      throw new McpProtocolException(JsonRpcError.INVALID_PARAMS, "Unknown tool: " + name);
    }
    final JsonNode arguments = params.path("arguments");
    try {
      return tool.call(
          arguments.isObject() ? arguments : objectMapper.createObjectNode(),
          new ToolCallContext(transport, authContext));
    } catch (IllegalArgumentException ex) {
      throw new McpProtocolException(JsonRpcError.INVALID_PARAMS, ex.getMessage());
    } catch (RuntimeException ex) {
      logger.error("tool call failed tool={} sessionId={}", name, transport.sessionId(), ex);
      return CallToolResult.error("Tool " + name + " failed: " + ex.getMessage());
    }
  }

  private Map<String, Object> setLogLevel(JsonNode params, McpStreamTransport transport) {
    final McpLogLevel level =
        McpLogLevel.fromValue(params.path("level").asText(null))
            .orElseThrow(
                () -> new McpProtocolException(JsonRpcError.INVALID_PARAMS, "Invalid log level"));
    transport.setLogLevel(level);
    return Map.of();
  }
}
