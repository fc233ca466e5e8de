package com.example.mcp_bridge.mcp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.mcp_bridge.config.McpProperties;
import com.example.mcp_bridge.mcp.tool.CallToolResult;
import com.example.mcp_bridge.mcp.tool.GreetTool;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class McpRequestDispatcherTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final McpRequestDispatcher dispatcher =
      new McpRequestDispatcher(
          objectMapper,
          new McpProperties("test-server", "9.9.9", null, null, null),
          List.of(new GreetTool()));
  private final McpStreamTransport transport =
      new McpStreamTransport("s-1", new InMemoryEventStore(), objectMapper, Clock.systemUTC());

  @Test
  void initializeNegotiatesRequestedVersionAndAdvertisesCapabilities() {
    final JsonNode result =
        resultOf(
            """
            {"jsonrpc":"2.0","id":1,"method":"initialize",
             "params":{"protocolVersion":"2025-03-26","capabilities":{},
                       "clientInfo":{"name":"c","version":"1"}}}
            """);

    assertThat(result.path("protocolVersion").asText()).isEqualTo("2025-03-26");
    assertThat(result.path("capabilities").has("tools")).isTrue();
    assertThat(result.path("capabilities").has("logging")).isTrue();
    assertThat(result.path("serverInfo").path("name").asText()).isEqualTo("test-server");
    assertThat(result.path("serverInfo").path("version").asText()).isEqualTo("9.9.9");
  }

  @Test
  void initializeFallsBackToLatestVersion() {
    final JsonNode result =
        resultOf(
            """
            {"jsonrpc":"2.0","id":1,"method":"initialize","params":{"protocolVersion":"1999-01-01"}}
            """);

    assertThat(result.path("protocolVersion").asText()).isEqualTo("2025-06-18");
  }

  @Test
  void toolsListAndCallGreet() {
    final JsonNode list = resultOf("{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"tools/list\"}");
    assertThat(list.path("tools").get(0).path("name").asText()).isEqualTo("greet");
    assertThat(list.path("tools").get(0).path("inputSchema").path("type").asText())
        .isEqualTo("object");

    final JsonNode call =
        resultOf(
            """
            {"jsonrpc":"2.0","id":3,"method":"tools/call",
             "params":{"name":"greet","arguments":{"name":"Ada"}}}
            """);
    assertThat(call.path("content").get(0).path("text").asText()).isEqualTo("Hello, Ada!");
    assertThat(call.path("isError").asBoolean()).isFalse();
  }

  @Test
  void unknownToolAndBadArgumentsAreInvalidParams() {
    assertThat(errorCodeOf(
            "{\"jsonrpc\":\"2.0\",\"id\":4,\"method\":\"tools/call\",\"params\":{\"name\":\"nope\"}}"))
        .isEqualTo(JsonRpcError.INVALID_PARAMS);
    assertThat(errorCodeOf(
            "{\"jsonrpc\":\"2.0\",\"id\":5,\"method\":\"tools/call\",\"params\":{\"name\":\"greet\",\"arguments\":{}}}"))
        .isEqualTo(JsonRpcError.INVALID_PARAMS);
  }

  @Test
  void unknownMethodIsMethodNotFoundWithRequestId() {
    final JsonRpcResponse response = dispatch("{\"jsonrpc\":\"2.0\",\"id\":\"abc\",\"method\":\"foo/bar\"}");

    assertThat(response.error().code()).isEqualTo(JsonRpcError.METHOD_NOT_FOUND);
    assertThat(response.id().asText()).isEqualTo("abc");
  }

  @Test
  void setLevelChangesTransportLogLevel() {
    resultOf(
        "{\"jsonrpc\":\"2.0\",\"id\":6,\"method\":\"logging/setLevel\",\"params\":{\"level\":\"error\"}}");

    assertThat(transport.logLevel()).isEqualTo(McpLogLevel.ERROR);
    assertThat(errorCodeOf(
            "{\"jsonrpc\":\"2.0\",\"id\":7,\"method\":\"logging/setLevel\",\"params\":{\"level\":\"loud\"}}"))
        .isEqualTo(JsonRpcError.INVALID_PARAMS);
  }

  @Test
  void notificationsProduceNoResponse() {
    final JsonRpcRequest request =
        dispatcher
            .parse("{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}")
            .orElseThrow();

    assertThat(dispatcher.dispatch(request, transport, Optional.empty())).isEmpty();
  }

  @Test
  void clientResponsesAreAcceptedWithoutDispatch() {
    assertThat(dispatcher.parse("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{}}")).isEmpty();
  }

  @Test
  void malformedMessagesAreRejected() {
    assertThatThrownBy(() -> dispatcher.parse("{not json"))
        .isInstanceOf(McpProtocolException.class)
        .extracting(ex -> ((McpProtocolException) ex).code())
        .isEqualTo(JsonRpcError.PARSE_ERROR);
    assertThatThrownBy(() -> dispatcher.parse("{\"jsonrpc\":\"1.0\",\"id\":1,\"method\":\"ping\"}"))
        .isInstanceOf(McpProtocolException.class)
        .extracting(ex -> ((McpProtocolException) ex).code())
        .isEqualTo(JsonRpcError.INVALID_REQUEST);
    assertThatThrownBy(() -> dispatcher.parse("[]"))
        .isInstanceOf(McpProtocolException.class)
        .extracting(ex -> ((McpProtocolException) ex).code())
        .isEqualTo(JsonRpcError.INVALID_REQUEST);
  }

  @Test
  void toolResultSerializesIsErrorFlag() {
    final JsonNode node = objectMapper.valueToTree(CallToolResult.error("boom"));

    assertThat(node.path("isError").asBoolean()).isTrue();
    assertThat(node.path("content").get(0).path("type").asText()).isEqualTo("text");
  }

  private JsonRpcResponse dispatch(String body) {
    final JsonRpcRequest request = dispatcher.parse(body).orElseThrow();
    return dispatcher.dispatch(request, transport, Optional.empty()).orElseThrow();
  }

  private JsonNode resultOf(String body) {
    final JsonRpcResponse response = dispatch(body);
    assertThat(response.error()).isNull();
    return objectMapper.valueToTree(response.result());
  }

  private int errorCodeOf(String body) {
    final JsonRpcResponse response = dispatch(body);
    assertThat(response.result()).isNull();
    return response.error().code();
  }
}
