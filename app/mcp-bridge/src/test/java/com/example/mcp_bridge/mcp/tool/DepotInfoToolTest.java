package com.example.mcp_bridge.mcp.tool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.mcp_bridge.mcp.InMemoryEventStore;
import com.example.mcp_bridge.mcp.McpStreamTransport;
import com.example.mcp_bridge.model.AuthContext;
import com.example.mcp_bridge.service.AutoReloginService;
import com.example.mcp_bridge.service.UpstreamAccountException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DepotInfoToolTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final McpStreamTransport transport =
      new McpStreamTransport("s-1", new InMemoryEventStore(), objectMapper, Clock.systemUTC());

  @Mock private AutoReloginService autoReloginService;
  @InjectMocks private DepotInfoTool tool;

  @Test
  void failsClosedWithoutAuthContext() {
    final CallToolResult result =
        tool.call(objectMapper.createObjectNode(), new ToolCallContext(transport, Optional.empty()));

    assertThat(result.isError()).isTrue();
    verify(autoReloginService, never()).callWithAutoRelogin(anyString(), any());
  }

  @Test
  void failsClosedWhenTokenHasNoIdentity() {
    final CallToolResult result =
        tool.call(objectMapper.createObjectNode(), context(null));

    assertThat(result.isError()).isTrue();
    verify(autoReloginService, never()).callWithAutoRelogin(any(), any());
  }

  @Test
  void depotIndexSelectsFromAuthContextDepots() {
    final ObjectNode payload = objectMapper.createObjectNode().put("cash", 42);
    when(autoReloginService.callWithAutoRelogin("user-1", "depot-2")).thenReturn(payload);

    final CallToolResult result =
        tool.call(objectMapper.createObjectNode().put("depotIndex", 1), context("user-1"));

    assertThat(result.isError()).isFalse();
    assertThat(result.content().get(0).text()).contains("\"cash\" : 42");
  }

  @Test
  void explicitDepotIdWinsAndDefaultsToOrchestratorChoice() {
    final ObjectNode payload = objectMapper.createObjectNode();
    when(autoReloginService.callWithAutoRelogin("user-1", "depot-x")).thenReturn(payload);
    when(autoReloginService.callWithAutoRelogin("user-1", null)).thenReturn(payload);

    tool.call(
        objectMapper.createObjectNode().put("depotId", "depot-x").put("depotIndex", 0),
        context("user-1"));
    tool.call(objectMapper.createObjectNode(), context("user-1"));

    verify(autoReloginService).callWithAutoRelogin("user-1", "depot-x");
    verify(autoReloginService).callWithAutoRelogin("user-1", null);
  }

  @Test
  void outOfRangeIndexIsErrorResult() {
    final CallToolResult result =
        tool.call(objectMapper.createObjectNode().put("depotIndex", 5), context("user-1"));

    assertThat(result.isError()).isTrue();
    verify(autoReloginService, never()).callWithAutoRelogin(any(), any());
  }

  @Test
  void upstreamFailureBecomesErrorResult() {
    when(autoReloginService.callWithAutoRelogin("user-1", null))
        .thenThrow(
            new UpstreamAccountException(
                UpstreamAccountException.Reason.UPSTREAM_CREDENTIALS_INVALID,
                "upstream credentials are invalid, please log in again"));

    final CallToolResult result = tool.call(objectMapper.createObjectNode(), context("user-1"));

    assertThat(result.isError()).isTrue();
    assertThat(result.content().get(0).text()).contains("re-authorize");
  }

  private ToolCallContext context(String identity) {
    return new ToolCallContext(
        transport,
        Optional.of(
            new AuthContext(
                "t",
                "client-a",
                List.of(),
                0L,
                null,
                identity,
                "sess",
                List.of("depot-1", "depot-2"),
                "CONNECTED")));
  }
}
