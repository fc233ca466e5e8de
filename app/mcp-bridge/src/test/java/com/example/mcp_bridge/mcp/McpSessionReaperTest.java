package com.example.mcp_bridge.mcp;

import static org.mockito.Mockito.verify;

import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class McpSessionReaperTest {

  @Test
  void runReapsIdleSessions() {
    final McpSessionManager sessionManager = Mockito.mock(McpSessionManager.class);

    new McpSessionReaper(sessionManager).run();

    verify(sessionManager).reapIdle();
  }
}
