package com.example.mcp_bridge.mcp;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class McpSessionReaper {

  private final McpSessionManager sessionManager;

  @Scheduled(fixedDelayString = "${bridge.mcp.reaper-interval:PT1M}")
  public void run() {
    sessionManager.reapIdle();
  }
}
