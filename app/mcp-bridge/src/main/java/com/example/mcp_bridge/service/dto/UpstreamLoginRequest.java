package com.example.mcp_bridge.service.dto;

public record UpstreamLoginRequest(String username, String password, String client, String version) {

  @Override
  public String toString() {
    return "UpstreamLoginRequest[username=" + username + ", client=" + client + "]";
  }
}
