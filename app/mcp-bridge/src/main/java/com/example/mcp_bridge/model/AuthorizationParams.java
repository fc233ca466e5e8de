package com.example.mcp_bridge.model;

import java.util.List;

public record AuthorizationParams(
    String redirectUri,
    String codeChallenge,
    String codeChallengeMethod,
    String state,
    List<String> scopes,
    String resource) {

  public AuthorizationParams {
    scopes = scopes == null ? List.of() : List.copyOf(scopes);
  }
}
