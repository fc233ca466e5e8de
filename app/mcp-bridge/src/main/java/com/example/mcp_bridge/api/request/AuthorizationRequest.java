package com.example.mcp_bridge.api.request;

/** /authorize のクエリパラメータ。 */
public record AuthorizationRequest(
    String responseType,
    String clientId,
    String redirectUri,
    String codeChallenge,
    String codeChallengeMethod,
    String state,
    String scope,
    String resource) {}
