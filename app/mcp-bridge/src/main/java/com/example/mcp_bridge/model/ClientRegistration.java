/*
 * どこで: app/mcp-bridge/src/main/java/com/example/mcp_bridge/model/ClientRegistration.java
 * 何を: 公開 PKCE クライアントの登録情報
 * なぜ: redirect_uri を追記専用で扱い、secret を持たないクライアントだけを許可するため
 */
package com.example.mcp_bridge.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public record ClientRegistration(
    String clientId,
    List<String> redirectUris,
    String tokenEndpointAuthMethod,
    List<String> grantTypes,
    List<String> responseTypes,
    Instant clientIdIssuedAt) {

  public static final String AUTH_METHOD_NONE = "none";
  public static final String GRANT_AUTHORIZATION_CODE = "authorization_code";
  public static final String RESPONSE_TYPE_CODE = "code";

  public ClientRegistration {
    redirectUris = redirectUris == null ? List.of() : List.copyOf(redirectUris);
    grantTypes = grantTypes == null ? List.of() : List.copyOf(grantTypes);
    responseTypes = responseTypes == null ? List.of() : List.copyOf(responseTypes);
  }

  public static ClientRegistration publicPkceClient(
      String clientId, List<String> redirectUris, Instant issuedAt) {
    return new ClientRegistration(
        clientId,
        redirectUris,
        AUTH_METHOD_NONE,
        List.of(GRANT_AUTHORIZATION_CODE),
        List.of(RESPONSE_TYPE_CODE),
        issuedAt);
  }

  public boolean allowsRedirectUri(String redirectUri) {
    return redirectUris.contains(redirectUri);
  }

  public ClientRegistration withRedirectUri(String redirectUri) {
    if (allowsRedirectUri(redirectUri)) {
      return this;
    }
    final List<String> appended = new ArrayList<>(redirectUris);
    appended.add(redirectUri);
    return new ClientRegistration(
        clientId, appended, tokenEndpointAuthMethod, grantTypes, responseTypes, clientIdIssuedAt);
  }
}
