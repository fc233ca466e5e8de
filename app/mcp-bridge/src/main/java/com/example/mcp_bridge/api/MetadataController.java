package com.example.mcp_bridge.api;

import com.example.mcp_bridge.api.response.AuthorizationServerMetadataResponse;
import com.example.mcp_bridge.api.response.ProtectedResourceMetadataResponse;
import com.example.mcp_bridge.config.OAuthServerProperties;
import com.example.mcp_bridge.model.ClientRegistration;
import com.example.mcp_bridge.service.AuthorizationService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** OAuth クライアントが設定を自動発見するための well-known 文書。 */
@RestController
@RequiredArgsConstructor
public class MetadataController {

  private final OAuthServerProperties properties;

  @GetMapping("/.well-known/oauth-authorization-server")
  public AuthorizationServerMetadataResponse authorizationServer() {
    return new AuthorizationServerMetadataResponse(
        properties.issuerUrl(),
        properties.endpoint("/authorize"),
        properties.endpoint("/token"),
        properties.endpoint("/register"),
        properties.endpoint("/introspect"),
        List.of(ClientRegistration.RESPONSE_TYPE_CODE),
        List.of(ClientRegistration.GRANT_AUTHORIZATION_CODE),
        List.of(AuthorizationService.CODE_CHALLENGE_METHOD_S256),
        List.of(ClientRegistration.AUTH_METHOD_NONE),
        properties.scopesSupported());
  }

  @GetMapping({"/.well-known/oauth-protected-resource", "/.well-known/oauth-protected-resource/mcp"})
  public ProtectedResourceMetadataResponse protectedResource() {
    return new ProtectedResourceMetadataResponse(
        properties.mcpResourceUrl(),
        List.of(properties.issuerUrl()),
        properties.scopesSupported(),
        List.of("header"),
        properties.resourceName());
  }
}
