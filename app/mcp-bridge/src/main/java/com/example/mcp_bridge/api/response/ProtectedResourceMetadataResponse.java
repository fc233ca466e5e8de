package com.example.mcp_bridge.api.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** RFC 9728 保護リソースメタデータ。 */
public record ProtectedResourceMetadataResponse(
    @JsonProperty("resource") String resource,
    @JsonProperty("authorization_servers") List<String> authorizationServers,
    @JsonProperty("scopes_supported") List<String> scopesSupported,
    @JsonProperty("bearer_methods_supported") List<String> bearerMethodsSupported,
    @JsonProperty("resource_name") String resourceName) {}
