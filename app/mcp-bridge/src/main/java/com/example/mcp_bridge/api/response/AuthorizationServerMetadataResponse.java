package com.example.mcp_bridge.api.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** RFC 8414 認可サーバーメタデータ。 */
public record AuthorizationServerMetadataResponse(
    @JsonProperty("issuer") String issuer,
    @JsonProperty("authorization_endpoint") String authorizationEndpoint,
    @JsonProperty("token_endpoint") String tokenEndpoint,
    @JsonProperty("registration_endpoint") String registrationEndpoint,
    @JsonProperty("introspection_endpoint") String introspectionEndpoint,
    @JsonProperty("response_types_supported") List<String> responseTypesSupported,
    @JsonProperty("grant_types_supported") List<String> grantTypesSupported,
    @JsonProperty("code_challenge_methods_supported") List<String> codeChallengeMethodsSupported,
    @JsonProperty("token_endpoint_auth_methods_supported")
        List<String> tokenEndpointAuthMethodsSupported,
    @JsonProperty("scopes_supported") List<String> scopesSupported) {}
