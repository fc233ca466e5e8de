package com.example.mcp_bridge.api.response;

import com.example.mcp_bridge.model.ClientRegistration;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record ClientRegistrationResponse(
    @JsonProperty("client_id") String clientId,
    @JsonProperty("client_id_issued_at") long clientIdIssuedAt,
    @JsonProperty("redirect_uris") List<String> redirectUris,
    @JsonProperty("token_endpoint_auth_method") String tokenEndpointAuthMethod,
    @JsonProperty("grant_types") List<String> grantTypes,
    @JsonProperty("response_types") List<String> responseTypes) {

  public static ClientRegistrationResponse from(ClientRegistration registration) {
    return new ClientRegistrationResponse(
        registration.clientId(),
        registration.clientIdIssuedAt().getEpochSecond(),
        registration.redirectUris(),
        registration.tokenEndpointAuthMethod(),
        registration.grantTypes(),
        registration.responseTypes());
  }
}
