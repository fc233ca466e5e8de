/*
 * どこで: MCP Bridge API 応答
 * 何を: /introspect の応答形状(RFC 7662 + upstream 拡張フィールド)
 * なぜ: 無効トークンでは active=false 以外を出さないようにするため
 */
package com.example.mcp_bridge.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record IntrospectionResponse(
    @JsonProperty("active") boolean active,
    @JsonProperty("client_id") String clientId,
    @JsonProperty("scope") String scope,
    @JsonProperty("exp") Long exp,
    @JsonProperty("aud") String aud,
    @JsonProperty("identity") String identity,
    @JsonProperty("upstream_session") String upstreamSession,
    @JsonProperty("resource_ids") List<String> resourceIds,
    @JsonProperty("upstream_status") String upstreamStatus) {

  public static IntrospectionResponse inactive() {
    return new IntrospectionResponse(false, null, null, null, null, null, null, null, null);
  }
}
