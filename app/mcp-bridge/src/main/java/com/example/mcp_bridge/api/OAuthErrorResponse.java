package com.example.mcp_bridge.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** RFC 6749 5.2 形式のエラー応答。 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OAuthErrorResponse(
    @JsonProperty("error") String error,
    @JsonProperty("error_description") String errorDescription) {}
