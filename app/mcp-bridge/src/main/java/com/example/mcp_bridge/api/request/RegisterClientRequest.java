package com.example.mcp_bridge.api.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** RFC 7591 の登録要求。redirect_uris 以外の項目は無視する。 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RegisterClientRequest(@JsonProperty("redirect_uris") List<String> redirectUris) {}
