package com.example.mcp_bridge.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record UpstreamLoginResponse(Integer responseCode, String session, User user) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record User(@JsonProperty("_id") String id, String email, List<Depot> depots) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Depot(@JsonProperty("_id") String id) {}
}
