package com.example.mcp_bridge.model;

import java.util.List;

/** upstream ログイン成功時に得られる identity とセッション。 */
public record UpstreamLogin(String identity, String email, String session, List<String> depotIds) {

  public UpstreamLogin {
    depotIds = depotIds == null ? List.of() : List.copyOf(depotIds);
  }

  @Override
  public String toString() {
    return "UpstreamLogin[identity=" + identity + ", email=" + email + ", depotIds=" + depotIds + "]";
  }
}
