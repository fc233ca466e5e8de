package com.example.mcp_bridge.repository;

import com.example.mcp_bridge.model.AccessToken;
import java.time.Instant;
import java.util.Optional;

public interface AccessTokenRepository {

  void save(AccessToken token);

  Optional<AccessToken> findByToken(String token);

  int deleteExpired(Instant now);
}
