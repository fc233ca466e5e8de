package com.example.mcp_bridge.repository;

import com.example.mcp_bridge.model.AccessToken;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryAccessTokenRepository implements AccessTokenRepository {

  private final Map<String, AccessToken> tokens = new ConcurrentHashMap<>();

  @Override
  public void save(AccessToken token) {
    tokens.put(token.token(), token);
  }

  @Override
  public Optional<AccessToken> findByToken(String token) {
    return Optional.ofNullable(tokens.get(token));
  }

  @Override
  public int deleteExpired(Instant now) {
    int removed = 0;
    for (AccessToken token : tokens.values()) {
      if (token.isExpired(now) && tokens.remove(token.token(), token)) {
        removed++;
      }
    }
    return removed;
  }
}
