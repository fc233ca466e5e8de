package com.example.mcp_bridge.repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryCodeChallengeBindingRepository implements CodeChallengeBindingRepository {

  private final Map<String, String> identitiesByChallenge = new ConcurrentHashMap<>();

  @Override
  public Optional<String> bind(String codeChallenge, String identity) {
    return Optional.ofNullable(identitiesByChallenge.put(codeChallenge, identity));
  }

  @Override
  public Optional<String> consume(String codeChallenge) {
    return Optional.ofNullable(identitiesByChallenge.remove(codeChallenge));
  }
}
