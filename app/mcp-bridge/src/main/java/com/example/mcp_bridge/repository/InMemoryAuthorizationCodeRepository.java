package com.example.mcp_bridge.repository;

import com.example.mcp_bridge.model.AuthorizationCode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryAuthorizationCodeRepository implements AuthorizationCodeRepository {

  private final Map<String, AuthorizationCode> codes = new ConcurrentHashMap<>();

  @Override
  public void save(AuthorizationCode code) {
    codes.put(code.code(), code);
  }

  @Override
  public Optional<AuthorizationCode> findByCode(String code) {
    return Optional.ofNullable(codes.get(code));
  }

  @Override
  public boolean consume(AuthorizationCode expected) {
    return codes.remove(expected.code(), expected);
  }

  @Override
  public List<AuthorizationCode> deleteExpired(Instant now) {
    final List<AuthorizationCode> removed = new ArrayList<>();
    for (AuthorizationCode code : codes.values()) {
      // 並行して消費されたコードは交換側がバインドを処理する
      if (code.isExpired(now) && codes.remove(code.code(), code)) {
        removed.add(code);
      }
    }
    return removed;
  }
}
