package com.example.mcp_bridge.repository;

import com.example.mcp_bridge.model.AccountRecord;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryAccountRepository implements AccountRepository {

  private final Map<String, AccountRecord> accounts = new ConcurrentHashMap<>();

  @Override
  public Optional<AccountRecord> findByIdentity(String identity) {
    return Optional.ofNullable(accounts.get(identity));
  }

  @Override
  public AccountRecord save(AccountRecord account) {
    accounts.put(account.identity(), account);
    return account;
  }

  @Override
  public Optional<AccountRecord> update(String identity, UnaryOperator<AccountRecord> updater) {
    return Optional.ofNullable(
        accounts.computeIfPresent(identity, (key, current) -> updater.apply(current)));
  }
}
