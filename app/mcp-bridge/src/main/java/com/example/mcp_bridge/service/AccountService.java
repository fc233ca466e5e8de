package com.example.mcp_bridge.service;

import com.example.mcp_bridge.model.AccountRecord;
import com.example.mcp_bridge.model.UpstreamLogin;
import com.example.mcp_bridge.repository.AccountRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * upstream アカウントの状態遷移を担う。
 *
 * <p>CONNECTED へ戻す経路は対話ログイン({@link #upsertFromLogin})と再ログイン成功({@link
 * #refreshSession})のみ。BROKEN_NEEDS_USER のアカウントに対して {@link #refreshSession} は呼ばれない前提。
 */
@Service
@RequiredArgsConstructor
public class AccountService {

  private static final Logger logger = LoggerFactory.getLogger(AccountService.class);

  private final AccountRepository accountRepository;
  private final Clock clock;

  public AccountRecord upsertFromLogin(
      @NonNull String username, @NonNull String password, @NonNull UpstreamLogin login) {
    final AccountRecord account =
        AccountRecord.connected(
            login.identity(),
            username,
            password,
            login.session(),
            login.depotIds(),
            Instant.now(clock));
    accountRepository.save(account);
    logger.info(
        "account connected identity={} depots={}", login.identity(), login.depotIds().size());
    return account;
  }

  public Optional<AccountRecord> find(String identity) {
    if (identity == null || identity.isBlank()) {
      return Optional.empty();
    }
    return accountRepository.findByIdentity(identity);
  }

  /**
   * 役割: 再ログイン成功後のセッションと depot を保存する。
   *
   * <p>期待動作: 現行セッションが staleSession のままの場合だけ置き換える。 その間に対話ログインで差し替わっていれば現行レコードをそのまま返す。
   */
  public Optional<AccountRecord> refreshSession(
      String identity, String staleSession, UpstreamLogin login) {
    return accountRepository.update(
        identity,
        current ->
            Objects.equals(current.upstreamSession(), staleSession)
                ? current.withRefreshedSession(
                    login.session(), login.depotIds(), Instant.now(clock))
                : current);
  }

  /**
   * 役割: failedSession で失敗したアカウントを BROKEN_NEEDS_USER にする。
   *
   * <p>期待動作: 現行セッションが failedSession でなければ状態を変えない。 CONNECTED へ戻すのは対話ログインだけなので、
   * 失敗中に完了した新しいログインを上書きしない。
   */
  public Optional<AccountRecord> markBroken(String identity, String failedSession) {
    final Optional<AccountRecord> result =
        accountRepository.update(
            identity,
            current ->
                Objects.equals(current.upstreamSession(), failedSession)
                    ? current.markedBroken()
                    : current);
    result.ifPresent(
        account -> {
          if (Objects.equals(account.upstreamSession(), failedSession)) {
            logger.warn(
                "account marked broken identity={} failedLoginCount={}",
                identity,
                account.failedLoginCount());
          } else {
            logger.info("session already replaced, keeping account state identity={}", identity);
          }
        });
    return result;
  }
}
