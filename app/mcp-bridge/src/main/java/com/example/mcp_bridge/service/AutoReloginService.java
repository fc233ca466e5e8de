/*
 * どこで: MCP Bridge サービス層
 * 何を: upstream データ呼び出しを包み、セッション切れ時に保存済み資格情報で 1 回だけ再ログインして 1 回だけ再試行する
 * なぜ: ツール呼び出し側へ upstream セッション期限切れを見せず、かつ障害時の upstream 負荷を上限付きにするため
 */
package com.example.mcp_bridge.service;

import com.example.mcp_bridge.model.AccountRecord;
import com.example.mcp_bridge.model.UpstreamCallResult;
import com.example.mcp_bridge.model.UpstreamLoginResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.annotations.VisibleForTesting;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AutoReloginService {

  private static final Logger logger = LoggerFactory.getLogger(AutoReloginService.class);

  private final DepotApiClient depotApiClient;
  private final AccountService accountService;
  private final BridgeMetrics bridgeMetrics;

  // identity ごとの実行中再ログイン。同時呼び出しは同じ future を待つ。
  private final Map<String, CompletableFuture<AccountRecord>> reloginsInFlight =
      new ConcurrentHashMap<>();

  /**
   * 役割: depot 口座情報を取得する。
   *
   * <p>期待動作: 401/403 のときだけ再ログインを 1 回行い、元の呼び出しを 1 回だけ再試行する。 5xx・接続失敗・タイムアウトは再ログインせず
   * UPSTREAM_TRANSIENT_ERROR にする。
   *
   * @param depotId null の場合はアカウントの先頭 depot を使う
   */
  public JsonNode callWithAutoRelogin(String identity, String depotId) {
    final AccountRecord account = requireAccount(identity);
    if (account.isBroken()) {
      throw failure(
          UpstreamAccountException.Reason.UPSTREAM_CREDENTIALS_INVALID,
          "upstream credentials are invalid, please log in again");
    }
    final String effectiveDepotId = resolveDepotId(account, depotId);

    final UpstreamCallResult first =
        depotApiClient.fetchDepotAccount(account.upstreamSession(), effectiveDepotId);
    if (first instanceof UpstreamCallResult.Success success) {
      return success.payload();
    }
    if (first instanceof UpstreamCallResult.TransientError error) {
      throw transientFailure(error);
    }

    final AccountRecord refreshed = reloginOnce(identity, account.upstreamSession());
    final UpstreamCallResult retry =
        depotApiClient.fetchDepotAccount(refreshed.upstreamSession(), effectiveDepotId);
    if (retry instanceof UpstreamCallResult.Success success) {
      return success.payload();
    }
    if (retry instanceof UpstreamCallResult.TransientError error) {
      throw transientFailure(error);
    }
    accountService.markBroken(identity, refreshed.upstreamSession());
    throw failure(
        UpstreamAccountException.Reason.UPSTREAM_SESSION_UNRECOVERABLE,
        "upstream session is still rejected after re-login, please log in again");
  }

  private AccountRecord reloginOnce(String identity, String staleSession) {
    final CompletableFuture<AccountRecord> mine = new CompletableFuture<>();
    final CompletableFuture<AccountRecord> inFlight = reloginsInFlight.putIfAbsent(identity, mine);
    if (inFlight != null) {
      logger.debug("joining in-flight re-login identity={}", identity);
      return await(inFlight);
    }
    try {
      final AccountRecord refreshed = performRelogin(identity, staleSession);
      mine.complete(refreshed);
      return refreshed;
    } catch (RuntimeException ex) {
      mine.completeExceptionally(ex);
      throw ex;
    } finally {
      reloginsInFlight.remove(identity, mine);
    }
  }

  private AccountRecord performRelogin(String identity, String staleSession) {
    final AccountRecord current = requireAccount(identity);
    if (current.isBroken()) {
      throw failure(
          UpstreamAccountException.Reason.UPSTREAM_CREDENTIALS_INVALID,
          "upstream credentials are invalid, please log in again");
    }
    if (!Objects.equals(current.upstreamSession(), staleSession)) {
      // 別の呼び出し(または対話ログイン)が既にセッションを差し替えている
      logger.debug("session already refreshed, skipping re-login identity={}", identity);
      return current;
    }

    logger.info("automatic upstream re-login identity={}", identity);
    final UpstreamLoginResult result =
        depotApiClient.login(current.upstreamUsername(), current.upstreamPassword());
    if (result instanceof UpstreamLoginResult.Success success) {
      bridgeMetrics.recordReloginResult("success");
      return accountService
          .refreshSession(identity, staleSession, success.login())
          .orElseThrow(
              () ->
                  failure(
                      UpstreamAccountException.Reason.ACCOUNT_NOT_LINKED,
                      "upstream account disappeared during re-login"));
    }
    if (result instanceof UpstreamLoginResult.Unreachable unreachable) {
      bridgeMetrics.recordReloginResult("unreachable");
      throw failure(
          UpstreamAccountException.Reason.UPSTREAM_TRANSIENT_ERROR,
          unreachable.timeout() ? "upstream re-login timed out" : "upstream re-login unreachable");
    }
    bridgeMetrics.recordReloginResult("rejected");
    accountService.markBroken(identity, staleSession);
    throw failure(
        UpstreamAccountException.Reason.UPSTREAM_CREDENTIALS_INVALID,
        "upstream re-login failed, please log in again");
  }

  private AccountRecord await(CompletableFuture<AccountRecord> inFlight) {
    try {
      return inFlight.join();
    } catch (CompletionException ex) {
      if (ex.getCause() instanceof UpstreamAccountException upstreamFailure) {
        throw upstreamFailure;
      }
      throw failure(
          UpstreamAccountException.Reason.UPSTREAM_TRANSIENT_ERROR,
          "concurrent re-login failed",
          ex.getCause());
    }
  }

  private AccountRecord requireAccount(String identity) {
    return accountService
        .find(identity)
        .orElseThrow(
            () ->
                failure(
                    UpstreamAccountException.Reason.ACCOUNT_NOT_LINKED,
                    "no upstream account is linked to this user"));
  }

  private String resolveDepotId(AccountRecord account, String depotId) {
    if (depotId != null && !depotId.isBlank()) {
      return depotId;
    }
    if (account.depotIds().isEmpty()) {
      throw failure(
          UpstreamAccountException.Reason.NO_DEPOT_AVAILABLE,
          "no depot ids are stored for this upstream account");
    }
    return account.depotIds().get(0);
  }

  private UpstreamAccountException transientFailure(UpstreamCallResult.TransientError error) {
    return failure(UpstreamAccountException.Reason.UPSTREAM_TRANSIENT_ERROR, error.detail());
  }

  private UpstreamAccountException failure(UpstreamAccountException.Reason reason, String message) {
    return failure(reason, message, null);
  }

  private UpstreamAccountException failure(
      UpstreamAccountException.Reason reason, String message, Throwable cause) {
    bridgeMetrics.recordUpstreamError(reason.name());
    return new UpstreamAccountException(reason, message, cause);
  }

  @VisibleForTesting
  int reloginsInFlight() {
    return reloginsInFlight.size();
  }
}
