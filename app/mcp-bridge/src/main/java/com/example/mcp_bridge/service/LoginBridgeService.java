package com.example.mcp_bridge.service;

import com.example.mcp_bridge.model.AccountRecord;
import com.example.mcp_bridge.model.BrowserSessionUser;
import com.example.mcp_bridge.model.UpstreamLogin;
import com.example.mcp_bridge.model.UpstreamLoginResult;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class LoginBridgeService {

  private static final Logger logger = LoggerFactory.getLogger(LoginBridgeService.class);

  private final DepotApiClient depotApiClient;
  private final AccountService accountService;
  private final BridgeMetrics bridgeMetrics;

  /**
   * 役割:
   * - upstream へ資格情報ログインし、成功したらアカウントを upsert する。
   *
   * 期待動作:
   * - 成功時はブラウザセッションへ保存する利用者情報を返す。
   * - 失敗理由の詳細(upstream の応答本文)は呼び出し側へ渡さない。
   */
  public BrowserSessionUser login(String username, String password) {
    if (username == null || username.isBlank()) {
      throw new IllegalArgumentException("username is required");
    }
    if (password == null || password.isBlank()) {
      throw new IllegalArgumentException("password is required");
    }

    final UpstreamLoginResult result = depotApiClient.login(username, password);
    if (result instanceof UpstreamLoginResult.Success success) {
      final UpstreamLogin login = success.login();
      final AccountRecord account = accountService.upsertFromLogin(username, password, login);
      bridgeMetrics.recordLoginResult("success");
      logger.info("login bridge succeeded identity={}", account.identity());
      return new BrowserSessionUser(
          account.identity(), login.email(), account.upstreamSession(), account.depotIds());
    }
    if (result instanceof UpstreamLoginResult.Unreachable) {
      bridgeMetrics.recordLoginResult("unavailable");
      throw new UpstreamLoginFailedException(
          UpstreamLoginFailedException.Reason.UNAVAILABLE, "login service is unavailable");
    }
    bridgeMetrics.recordLoginResult("rejected");
    throw new UpstreamLoginFailedException(
        UpstreamLoginFailedException.Reason.REJECTED, "login failed");
  }
}
