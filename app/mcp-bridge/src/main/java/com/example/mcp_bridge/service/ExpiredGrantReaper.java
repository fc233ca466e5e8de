/*
 * どこで: MCP Bridge 定期処理
 * 何を: 期限切れの認可コードとアクセストークンを定期削除する
 * なぜ: 交換されずに残ったコードやトークンでメモリが増え続けないようにするため
 */
package com.example.mcp_bridge.service;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ExpiredGrantReaper {

  private final TokenService tokenService;

  @Scheduled(fixedDelayString = "${bridge.oauth.cleanup-interval:PT5M}")
  public void run() {
    tokenService.purgeExpired();
  }
}
