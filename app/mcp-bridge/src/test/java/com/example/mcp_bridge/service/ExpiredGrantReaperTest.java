package com.example.mcp_bridge.service;

import static org.mockito.Mockito.verify;

import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class ExpiredGrantReaperTest {

  @Test
  void runPurgesExpiredCodesAndTokens() {
    final TokenService tokenService = Mockito.mock(TokenService.class);

    new ExpiredGrantReaper(tokenService).run();

    verify(tokenService).purgeExpired();
  }
}
