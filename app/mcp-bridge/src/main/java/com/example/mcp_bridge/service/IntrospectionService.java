/*
 * どこで: MCP Bridge サービス層
 * 何を: アクセストークンをイントロスペクションし、identity に紐づく upstream 情報を付加する
 * なぜ: MCP 側が token から upstream セッションと depot を 1 回の照会で得られるようにするため
 */
package com.example.mcp_bridge.service;

import com.example.mcp_bridge.api.response.IntrospectionResponse;
import com.example.mcp_bridge.model.AccessToken;
import com.example.mcp_bridge.model.AccountRecord;
import com.example.mcp_bridge.model.AuthContext;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class IntrospectionService {

  static final String STATUS_UNKNOWN = "UNKNOWN";

  private static final Logger logger = LoggerFactory.getLogger(IntrospectionService.class);

  private final TokenService tokenService;
  private final AccountService accountService;

  /** 無効トークンでも例外を投げず active=false を返す。 */
  public IntrospectionResponse introspect(String token) {
    return resolveAuthContext(token)
        .map(
            context ->
                new IntrospectionResponse(
                    true,
                    context.clientId(),
                    String.join(" ", context.scopes()),
                    context.expiresAtEpochSeconds(),
                    context.resource(),
                    context.identity(),
                    context.upstreamSession(),
                    context.depotIds(),
                    context.upstreamStatus()))
        .orElseGet(IntrospectionResponse::inactive);
  }

  public Optional<AuthContext> resolveAuthContext(String token) {
    final AccessToken accessToken;
    try {
      accessToken = tokenService.verifyAccessToken(token);
    } catch (OAuthFlowException ex) {
      logger.debug("introspection of inactive token: {}", ex.getMessage());
      return Optional.empty();
    }
    final Optional<AccountRecord> account = accessToken.identity().flatMap(accountService::find);
    return Optional.of(
        new AuthContext(
            accessToken.token(),
            accessToken.clientId(),
            accessToken.scopes(),
            accessToken.expiresAt().getEpochSecond(),
            accessToken.resource(),
            accessToken.identity().orElse(null),
            account.map(AccountRecord::upstreamSession).orElse(null),
            account.map(AccountRecord::depotIds).orElse(null),
            account.map(a -> a.status().name()).orElse(STATUS_UNKNOWN)));
  }
}
