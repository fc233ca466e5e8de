/*
 * どこで: MCP Bridge サービス層
 * 何を: 認可コードとアクセストークンの交換・検証・期限切れ掃除を行う
 * なぜ: PKCE 検証とバインディング消費を 1 箇所で行い、identity をトークンの付加情報へ確実に移すため
 */
package com.example.mcp_bridge.service;

import com.example.common.SecureIds;
import com.example.mcp_bridge.api.response.TokenResponse;
import com.example.mcp_bridge.config.OAuthServerProperties;
import com.example.mcp_bridge.model.AccessToken;
import com.example.mcp_bridge.model.AuthorizationCode;
import com.example.mcp_bridge.repository.AccessTokenRepository;
import com.example.mcp_bridge.repository.AuthorizationCodeRepository;
import com.example.mcp_bridge.repository.CodeChallengeBindingRepository;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class TokenService {

  public static final String TOKEN_TYPE_BEARER = "bearer";

  private static final Logger logger = LoggerFactory.getLogger(TokenService.class);

  private final ClientRegistrationService clientRegistrationService;
  private final AuthorizationCodeRepository authorizationCodeRepository;
  private final CodeChallengeBindingRepository codeChallengeBindingRepository;
  private final AccessTokenRepository accessTokenRepository;
  private final OAuthServerProperties properties;
  private final BridgeMetrics bridgeMetrics;
  private final Clock clock;

  /**
   * 役割:
   * - 認可コードをアクセストークンへ交換する。
   *
   * 期待動作:
   * - 別クライアントのコードでは消費せずに invalid_grant を返す。
   * - 成功時はコードと challenge バインディングの両方を消費する。
   * - バインディングが無い場合は identity 無しのトークンを発行する。
   */
  public TokenResponse exchangeAuthorizationCode(
      String clientId, String code, String codeVerifier, String redirectUri) {
    if (clientRegistrationService.find(clientId).isEmpty()) {
      throw new OAuthFlowException(OAuthFlowException.Reason.INVALID_CLIENT, "unknown client");
    }
    if (isBlank(code)) {
      throw new OAuthFlowException(OAuthFlowException.Reason.INVALID_REQUEST, "code is required");
    }
    final AuthorizationCode authorizationCode =
        authorizationCodeRepository
            .findByCode(code)
            .orElseThrow(
                () ->
                    new OAuthFlowException(
                        OAuthFlowException.Reason.INVALID_GRANT, "invalid authorization code"));
    if (!authorizationCode.clientId().equals(clientId)) {
      logger.warn("authorization code presented by another client clientId={}", clientId);
      throw new OAuthFlowException(
          OAuthFlowException.Reason.INVALID_GRANT,
          "authorization code was not issued to this client");
    }
    final Instant now = Instant.now(clock);
    if (authorizationCode.isExpired(now)) {
      if (authorizationCodeRepository.consume(authorizationCode)) {
        codeChallengeBindingRepository.consume(authorizationCode.params().codeChallenge());
      }
      throw new OAuthFlowException(
          OAuthFlowException.Reason.INVALID_GRANT, "authorization code has expired");
    }
    if (isBlank(codeVerifier)) {
      throw new OAuthFlowException(
          OAuthFlowException.Reason.INVALID_REQUEST, "code_verifier is required");
    }
    if (!s256(codeVerifier).equals(authorizationCode.params().codeChallenge())) {
      throw new OAuthFlowException(
          OAuthFlowException.Reason.INVALID_GRANT, "code_verifier does not match code_challenge");
    }
    if (!isBlank(redirectUri) && !redirectUri.equals(authorizationCode.params().redirectUri())) {
      throw new OAuthFlowException(
          OAuthFlowException.Reason.INVALID_GRANT, "redirect_uri does not match");
    }
    final String resource = authorizationCode.params().resource();
    if (properties.strictResource() && !properties.mcpResourceUrl().equals(resource)) {
      throw new OAuthFlowException(
          OAuthFlowException.Reason.INVALID_TARGET, "resource is not served by this server");
    }
    if (!authorizationCodeRepository.consume(authorizationCode)) {
      // 並行した交換に負けた
      throw new OAuthFlowException(
          OAuthFlowException.Reason.INVALID_GRANT, "authorization code was already used");
    }

    final Optional<String> identity =
        codeChallengeBindingRepository.consume(authorizationCode.params().codeChallenge());
    if (identity.isEmpty()) {
      logger.warn("no identity bound to code_challenge, issuing token without identity clientId={}", clientId);
    }

    final AccessToken token =
        new AccessToken(
            SecureIds.newOpaqueValue(),
            clientId,
            authorizationCode.params().scopes(),
            now.plus(properties.accessTokenTtl()),
            resource,
            new AccessToken.TokenExtra(identity.orElse(null)));
    accessTokenRepository.save(token);
    bridgeMetrics.recordTokenIssued(identity.isPresent() ? "with_identity" : "without_identity");
    logger.info(
        "access token issued clientId={} identity={}", clientId, identity.orElse("(none)"));

    return new TokenResponse(
        token.token(),
        TOKEN_TYPE_BEARER,
        properties.accessTokenTtl().toSeconds(),
        token.scopes().isEmpty() ? null : String.join(" ", token.scopes()));
  }

  public TokenResponse exchangeRefreshToken(String clientId, String refreshToken) {
    throw new OAuthFlowException(
        OAuthFlowException.Reason.NOT_IMPLEMENTED, "refresh tokens are not supported");
  }

  /** 有効期限内のトークンのみ返す。未知または期限切れは invalid_token。 */
  public AccessToken verifyAccessToken(String token) {
    if (isBlank(token)) {
      throw new OAuthFlowException(OAuthFlowException.Reason.INVALID_TOKEN, "token is required");
    }
    final AccessToken accessToken =
        accessTokenRepository
            .findByToken(token)
            .orElseThrow(
                () -> new OAuthFlowException(OAuthFlowException.Reason.INVALID_TOKEN, "invalid token"));
    if (accessToken.isExpired(Instant.now(clock))) {
      throw new OAuthFlowException(OAuthFlowException.Reason.INVALID_TOKEN, "token has expired");
    }
    return accessToken;
  }

  public void purgeExpired() {
    final Instant now = Instant.now(clock);
    final List<AuthorizationCode> codes = authorizationCodeRepository.deleteExpired(now);
    // 交換されずに消えたコードの code_challenge 紐付けも残さない
    codes.forEach(
        code -> codeChallengeBindingRepository.consume(code.params().codeChallenge()));
    final int tokens = accessTokenRepository.deleteExpired(now);
    if (!codes.isEmpty() || tokens > 0) {
      logger.info("purged expired grants codes={} tokens={}", codes.size(), tokens);
    }
  }

  static String s256(String codeVerifier) {
    try {
      final byte[] digest =
          MessageDigest.getInstance("SHA-256")
              .digest(codeVerifier.getBytes(StandardCharsets.US_ASCII));
      return Base64.getUrlEncoder().withoutPadding().encodeToString(digest);
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 is not available", ex);
    }
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
