/*
 * どこで: MCP Bridge サービス層
 * 何を: /authorize を処理し、ログイン済み identity を PKCE code_challenge に結び付けて認可コードを発行する
 * なぜ: PKCE フロー上で upstream ログイン由来の identity をトークン交換まで運ぶため
 */
package com.example.mcp_bridge.service;

import com.example.common.SecureIds;
import com.example.mcp_bridge.api.request.AuthorizationRequest;
import com.example.mcp_bridge.config.OAuthServerProperties;
import com.example.mcp_bridge.model.AuthorizationCode;
import com.example.mcp_bridge.model.AuthorizationParams;
import com.example.mcp_bridge.model.BrowserSessionUser;
import com.example.mcp_bridge.model.ClientRegistration;
import com.example.mcp_bridge.repository.AuthorizationCodeRepository;
import com.example.mcp_bridge.repository.CodeChallengeBindingRepository;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AuthorizationService {

  public static final String CODE_CHALLENGE_METHOD_S256 = "S256";

  private static final Logger logger = LoggerFactory.getLogger(AuthorizationService.class);

  private final ClientRegistrationService clientRegistrationService;
  private final AuthorizationCodeRepository authorizationCodeRepository;
  private final CodeChallengeBindingRepository codeChallengeBindingRepository;
  private final OAuthServerProperties properties;
  private final Clock clock;

  /**
   * 役割: 認可リクエストを処理し、遷移先 URL を返す。
   *
   * <p>期待動作: client_id と redirect_uri を検証してから、未ログインなら同じ認可リクエストへ戻る returnTo 付きでログインへ誘導する。
   * redirect_uri を信頼できるまでの失敗は例外、信頼後の失敗は redirect_uri へ error を付けて返す。
   *
   * @param returnTo 元の /authorize URL(クエリ込み)
   */
  public String authorize(
      AuthorizationRequest request, Optional<BrowserSessionUser> sessionUser, String returnTo) {
    if (isBlank(request.clientId())) {
      throw new OAuthFlowException(OAuthFlowException.Reason.INVALID_REQUEST, "client_id is required");
    }
    if (isBlank(request.redirectUri())) {
      throw new OAuthFlowException(
          OAuthFlowException.Reason.INVALID_REQUEST, "redirect_uri is required");
    }

    final ClientRegistration client = resolveClient(request);
    if (!client.allowsRedirectUri(request.redirectUri())) {
      throw new OAuthFlowException(
          OAuthFlowException.Reason.INVALID_REQUEST, "Unregistered redirect_uri");
    }
    if (sessionUser.isEmpty()) {
      logger.info(
          "no user in browser session, redirecting to login clientId={}", client.clientId());
      return "/login?returnTo=" + encode(returnTo);
    }

    // ここから先は redirect_uri が信頼済みなので、エラーはリダイレクトで返す
    if (!ClientRegistration.RESPONSE_TYPE_CODE.equals(request.responseType())) {
      return errorRedirect(request, "unsupported_response_type", "response_type must be code");
    }
    if (isBlank(request.codeChallenge())) {
      return errorRedirect(request, "invalid_request", "code_challenge is required");
    }
    if (!CODE_CHALLENGE_METHOD_S256.equals(request.codeChallengeMethod())) {
      return errorRedirect(request, "invalid_request", "code_challenge_method must be S256");
    }
    if (!isBlank(request.resource()) && !isAbsoluteUri(request.resource())) {
      return errorRedirect(request, "invalid_request", "resource must be an absolute URI");
    }

    final String identity = sessionUser.get().identity();
    codeChallengeBindingRepository
        .bind(request.codeChallenge(), identity)
        .filter(previous -> !previous.equals(identity))
        .ifPresent(
            previous ->
                logger.warn(
                    "code_challenge binding overwritten by a different identity clientId={}",
                    client.clientId()));

    final Instant now = Instant.now(clock);
    final AuthorizationCode code =
        new AuthorizationCode(
            SecureIds.newOpaqueValue(),
            client.clientId(),
            new AuthorizationParams(
                request.redirectUri(),
                request.codeChallenge(),
                request.codeChallengeMethod(),
                request.state(),
                parseScopes(request.scope()),
                isBlank(request.resource()) ? null : request.resource()),
            now,
            now.plus(properties.authorizationCodeTtl()));
    authorizationCodeRepository.save(code);
    logger.info("authorization code issued clientId={} identity={}", client.clientId(), identity);

    final Map<String, String> params = new LinkedHashMap<>();
    params.put("code", code.code());
    if (request.state() != null) {
      params.put("state", request.state());
    }
    return appendQuery(request.redirectUri(), params);
  }

  private ClientRegistration resolveClient(AuthorizationRequest request) {
    final boolean pkceFlow =
        !isBlank(request.codeChallenge())
            && CODE_CHALLENGE_METHOD_S256.equals(request.codeChallengeMethod());
    if (pkceFlow) {
      return clientRegistrationService.ensurePublicPkceClient(
          request.clientId(), request.redirectUri());
    }
    return clientRegistrationService
        .find(request.clientId())
        .orElseThrow(
            () ->
                new OAuthFlowException(
                    OAuthFlowException.Reason.INVALID_REQUEST, "client is not registered"));
  }

  private String errorRedirect(AuthorizationRequest request, String error, String description) {
    logger.info("authorization request rejected error={} description={}", error, description);
    final Map<String, String> params = new LinkedHashMap<>();
    params.put("error", error);
    params.put("error_description", description);
    if (request.state() != null) {
      params.put("state", request.state());
    }
    return appendQuery(request.redirectUri(), params);
  }

  private String appendQuery(String baseUri, Map<String, String> params) {
    final StringBuilder url = new StringBuilder(baseUri);
    char separator = baseUri.contains("?") ? '&' : '?';
    for (Map.Entry<String, String> entry : params.entrySet()) {
      url.append(separator).append(entry.getKey()).append('=').append(encode(entry.getValue()));
      separator = '&';
    }
    return url.toString();
  }

  private List<String> parseScopes(String scope) {
    if (isBlank(scope)) {
      return List.of();
    }
    return Arrays.stream(scope.trim().split("\\s+")).toList();
  }

  private boolean isAbsoluteUri(String value) {
    try {
      return new URI(value).isAbsolute();
    } catch (URISyntaxException ex) {
      return false;
    }
  }

  private String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
