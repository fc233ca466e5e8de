/*
 * どこで: MCP Bridge API 層
 * 何を: /token(コード交換)と /introspect(トークン照会)を提供する
 * なぜ: OAuth クライアントと MCP リソースサーバーがフォーム形式で呼ぶ窓口のため
 */
package com.example.mcp_bridge.api;

import com.example.mcp_bridge.api.response.IntrospectionResponse;
import com.example.mcp_bridge.api.response.TokenResponse;
import com.example.mcp_bridge.service.IntrospectionService;
import com.example.mcp_bridge.service.OAuthFlowException;
import com.example.mcp_bridge.service.TokenService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class TokenController {

  static final String GRANT_AUTHORIZATION_CODE = "authorization_code";
  static final String GRANT_REFRESH_TOKEN = "refresh_token";

  private final TokenService tokenService;
  private final IntrospectionService introspectionService;

  @PostMapping(value = "/token", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
  public ResponseEntity<TokenResponse> token(
      @RequestParam(name = "grant_type", required = false) String grantType,
      @RequestParam(name = "client_id", required = false) String clientId,
      @RequestParam(name = "code", required = false) String code,
      @RequestParam(name = "code_verifier", required = false) String codeVerifier,
      @RequestParam(name = "redirect_uri", required = false) String redirectUri,
      @RequestParam(name = "refresh_token", required = false) String refreshToken) {
    if (grantType == null || grantType.isBlank()) {
      throw new OAuthFlowException(
          OAuthFlowException.Reason.INVALID_REQUEST, "grant_type is required");
    }
    final TokenResponse response =
        switch (grantType) {
          case GRANT_AUTHORIZATION_CODE -> tokenService.exchangeAuthorizationCode(
              clientId, code, codeVerifier, redirectUri);
          case GRANT_REFRESH_TOKEN -> tokenService.exchangeRefreshToken(clientId, refreshToken);
          default -> throw new OAuthFlowException(
              OAuthFlowException.Reason.UNSUPPORTED_GRANT_TYPE,
              "grant_type " + grantType + " is not supported");
        };
    return ResponseEntity.ok()
        .header("Cache-Control", "no-store")
        .header("Pragma", "no-cache")
        .body(response);
  }

  /**
   * 役割:
   * - トークンを照会する。
   *
   * 期待動作:
   * - token が無ければ 400 invalid_request。
   * - 無効または期限切れなら 401 で {"active":false} のみ返す。
   */
  @PostMapping(value = "/introspect", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
  public ResponseEntity<IntrospectionResponse> introspect(
      @RequestParam(name = "token", required = false) String token) {
    if (token == null || token.isBlank()) {
      throw new OAuthFlowException(OAuthFlowException.Reason.INVALID_REQUEST, "token is required");
    }
    final IntrospectionResponse response = introspectionService.introspect(token);
    if (!response.active()) {
      return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(response);
    }
    return ResponseEntity.ok(response);
  }
}
