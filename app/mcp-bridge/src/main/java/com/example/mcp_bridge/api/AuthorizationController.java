/*
 * どこで: MCP Bridge API 層
 * 何を: /authorize(PKCE 認可)と /register(動的クライアント登録)を提供する
 * なぜ: ブラウザセッションのログイン結果を OAuth フローへ橋渡しする入口を 1 箇所にまとめるため
 */
package com.example.mcp_bridge.api;

import com.example.mcp_bridge.api.request.AuthorizationRequest;
import com.example.mcp_bridge.api.request.RegisterClientRequest;
import com.example.mcp_bridge.api.response.ClientRegistrationResponse;
import com.example.mcp_bridge.model.BrowserSessionUser;
import com.example.mcp_bridge.service.AuthorizationService;
import com.example.mcp_bridge.service.ClientRegistrationService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpSession;
import java.net.URI;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class AuthorizationController {

  private final AuthorizationService authorizationService;
  private final ClientRegistrationService clientRegistrationService;

  /**
   * 役割:
   * - PKCE 認可リクエストを受け付ける。
   *
   * 期待動作:
   * - 未ログインならログイン画面へ 302。
   * - ログイン済みなら code_challenge と identity を結び付け、redirect_uri へ code 付きで 302。
   */
  @GetMapping("/authorize")
  public ResponseEntity<Void> authorize(
      @RequestParam(name = "response_type", required = false) String responseType,
      @RequestParam(name = "client_id", required = false) String clientId,
      @RequestParam(name = "redirect_uri", required = false) String redirectUri,
      @RequestParam(name = "code_challenge", required = false) String codeChallenge,
      @RequestParam(name = "code_challenge_method", required = false) String codeChallengeMethod,
      @RequestParam(name = "state", required = false) String state,
      @RequestParam(name = "scope", required = false) String scope,
      @RequestParam(name = "resource", required = false) String resource,
      HttpServletRequest request) {
    final AuthorizationRequest authorizationRequest =
        new AuthorizationRequest(
            responseType,
            clientId,
            redirectUri,
            codeChallenge,
            codeChallengeMethod,
            state,
            scope,
            resource);
    final String location =
        authorizationService.authorize(
            authorizationRequest, sessionUser(request), originalUrl(request));
    return ResponseEntity.status(HttpStatus.FOUND).location(URI.create(location)).build();
  }

  @PostMapping("/register")
  public ResponseEntity<ClientRegistrationResponse> register(
      @RequestBody RegisterClientRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(
            ClientRegistrationResponse.from(
                clientRegistrationService.register(request.redirectUris())));
  }

  private Optional<BrowserSessionUser> sessionUser(HttpServletRequest request) {
    final HttpSession session = request.getSession(false);
    if (session == null) {
      return Optional.empty();
    }
    final Object attribute = session.getAttribute(BrowserSessionUser.SESSION_ATTRIBUTE);
    if (attribute instanceof BrowserSessionUser user) {
      return Optional.of(user);
    }
    return Optional.empty();
  }

  private String originalUrl(HttpServletRequest request) {
    final String query = request.getQueryString();
    return query == null ? request.getRequestURI() : request.getRequestURI() + "?" + query;
  }
}
