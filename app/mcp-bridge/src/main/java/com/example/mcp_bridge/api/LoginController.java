/*
 * どこで: MCP Bridge API 層
 * 何を: upstream 資格情報のログインフォームと送信処理を提供する
 * なぜ: 認可フロー途中で upstream ログインを行い、その identity をブラウザセッションへ載せるため
 */
package com.example.mcp_bridge.api;

import com.example.mcp_bridge.model.BrowserSessionUser;
import com.example.mcp_bridge.service.LoginBridgeService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpSession;
import java.net.URI;
import java.net.URISyntaxException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.web.csrf.CsrfToken;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.HtmlUtils;

@RestController
@RequiredArgsConstructor
public class LoginController {

  static final String DEFAULT_RETURN_TO = "/authorize";

  private final LoginBridgeService loginBridgeService;

  @GetMapping(value = "/login", produces = MediaType.TEXT_HTML_VALUE)
  public ResponseEntity<String> loginForm(
      @RequestParam(name = "returnTo", required = false) String returnTo,
      HttpServletRequest request) {
    final StringBuilder html = new StringBuilder();
    html.append("<!DOCTYPE html><html><head><meta charset=\"utf-8\"><title>Sign in</title></head>")
        .append("<body><h1>Sign in to the depot service</h1>")
        .append("<form method=\"post\" action=\"/login\">")
        .append("<input type=\"hidden\" name=\"returnTo\" value=\"")
        .append(HtmlUtils.htmlEscape(safeReturnTo(returnTo)))
        .append("\">");
    if (request.getAttribute(CsrfToken.class.getName()) instanceof CsrfToken csrfToken) {
      html.append("<input type=\"hidden\" name=\"")
          .append(HtmlUtils.htmlEscape(csrfToken.getParameterName()))
          .append("\" value=\"")
          .append(HtmlUtils.htmlEscape(csrfToken.getToken()))
          .append("\">");
    }
    html.append("<label>Username <input type=\"text\" name=\"username\" autocomplete=\"username\"></label>")
        .append("<label>Password <input type=\"password\" name=\"password\"")
        .append(" autocomplete=\"current-password\"></label>")
        .append("<button type=\"submit\">Sign in</button></form></body></html>");
    return ResponseEntity.ok().contentType(MediaType.TEXT_HTML).body(html.toString());
  }

  /**
   * 役割:
   * - upstream へログインし、成功したらブラウザセッションへ identity を保存する。
   *
   * 期待動作:
   * - 成功時は returnTo(同一オリジンの相対パスのみ)へ 302。
   * - 失敗時の HTTP ステータスは例外ハンドラが決める(400/401/503)。
   */
  @PostMapping(value = "/login", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
  public ResponseEntity<Void> login(
      @RequestParam(name = "username", required = false) String username,
      @RequestParam(name = "password", required = false) String password,
      @RequestParam(name = "returnTo", required = false) String returnTo,
      HttpServletRequest request) {
    final BrowserSessionUser user = loginBridgeService.login(username, password);
    final HttpSession session = request.getSession(true);
    request.changeSessionId();
    session.setAttribute(BrowserSessionUser.SESSION_ATTRIBUTE, user);
    return ResponseEntity.status(HttpStatus.FOUND)
        .location(URI.create(safeReturnTo(returnTo)))
        .build();
  }

  // オープンリダイレクト防止: "/" 始まりかつ "//" や "/\" でないものだけ
  static String safeReturnTo(String returnTo) {
    if (returnTo == null
        || returnTo.isBlank()
        || !returnTo.startsWith("/")
        || returnTo.startsWith("//")
        || returnTo.startsWith("/\\")) {
      return DEFAULT_RETURN_TO;
    }
    try {
      final URI uri = new URI(returnTo);
      if (uri.isAbsolute() || uri.getRawAuthority() != null) {
        return DEFAULT_RETURN_TO;
      }
    } catch (URISyntaxException ex) {
      return DEFAULT_RETURN_TO;
    }
    return returnTo;
  }
}
