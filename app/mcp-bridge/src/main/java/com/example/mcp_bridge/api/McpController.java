/*
 * どこで: MCP Bridge API 層
 * 何を: MCP Streamable HTTP の POST/GET/DELETE /mcp を提供する
 * なぜ: JSON-RPC 要求、SSE ストリーム、セッション終了を同じエンドポイントで扱うため
 */
package com.example.mcp_bridge.api;

import com.example.mcp_bridge.config.McpAuthenticationToken;
import com.example.mcp_bridge.config.RequestMdcInterceptor;
import com.example.mcp_bridge.mcp.JsonRpcError;
import com.example.mcp_bridge.mcp.JsonRpcRequest;
import com.example.mcp_bridge.mcp.JsonRpcResponse;
import com.example.mcp_bridge.mcp.McpProtocolException;
import com.example.mcp_bridge.mcp.McpRequestDispatcher;
import com.example.mcp_bridge.mcp.McpSessionManager;
import com.example.mcp_bridge.mcp.McpStreamTransport;
import com.example.mcp_bridge.model.AuthContext;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/mcp")
@RequiredArgsConstructor
public class McpController {

  static final String SESSION_HEADER = RequestMdcInterceptor.MCP_SESSION_HEADER;
  static final String LAST_EVENT_ID_HEADER = "Last-Event-ID";

  private static final Logger logger = LoggerFactory.getLogger(McpController.class);

  private final McpSessionManager sessionManager;
  private final McpRequestDispatcher dispatcher;

  /**
   * 役割:
   * - JSON-RPC メッセージを受け付ける。
   *
   * 期待動作:
   * - 既知のセッション ID ならそのセッションで処理し、有効な bearer があれば認証情報を更新する。
   * - セッション ID 無しの initialize は新規セッションを作り、応答ヘッダーで ID を返す。
   * - それ以外は 400 と JSON-RPC エラー -32000。
   */
  @PostMapping(produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<JsonRpcResponse> post(
      @RequestHeader(name = SESSION_HEADER, required = false) String sessionId,
      @RequestBody(required = false) String body) {
    final Optional<JsonRpcRequest> parsed = dispatcher.parse(body);
    final Optional<AuthContext> bearer = currentAuthContext();

    final McpStreamTransport transport;
    final Optional<McpStreamTransport> existing = sessionManager.find(sessionId);
    if (existing.isPresent()) {
      transport = existing.get();
      bearer.ifPresent(context -> sessionManager.refreshAuthContext(sessionId, context));
    } else if (sessionId == null
        && parsed.isPresent()
        && McpRequestDispatcher.METHOD_INITIALIZE.equals(parsed.get().method())) {
      transport = sessionManager.createSession(bearer.orElse(null));
    } else {
      throw new McpProtocolException(
          JsonRpcError.SERVER_ERROR, "Bad Request: No valid session ID provided");
    }

    if (parsed.isEmpty()) {
      return ResponseEntity.accepted().header(SESSION_HEADER, transport.sessionId()).build();
    }
    final Optional<JsonRpcResponse> response =
        dispatcher.dispatch(
            parsed.get(), transport, sessionManager.authContext(transport.sessionId()));
    if (response.isEmpty()) {
      return ResponseEntity.accepted().header(SESSION_HEADER, transport.sessionId()).build();
    }
    return ResponseEntity.ok()
        .header(SESSION_HEADER, transport.sessionId())
        .contentType(MediaType.APPLICATION_JSON)
        .body(response.get());
  }

  /** サーバー発メッセージ用の SSE ストリーム。Last-Event-ID が既知なら続きから再送する。 */
  @GetMapping
  public ResponseEntity<SseEmitter> stream(
      @RequestHeader(name = SESSION_HEADER, required = false) String sessionId,
      @RequestHeader(name = LAST_EVENT_ID_HEADER, required = false) String lastEventId) {
    final Optional<McpStreamTransport> transport = sessionManager.find(sessionId);
    if (transport.isEmpty()) {
      logger.info("sse stream requested with invalid or missing session ID");
      return ResponseEntity.badRequest().build();
    }
    // 0 はタイムアウトなし。切断はクライアント側かセッション終了で起きる
    final SseEmitter emitter = new SseEmitter(0L);
    transport.get().attach(emitter, lastEventId);
    return ResponseEntity.ok()
        .header(SESSION_HEADER, transport.get().sessionId())
        .contentType(MediaType.TEXT_EVENT_STREAM)
        .body(emitter);
  }

  @DeleteMapping
  public ResponseEntity<Void> terminate(
      @RequestHeader(name = SESSION_HEADER, required = false) String sessionId) {
    if (!sessionManager.closeSession(sessionId)) {
      return ResponseEntity.notFound().build();
    }
    return ResponseEntity.noContent().build();
  }

  private Optional<AuthContext> currentAuthContext() {
    final Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (authentication instanceof McpAuthenticationToken token) {
      return Optional.of(token.authContext());
    }
    return Optional.empty();
  }
}
