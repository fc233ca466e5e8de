/*
 * どこで: MCP セッション管理
 * 何を: セッション ID ごとのトランスポートと認証コンテキストを保持する
 * なぜ: トランスポートを閉じたときに両方の表から同時に消し、古い認証情報が残らないようにするため
 */
package com.example.mcp_bridge.mcp;

import com.example.mcp_bridge.config.McpProperties;
import com.example.mcp_bridge.model.AuthContext;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class McpSessionManager {

  private static final Logger logger = LoggerFactory.getLogger(McpSessionManager.class);

  private final ObjectMapper objectMapper;
  private final McpProperties properties;
  private final Clock clock;

  private final Map<String, McpStreamTransport> transports = new ConcurrentHashMap<>();
  private final Map<String, AuthContext> sessionAuth = new ConcurrentHashMap<>();

  /** initialize 受信時に新しいセッションを作る。authContext は匿名セッションなら null。 */
  public McpStreamTransport createSession(AuthContext authContext) {
    final String sessionId = UUID.randomUUID().toString();
    final McpStreamTransport transport =
        new McpStreamTransport(sessionId, new InMemoryEventStore(), objectMapper, clock);
    transport.onClose(
        () -> {
          transports.remove(sessionId);
          sessionAuth.remove(sessionId);
        });
    transports.put(sessionId, transport);
    if (authContext != null) {
      sessionAuth.put(sessionId, authContext);
    }
    logger.info(
        "mcp session created sessionId={} identity={}",
        sessionId,
        authContext == null ? "(anonymous)" : authContext.identity());
    return transport;
  }

  public Optional<McpStreamTransport> find(String sessionId) {
    if (sessionId == null || sessionId.isBlank()) {
      return Optional.empty();
    }
    return Optional.ofNullable(transports.get(sessionId));
  }

  public Optional<AuthContext> authContext(String sessionId) {
    if (sessionId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(sessionAuth.get(sessionId));
  }

  /** 有効な bearer トークン付きのリクエストごとに認証スナップショットを差し替える。 */
  public void refreshAuthContext(String sessionId, AuthContext authContext) {
    if (authContext == null || !transports.containsKey(sessionId)) {
      return;
    }
    sessionAuth.put(sessionId, authContext);
  }

  public boolean closeSession(String sessionId) {
    final Optional<McpStreamTransport> transport = find(sessionId);
    transport.ifPresent(McpStreamTransport::close);
    return transport.isPresent();
  }

  /** 最終アクティビティからアイドル上限を超えたセッションを閉じる。 */
  public int reapIdle() {
    if (!properties.idleReapingEnabled()) {
      return 0;
    }
    final Instant threshold = Instant.now(clock).minus(properties.sessionIdleTimeout());
    final List<McpStreamTransport> idle =
        transports.values().stream()
            .filter(transport -> transport.lastActivity().isBefore(threshold))
            .toList();
    idle.forEach(McpStreamTransport::close);
    if (!idle.isEmpty()) {
      logger.info("reaped idle mcp sessions count={}", idle.size());
    }
    return idle.size();
  }

  @PreDestroy
  public void closeAll() {
    final List<McpStreamTransport> open = List.copyOf(transports.values());
    logger.info("closing all mcp sessions count={}", open.size());
    open.forEach(McpStreamTransport::close);
  }

  @VisibleForTesting
  int sessionCount() {
    return transports.size();
  }

  @VisibleForTesting
  int authContextCount() {
    return sessionAuth.size();
  }
}
