/*
 * どこで: MCP セッション
 * 何を: 1 セッション分の SSE ストリームとイベントバッファを保持する
 * なぜ: 切断中もイベントを溜め、Last-Event-ID による再開で順序どおりに再送するため
 */
package com.example.mcp_bridge.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

public class McpStreamTransport {

  public static final String STANDALONE_STREAM_ID = "standalone";
  static final String SSE_EVENT_NAME = "message";

  private static final Logger logger = LoggerFactory.getLogger(McpStreamTransport.class);

  private final String sessionId;
  private final EventStore eventStore;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final List<Runnable> closeCallbacks = new ArrayList<>();

  private SseEmitter liveStream;
  private McpLogLevel minimumLogLevel = McpLogLevel.INFO;
  private volatile Instant lastActivity;
  private boolean closed;

  public McpStreamTransport(
      String sessionId, EventStore eventStore, ObjectMapper objectMapper, Clock clock) {
    this.sessionId = sessionId;
    this.eventStore = eventStore;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.lastActivity = Instant.now(clock);
  }

  public String sessionId() {
    return sessionId;
  }

  public Instant lastActivity() {
    return lastActivity;
  }

  public void touch() {
    lastActivity = Instant.now(clock);
  }

  /**
   * 役割: サーバー発のメッセージをバッファへ保存し、接続中ならライブ配信する。
   *
   * <p>期待動作: 送信失敗時はライブストリームだけを切り離し、セッションとバッファは残す。
   */
  public synchronized void send(Object message) {
    if (closed) {
      logger.debug("dropping message for closed session sessionId={}", sessionId);
      return;
    }
    final String payload = serialize(message);
    final String eventId = eventStore.storeEvent(STANDALONE_STREAM_ID, payload);
    if (liveStream != null) {
      deliver(liveStream, eventId, payload);
    }
  }

  /** MCP の notifications/message を送る。設定レベル未満は捨てる。 */
  public void sendLog(McpLogLevel level, String loggerName, Object data) {
    if (!level.isAtLeast(logLevel())) {
      return;
    }
    send(
        JsonRpcNotification.of(
            "notifications/message",
            Map.of("level", level.value(), "logger", loggerName, "data", data)));
  }

  /**
   * 役割: GET /mcp のストリームを接続する。
   *
   * <p>期待動作: 既存のライブストリームは置き換える。lastEventId が既知なら、それより後のイベントを順に再送してからライブ配信に入る。
   */
  public synchronized void attach(SseEmitter emitter, String lastEventId) {
    if (closed) {
      emitter.complete();
      return;
    }
    if (liveStream != null && liveStream != emitter) {
      logger.info("replacing live stream sessionId={}", sessionId);
      liveStream.complete();
    }
    liveStream = emitter;
    emitter.onCompletion(() -> detach(emitter));
    emitter.onTimeout(() -> detach(emitter));
    emitter.onError(error -> detach(emitter));
    touch();

    final Optional<List<EventStore.StoredEvent>> replay = eventStore.eventsAfter(lastEventId);
    if (lastEventId != null && replay.isEmpty()) {
      logger.info("unknown Last-Event-ID, starting fresh stream sessionId={}", sessionId);
    }
    for (EventStore.StoredEvent event : replay.orElse(List.of())) {
      if (!deliver(emitter, event.eventId(), event.message())) {
        return;
      }
    }
  }

  public synchronized boolean hasLiveStream() {
    return liveStream != null;
  }

  public synchronized void setLogLevel(McpLogLevel level) {
    minimumLogLevel = level;
  }

  public synchronized McpLogLevel logLevel() {
    return minimumLogLevel;
  }

  public synchronized void onClose(Runnable callback) {
    closeCallbacks.add(callback);
  }

  public synchronized boolean isClosed() {
    return closed;
  }

  /** ストリームを閉じ、登録済みのクローズ処理を 1 回だけ実行する。 */
  public void close() {
    final List<Runnable> callbacks;
    synchronized (this) {
      if (closed) {
        return;
      }
      closed = true;
      if (liveStream != null) {
        liveStream.complete();
        liveStream = null;
      }
      callbacks = List.copyOf(closeCallbacks);
      closeCallbacks.clear();
    }
    callbacks.forEach(Runnable::run);
    logger.info("mcp transport closed sessionId={}", sessionId);
  }

  private synchronized void detach(SseEmitter emitter) {
    if (liveStream == emitter) {
      liveStream = null;
      logger.debug("live stream detached sessionId={}", sessionId);
    }
  }

  private boolean deliver(SseEmitter emitter, String eventId, String payload) {
    try {
      emitter.send(SseEmitter.event().id(eventId).name(SSE_EVENT_NAME).data(payload));
      return true;
    } catch (IOException | IllegalStateException ex) {
      logger.info(
          "live stream send failed, detaching sessionId={} cause={}", sessionId, ex.getMessage());
      detach(emitter);
      return false;
    }
  }

  private String serialize(Object message) {
    try {
      return objectMapper.writeValueAsString(message);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize mcp message", ex);
    }
  }
}
