/*
 * どこで: MCP ストリーム再開
 * 何を: SSE で送ったイベントを保持し、Last-Event-ID 以降を再送できるようにする
 * なぜ: 切断後の再接続で取りこぼしなく配信を再開するため
 */
package com.example.mcp_bridge.mcp;

import java.util.List;
import java.util.Optional;

public interface EventStore {

  /**
   * 役割: イベントを保存して ID を採番する。
   *
   * <p>期待動作: ID は {@code <streamId>_<sequence>} 形式で、sequence はストリームごとに単調増加する。
   */
  String storeEvent(String streamId, String message);

  /**
   * 役割: 指定 ID より後のイベントを保存順で返す。
   *
   * <p>期待動作: 未知の ID なら空を返し、呼び出し側は新規ストリームとして扱う。
   */
  Optional<List<StoredEvent>> eventsAfter(String lastEventId);

  record StoredEvent(String eventId, String streamId, String message) {}
}
