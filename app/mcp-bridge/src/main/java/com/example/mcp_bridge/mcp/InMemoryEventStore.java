package com.example.mcp_bridge.mcp;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/** セッションごとに 1 つ生成されるイベントストア。sequence で索引するので再送は対数時間で開始位置を引ける。 */
public class InMemoryEventStore implements EventStore {

  private static final char SEPARATOR = '_';

  private final Map<String, StreamLog> streams = new ConcurrentHashMap<>();

  @Override
  public String storeEvent(String streamId, String message) {
    if (streamId == null || streamId.isBlank()) {
      throw new IllegalArgumentException("streamId is required");
    }
    final StreamLog log = streams.computeIfAbsent(streamId, ignored -> new StreamLog());
    final long sequence = log.nextSequence.incrementAndGet();
    final String eventId = streamId + SEPARATOR + sequence;
    log.events.put(sequence, new StoredEvent(eventId, streamId, message));
    return eventId;
  }

  @Override
  public Optional<List<StoredEvent>> eventsAfter(String lastEventId) {
    if (lastEventId == null) {
      return Optional.empty();
    }
    final int separatorIndex = lastEventId.lastIndexOf(SEPARATOR);
    if (separatorIndex <= 0 || separatorIndex == lastEventId.length() - 1) {
      return Optional.empty();
    }
    final String streamId = lastEventId.substring(0, separatorIndex);
    final long sequence;
    try {
      sequence = Long.parseLong(lastEventId.substring(separatorIndex + 1));
    } catch (NumberFormatException ex) {
      return Optional.empty();
    }
    final StreamLog log = streams.get(streamId);
    if (log == null || !log.events.containsKey(sequence)) {
      return Optional.empty();
    }
    final ConcurrentNavigableMap<Long, StoredEvent> tail = log.events.tailMap(sequence, false);
    return Optional.of(List.copyOf(tail.values()));
  }

  private static final class StreamLog {
    private final AtomicLong nextSequence = new AtomicLong();
    private final ConcurrentSkipListMap<Long, StoredEvent> events = new ConcurrentSkipListMap<>();
  }
}
