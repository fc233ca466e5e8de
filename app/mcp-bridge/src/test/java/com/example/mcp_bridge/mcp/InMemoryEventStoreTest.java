package com.example.mcp_bridge.mcp;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class InMemoryEventStoreTest {

  private final InMemoryEventStore store = new InMemoryEventStore();

  @Test
  void eventIdsCarryStreamAndIncreasingSequence() {
    assertThat(store.storeEvent("standalone", "a")).isEqualTo("standalone_1");
    assertThat(store.storeEvent("standalone", "b")).isEqualTo("standalone_2");
    assertThat(store.storeEvent("other", "c")).isEqualTo("other_1");
  }

  @Test
  void replaysOnlyEventsOfTheSameStreamAfterTheGivenId() {
    final String first = store.storeEvent("standalone", "a");
    store.storeEvent("other", "x");
    store.storeEvent("standalone", "b");
    store.storeEvent("standalone", "c");

    final List<EventStore.StoredEvent> replay = store.eventsAfter(first).orElseThrow();

    assertThat(replay)
        .extracting(EventStore.StoredEvent::message)
        .containsExactly("b", "c");
    assertThat(replay).extracting(EventStore.StoredEvent::eventId)
        .containsExactly("standalone_2", "standalone_3");
  }

  @Test
  void lastEventReplaysNothing() {
    store.storeEvent("standalone", "a");
    final String last = store.storeEvent("standalone", "b");

    assertThat(store.eventsAfter(last)).contains(List.of());
  }

  @Test
  void unknownOrMalformedIdsAreEmpty() {
    store.storeEvent("standalone", "a");

    assertThat(store.eventsAfter(null)).isEmpty();
    assertThat(store.eventsAfter("standalone_99")).isEmpty();
    assertThat(store.eventsAfter("missing_1")).isEmpty();
    assertThat(store.eventsAfter("standalone_x")).isEmpty();
    assertThat(store.eventsAfter("nounderscore")).isEmpty();
  }

  @Test
  void streamIdsMayContainSeparator() {
    final String first = store.storeEvent("stream_a", "one");
    store.storeEvent("stream_a", "two");

    assertThat(store.eventsAfter(first).orElseThrow())
        .extracting(EventStore.StoredEvent::message)
        .containsExactly("two");
  }
}
