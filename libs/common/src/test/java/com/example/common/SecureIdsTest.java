package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SecureIdsTest {

  @Test
  void opaqueValuesAreUrlSafeAndDistinct() {
    final Set<String> values = new HashSet<>();
    for (int i = 0; i < 100; i++) {
      values.add(SecureIds.newOpaqueValue());
    }

    assertThat(values).hasSize(100);
    assertThat(values).allSatisfy(value -> assertThat(value).matches("[A-Za-z0-9_-]{43}"));
  }

  @Test
  void requestIdIsUuid() {
    assertThat(SecureIds.newRequestId())
        .matches("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}");
  }
}
