package com.questboard.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;
import org.junit.jupiter.api.Test;

class TraceIdsTest {

  @Test
  void newTraceIdIsUuid() {
    final String traceId = TraceIds.newTraceId();

    assertThat(UUID.fromString(traceId).toString()).isEqualTo(traceId);
  }

  @Test
  void orNewKeepsSuppliedValue() {
    assertThat(TraceIds.orNew(" req-1 ")).isEqualTo("req-1");
  }

  @Test
  void orNewGeneratesWhenBlank() {
    assertThat(TraceIds.orNew(null)).isNotBlank();
    assertThat(TraceIds.orNew("  ")).isNotBlank();
  }
}
