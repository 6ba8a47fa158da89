package dev.henneberger.vertx.source.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogPositionTest {

  @Test
  void parsesAndPrintsPostgresForm() {
    LogPosition position = LogPosition.parse("16/B374D848");

    assertEquals(0x16B374D848L, position.value());
    assertEquals("16/B374D848", position.asString());
    assertEquals(position, LogPosition.parse(Long.toString(0x16B374D848L)));
  }

  @Test
  void comparesAsUnsigned() {
    LogPosition high = LogPosition.parse("FFFFFFFF/0");
    LogPosition low = LogPosition.parse("0/1");

    assertTrue(high.isAfter(low));
    assertEquals(high, LogPosition.max(low, high));
    assertEquals(low, LogPosition.max(null, low));
  }

  @Test
  void rejectsGarbage() {
    assertThrows(IllegalArgumentException.class, () -> LogPosition.parse("x/y"));
    assertThrows(IllegalArgumentException.class, () -> LogPosition.parse("100000000/0"));
  }
}
