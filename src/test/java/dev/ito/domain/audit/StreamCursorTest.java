package dev.ito.domain.audit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class StreamCursorTest {

  @Test
  void tokenRestoresEqualCursor() {
    StreamCursor cursor = StreamCursor.of(1024, 7, "3fa9c1");

    StreamCursor restored = StreamCursor.parse(cursor.token());

    assertEquals(cursor, restored);
    assertEquals(1024, restored.byteOffset());
    assertEquals(7, restored.lineCount());
    assertTrue(restored.hasIdentity());
  }

  @Test
  void startHasNoIdentity() {
    assertFalse(StreamCursor.START.hasIdentity());
    assertEquals(StreamCursor.START, StreamCursor.parse(StreamCursor.START.token()));
  }

  @Test
  void cursorsOrderByPosition() {
    assertTrue(StreamCursor.of(10, 1, "a").compareTo(StreamCursor.of(20, 2, "a")) < 0);
    assertTrue(StreamCursor.of(20, 2, "a").compareTo(StreamCursor.START) > 0);
  }

  @Test
  void foreignTokensAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> StreamCursor.parse("42"));
    assertThrows(IllegalArgumentException.class, () -> StreamCursor.parse("c1.x.1.-"));
    assertThrows(IllegalArgumentException.class, () -> StreamCursor.parse("c2.1.1.-"));
    assertThrows(IllegalArgumentException.class, () -> StreamCursor.of(-1, 0, null));
  }
}
