/*
 * Copyright (C) 2026 Daniel Henneberger
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.henneberger.vertx.pg.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.henneberger.vertx.source.core.ChangeRecord;
import dev.henneberger.vertx.source.core.CommittedTransaction;
import dev.henneberger.vertx.source.core.LogDecodeException;
import dev.henneberger.vertx.source.core.LogPosition;
import dev.henneberger.vertx.source.core.StreamDescriptor;
import java.io.ByteArrayOutputStream;
import java.time.Instant;
import java.util.Arrays;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class PgOutputDecoderTest {

  @Test
  void releasesInsertAtCommitWithEndPosition() {
    PgOutputDecoder decoder = new PgOutputDecoder();

    assertFalse(decoder.decode(PgOutputFrames.begin(42)).isPresent());
    assertFalse(decoder.decode(PgOutputFrames.usersRelation(1)).isPresent());
    assertFalse(decoder.decode(PgOutputFrames.insert(1, "1", "alice")).isPresent());
    assertTrue(decoder.inTransaction());

    Optional<CommittedTransaction> txn = decoder.decode(PgOutputFrames.commit(0x100L, 0x120L));

    assertTrue(txn.isPresent());
    assertFalse(decoder.inTransaction());
    assertEquals(42L, txn.get().xid());
    assertEquals(LogPosition.of(0x120L), txn.get().commitPosition());
    assertEquals(1, txn.get().changes().size());
    ChangeRecord change = txn.get().changes().get(0);
    assertEquals(ChangeRecord.Operation.INSERT, change.operation());
    assertEquals(StreamDescriptor.of("public", "users"), change.stream());
    assertEquals(1, change.after().get("id"));
    assertEquals("alice", change.after().get("name"));
    assertEquals(LogPosition.of(0x120L), change.commitPosition());
  }

  @Test
  void decodesUpdateWithOldKeyAndDelete() {
    PgOutputDecoder decoder = new PgOutputDecoder();
    decoder.decode(PgOutputFrames.usersRelation(7));
    decoder.decode(PgOutputFrames.begin(5));
    decoder.decode(PgOutputFrames.update(7, new String[] {"1", null}, "2", "bob"));
    decoder.decode(PgOutputFrames.update(7, null, "2", "carol"));
    decoder.decode(PgOutputFrames.delete(7, "2", null));

    CommittedTransaction txn = decoder.decode(PgOutputFrames.commit(0x200L, 0x210L)).orElseThrow();

    assertEquals(3, txn.changes().size());
    ChangeRecord moved = txn.changes().get(0);
    assertEquals(ChangeRecord.Operation.UPDATE, moved.operation());
    assertEquals(1, moved.before().get("id"));
    assertEquals("bob", moved.after().get("name"));
    assertNull(txn.changes().get(1).before());
    ChangeRecord deleted = txn.changes().get(2);
    assertEquals(ChangeRecord.Operation.DELETE, deleted.operation());
    assertEquals(2, deleted.before().get("id"));
    assertNull(deleted.after());
  }

  @Test
  void followsRelationChangesMidStream() {
    PgOutputDecoder decoder = new PgOutputDecoder();
    decoder.decode(PgOutputFrames.usersRelation(1));
    decoder.decode(PgOutputFrames.begin(1));
    decoder.decode(PgOutputFrames.insert(1, "1", "alice"));
    decoder.decode(PgOutputFrames.commit(0x10L, 0x18L));

    decoder.decode(PgOutputFrames.usersRelation(1, "email"));
    decoder.decode(PgOutputFrames.begin(2));
    decoder.decode(PgOutputFrames.insert(1, "2", "bob", "bob@example.com"));
    CommittedTransaction txn = decoder.decode(PgOutputFrames.commit(0x20L, 0x28L)).orElseThrow();

    assertEquals("bob@example.com", txn.changes().get(0).after().get("email"));
  }

  @Test
  void committedTransactionWithoutChangesIsStillReleased() {
    PgOutputDecoder decoder = new PgOutputDecoder();
    decoder.decode(PgOutputFrames.begin(9));

    CommittedTransaction txn = decoder.decode(PgOutputFrames.commit(0x30L, 0x38L)).orElseThrow();

    assertTrue(txn.changes().isEmpty());
    assertEquals(LogPosition.of(0x38L), txn.commitPosition());
  }

  @Test
  void skipsUnknownAndIgnoredFrameTypes() {
    PgOutputDecoder decoder = new PgOutputDecoder();

    assertFalse(decoder.decode(new byte[] {'Z', 1, 2, 3}).isPresent());
    assertFalse(decoder.decode(new byte[] {'Y', 0, 0, 0, 1}).isPresent());
    assertFalse(decoder.decode(new byte[0]).isPresent());
    assertFalse(decoder.inTransaction());
  }

  @Test
  void truncatedFrameFails() {
    PgOutputDecoder decoder = new PgOutputDecoder();
    decoder.decode(PgOutputFrames.usersRelation(1));
    decoder.decode(PgOutputFrames.begin(1));
    byte[] insert = PgOutputFrames.insert(1, "1", "alice");

    assertThrows(LogDecodeException.class, () -> decoder.decode(Arrays.copyOf(insert, insert.length - 3)));
  }

  @Test
  void oversizedColumnLengthFails() {
    PgOutputDecoder decoder = new PgOutputDecoder();
    decoder.decode(PgOutputFrames.usersRelation(1));
    decoder.decode(PgOutputFrames.begin(1));
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    PgOutputFrames.writeByte(out, 'I');
    PgOutputFrames.writeInt(out, 1);
    PgOutputFrames.writeByte(out, 'N');
    PgOutputFrames.writeShort(out, 2);
    PgOutputFrames.writeByte(out, 't');
    PgOutputFrames.writeInt(out, Integer.MAX_VALUE);
    PgOutputFrames.writeByte(out, '1');

    assertThrows(LogDecodeException.class, () -> decoder.decode(out.toByteArray()));
  }

  @Test
  void changeForUnknownRelationFails() {
    PgOutputDecoder decoder = new PgOutputDecoder();
    decoder.decode(PgOutputFrames.begin(1));

    assertThrows(LogDecodeException.class, () -> decoder.decode(PgOutputFrames.insert(99, "1", "alice")));
  }

  @Test
  void tupleWithWrongColumnCountFails() {
    PgOutputDecoder decoder = new PgOutputDecoder();
    decoder.decode(PgOutputFrames.usersRelation(1));
    decoder.decode(PgOutputFrames.begin(1));

    assertThrows(LogDecodeException.class, () -> decoder.decode(PgOutputFrames.insert(1, "1")));
  }

  @Test
  void discardedTransactionIsNeverReleased() {
    PgOutputDecoder decoder = new PgOutputDecoder();
    decoder.decode(PgOutputFrames.usersRelation(1));
    decoder.decode(PgOutputFrames.begin(1));
    decoder.decode(PgOutputFrames.insert(1, "1", "alice"));

    decoder.discardTransaction();

    assertFalse(decoder.inTransaction());
    assertThrows(LogDecodeException.class, () -> decoder.decode(PgOutputFrames.commit(0x10L, 0x18L)));
    decoder.decode(PgOutputFrames.begin(2));
    decoder.decode(PgOutputFrames.insert(1, "2", "bob"));
    CommittedTransaction txn = decoder.decode(PgOutputFrames.commit(0x20L, 0x28L)).orElseThrow();
    assertEquals(1, txn.changes().size());
    assertEquals(2, txn.changes().get(0).after().get("id"));
  }

  @Test
  void convertsPostgresEpochMicros() {
    assertEquals(Instant.parse("2000-01-01T00:00:01Z"), PgOutputDecoder.fromPgEpochMicros(1_000_000L));
    assertEquals(Instant.parse("1999-12-31T23:59:59.999999Z"), PgOutputDecoder.fromPgEpochMicros(-1L));
  }
}
