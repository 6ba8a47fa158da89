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

import dev.henneberger.vertx.source.core.ChangeRecord;
import dev.henneberger.vertx.source.core.CommittedTransaction;
import dev.henneberger.vertx.source.core.LogDecodeException;
import dev.henneberger.vertx.source.core.LogPosition;
import dev.henneberger.vertx.source.core.StreamDescriptor;
import dev.henneberger.vertx.source.core.TransactionBuffer;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decoder for the native PostgreSQL {@code pgoutput} logical replication format (protocol
 * version 1). Row changes are buffered per transaction and released as one
 * {@link CommittedTransaction} when the commit frame arrives.
 */
public final class PgOutputDecoder {

  private static final Logger LOG = LoggerFactory.getLogger(PgOutputDecoder.class);

  private static final long PG_EPOCH_SECONDS = 946684800L;

  private final Map<Integer, Relation> relations = new HashMap<>();
  private final TransactionBuffer transaction = new TransactionBuffer();
  private Instant beginTimestamp;

  public Optional<CommittedTransaction> decode(ByteBuffer buffer) {
    byte[] payload = new byte[buffer.remaining()];
    buffer.get(payload);
    return decode(payload);
  }

  /**
   * Decodes one frame.
   *
   * @return the committed transaction when {@code payload} is a commit frame
   * @throws LogDecodeException if the frame is truncated or inconsistent with known relations
   */
  public Optional<CommittedTransaction> decode(byte[] payload) {
    Cursor cursor = new Cursor(payload);
    if (!cursor.hasRemaining()) {
      return Optional.empty();
    }

    char messageType = (char) cursor.readByte();
    switch (messageType) {
      case 'B':
        decodeBegin(cursor);
        return Optional.empty();
      case 'C':
        return Optional.of(decodeCommit(cursor));
      case 'R':
        decodeRelation(cursor);
        return Optional.empty();
      case 'I':
        decodeInsert(cursor);
        return Optional.empty();
      case 'U':
        decodeUpdate(cursor);
        return Optional.empty();
      case 'D':
        decodeDelete(cursor);
        return Optional.empty();
      case 'T':
      case 'Y':
      case 'O':
      case 'M':
        return Optional.empty();
      default:
        LOG.warn("Skipping unsupported pgoutput message type '{}' ({} bytes)", messageType, payload.length);
        return Optional.empty();
    }
  }

  public boolean inTransaction() {
    return transaction.inTransaction();
  }

  /**
   * Drops the partially decoded transaction. Relation metadata is kept; the server resends it
   * on a new connection before it is used.
   */
  public void discardTransaction() {
    transaction.discard();
    beginTimestamp = null;
  }

  private void decodeBegin(Cursor cursor) {
    cursor.readLong();
    beginTimestamp = fromPgEpochMicros(cursor.readLong());
    long xid = Integer.toUnsignedLong(cursor.readInt());
    transaction.begin(xid);
  }

  private CommittedTransaction decodeCommit(Cursor cursor) {
    cursor.readByte();
    cursor.readLong();
    LogPosition endPosition = LogPosition.of(cursor.readLong());
    Instant commitTimestamp = fromPgEpochMicros(cursor.readLong());
    beginTimestamp = null;
    return transaction.commit(endPosition, commitTimestamp);
  }

  private void decodeRelation(Cursor cursor) {
    int relationId = cursor.readInt();
    String schema = cursor.readCString();
    String table = cursor.readCString();
    cursor.readByte();
    int columnCount = cursor.readUnsignedShort();
    List<Column> columns = new ArrayList<>(columnCount);

    for (int i = 0; i < columnCount; i++) {
      cursor.readByte();
      String name = cursor.readCString();
      int typeOid = cursor.readInt();
      cursor.readInt();
      columns.add(new Column(name, typeOid));
    }

    Relation previous = relations.put(relationId, new Relation(StreamDescriptor.of(schema, table), columns));
    if (previous != null && previous.columns.size() != columns.size()) {
      LOG.info("Relation {} changed from {} to {} column(s)", previous.stream, previous.columns.size(), columns.size());
    }
  }

  private void decodeInsert(Cursor cursor) {
    Relation relation = relation(cursor.readInt());
    char tupleType = (char) cursor.readByte();
    if (tupleType != 'N') {
      throw new LogDecodeException("Unexpected tuple marker for INSERT on " + relation.stream + ": " + tupleType);
    }
    Map<String, Object> row = decodeTuple(cursor, relation);
    transaction.add(relation.stream, ChangeRecord.Operation.INSERT, null, row);
  }

  private void decodeUpdate(Cursor cursor) {
    Relation relation = relation(cursor.readInt());

    Map<String, Object> before = null;
    char marker = (char) cursor.readByte();
    if (marker == 'K' || marker == 'O') {
      before = decodeTuple(cursor, relation);
      marker = (char) cursor.readByte();
    }
    if (marker != 'N') {
      throw new LogDecodeException("Unexpected tuple marker for UPDATE on " + relation.stream + ": " + marker);
    }
    Map<String, Object> after = decodeTuple(cursor, relation);
    transaction.add(relation.stream, ChangeRecord.Operation.UPDATE, before, after);
  }

  private void decodeDelete(Cursor cursor) {
    Relation relation = relation(cursor.readInt());
    char marker = (char) cursor.readByte();
    if (marker != 'K' && marker != 'O') {
      throw new LogDecodeException("Unexpected tuple marker for DELETE on " + relation.stream + ": " + marker);
    }
    Map<String, Object> before = decodeTuple(cursor, relation);
    transaction.add(relation.stream, ChangeRecord.Operation.DELETE, before, null);
  }

  private Map<String, Object> decodeTuple(Cursor cursor, Relation relation) {
    int colCount = cursor.readUnsignedShort();
    if (colCount != relation.columns.size()) {
      throw new LogDecodeException("Tuple for " + relation.stream + " has " + colCount
        + " column(s) but the relation has " + relation.columns.size());
    }
    Map<String, Object> values = new LinkedHashMap<>();

    for (int i = 0; i < colCount; i++) {
      Column column = relation.columns.get(i);
      char kind = (char) cursor.readByte();
      switch (kind) {
        case 'n':
          values.put(column.name, null);
          break;
        case 'u':
          // unchanged TOAST value, not sent
          break;
        case 't': {
          int len = cursor.readInt();
          values.put(column.name, PgValues.fromText(cursor.readString(len), column.typeOid));
          break;
        }
        case 'b': {
          int len = cursor.readInt();
          values.put(column.name, Base64.getEncoder().encodeToString(cursor.readBytes(len)));
          break;
        }
        default:
          throw new LogDecodeException("Unsupported tuple column kind for " + relation.stream + "." + column.name + ": " + kind);
      }
    }

    return values;
  }

  private Relation relation(int relationId) {
    Relation relation = relations.get(relationId);
    if (relation == null) {
      throw new LogDecodeException("pgoutput relation metadata missing for relation id " + relationId);
    }
    return relation;
  }

  static Instant fromPgEpochMicros(long micros) {
    long seconds = Math.floorDiv(micros, 1_000_000L);
    long microsRemainder = Math.floorMod(micros, 1_000_000L);
    return Instant.ofEpochSecond(PG_EPOCH_SECONDS + seconds, microsRemainder * 1_000L);
  }

  private static final class Relation {
    private final StreamDescriptor stream;
    private final List<Column> columns;

    private Relation(StreamDescriptor stream, List<Column> columns) {
      this.stream = stream;
      this.columns = columns;
    }
  }

  private static final class Column {
    private final String name;
    private final int typeOid;

    private Column(String name, int typeOid) {
      this.name = name;
      this.typeOid = typeOid;
    }
  }

  private static final class Cursor {
    private final byte[] bytes;
    private int index;

    private Cursor(byte[] bytes) {
      this.bytes = bytes;
      this.index = 0;
    }

    private boolean hasRemaining() {
      return index < bytes.length;
    }

    private void require(int len) {
      if (len < 0 || len > bytes.length - index) {
        throw new LogDecodeException("Truncated pgoutput frame: need " + len + " byte(s) at offset " + index
          + " of " + bytes.length);
      }
    }

    private int readUnsignedShort() {
      require(2);
      return ((bytes[index++] & 0xff) << 8) | (bytes[index++] & 0xff);
    }

    private byte readByte() {
      require(1);
      return bytes[index++];
    }

    private int readInt() {
      require(4);
      int value = ((bytes[index] & 0xff) << 24)
        | ((bytes[index + 1] & 0xff) << 16)
        | ((bytes[index + 2] & 0xff) << 8)
        | (bytes[index + 3] & 0xff);
      index += 4;
      return value;
    }

    private long readLong() {
      require(8);
      long value = ((long) (bytes[index] & 0xff) << 56)
        | ((long) (bytes[index + 1] & 0xff) << 48)
        | ((long) (bytes[index + 2] & 0xff) << 40)
        | ((long) (bytes[index + 3] & 0xff) << 32)
        | ((long) (bytes[index + 4] & 0xff) << 24)
        | ((long) (bytes[index + 5] & 0xff) << 16)
        | ((long) (bytes[index + 6] & 0xff) << 8)
        | (bytes[index + 7] & 0xff);
      index += 8;
      return value;
    }

    private String readCString() {
      int start = index;
      while (index < bytes.length && bytes[index] != 0) {
        index++;
      }
      if (index >= bytes.length) {
        throw new LogDecodeException("Truncated pgoutput frame: unterminated string at offset " + start);
      }
      String out = new String(bytes, start, index - start, StandardCharsets.UTF_8);
      index++;
      return out;
    }

    private String readString(int len) {
      require(len);
      String out = new String(bytes, index, len, StandardCharsets.UTF_8);
      index += len;
      return out;
    }

    private byte[] readBytes(int len) {
      require(len);
      byte[] out = new byte[len];
      System.arraycopy(bytes, index, out, 0, len);
      index += len;
      return out;
    }
  }
}
