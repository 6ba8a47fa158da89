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

import dev.henneberger.vertx.source.core.LogPosition;
import java.nio.ByteBuffer;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.TimeUnit;
import org.postgresql.PGConnection;
import org.postgresql.replication.LogSequenceNumber;
import org.postgresql.replication.PGReplicationStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ReplicationConnection} over the pgjdbc replication API using {@code pgoutput}
 * protocol version 1.
 */
final class PgReplicationConnection implements ReplicationConnection {

  private static final Logger LOG = LoggerFactory.getLogger(PgReplicationConnection.class);

  private final Connection connection;
  private final PGReplicationStream stream;

  private PgReplicationConnection(Connection connection, PGReplicationStream stream) {
    this.connection = connection;
    this.stream = stream;
  }

  static ReplicationConnection.Factory factory(PgConnections connections, long statusIntervalMillis) {
    return (slotName, publicationName, start) -> open(connections, slotName, publicationName, start, statusIntervalMillis);
  }

  static PgReplicationConnection open(PgConnections connections,
                                      String slotName,
                                      String publicationName,
                                      LogPosition start,
                                      long statusIntervalMillis) throws SQLException {
    Connection replConn = connections.openReplication();
    try {
      PGConnection pgConnection = replConn.unwrap(PGConnection.class);
      PGReplicationStream stream = pgConnection.getReplicationAPI()
        .replicationStream()
        .logical()
        .withSlotName(slotName)
        .withStartPosition(LogSequenceNumber.valueOf(start.value()))
        .withSlotOption("proto_version", 1)
        .withSlotOption("publication_names", publicationName)
        .withStatusInterval((int) Math.max(1L, statusIntervalMillis), TimeUnit.MILLISECONDS)
        .start();
      return new PgReplicationConnection(replConn, stream);
    } catch (SQLException | RuntimeException e) {
      closeQuietly(replConn);
      throw e;
    }
  }

  @Override
  public ByteBuffer readPending() throws SQLException {
    return stream.readPending();
  }

  @Override
  public LogPosition lastReceivedPosition() {
    LogSequenceNumber lsn = stream.getLastReceiveLSN();
    return lsn == null ? LogPosition.ZERO : LogPosition.of(lsn.asLong());
  }

  @Override
  public void sendStatus(LogPosition flushed) throws SQLException {
    if (flushed != null) {
      LogSequenceNumber lsn = LogSequenceNumber.valueOf(flushed.value());
      stream.setAppliedLSN(lsn);
      stream.setFlushedLSN(lsn);
    }
    stream.forceUpdateStatus();
  }

  @Override
  public void close() {
    try {
      stream.close();
    } catch (SQLException e) {
      LOG.debug("Closing replication stream failed", e);
    }
    closeQuietly(connection);
  }

  private static void closeQuietly(Connection connection) {
    try {
      connection.close();
    } catch (SQLException e) {
      LOG.debug("Closing replication connection failed", e);
    }
  }
}
