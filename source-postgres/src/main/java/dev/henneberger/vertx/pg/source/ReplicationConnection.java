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
import java.sql.SQLException;

/**
 * A streaming replication connection positioned on a slot.
 */
interface ReplicationConnection extends AutoCloseable {

  /**
   * Returns the next pending frame without blocking, or {@code null} if none has arrived.
   * Server keepalives are answered internally and never returned.
   */
  ByteBuffer readPending() throws SQLException;

  /**
   * Highest position received from the server so far, including keepalive positions.
   */
  LogPosition lastReceivedPosition();

  /**
   * Sends a standby status update reporting {@code flushed} as applied and flushed.
   * A {@code null} position only refreshes the keepalive.
   */
  void sendStatus(LogPosition flushed) throws SQLException;

  @Override
  void close();

  @FunctionalInterface
  interface Factory {
    ReplicationConnection open(String slotName, String publicationName, LogPosition start) throws SQLException;
  }
}
