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

import dev.henneberger.vertx.source.core.Registration;
import java.util.Objects;
import org.slf4j.Logger;

public final class SourceLogging {

  private SourceLogging() {
  }

  public static Registration attachDefaultLogging(PostgresSource source,
                                                  Logger logger,
                                                  String sourceName) {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(logger, "logger");
    String name = sourceName == null || sourceName.isBlank() ? "source" : sourceName;

    return source.onLogReaderStateChange(change -> {
      Throwable cause = change.cause();
      if (cause != null) {
        logger.warn("source={} state={} prev={} position={} attempt={} cause={}",
          name,
          change.state(),
          change.previousState(),
          change.position(),
          change.attempt(),
          cause.toString());
      } else {
        logger.info("source={} state={} prev={} position={} attempt={}",
          name,
          change.state(),
          change.previousState(),
          change.position(),
          change.attempt());
      }
    });
  }
}
