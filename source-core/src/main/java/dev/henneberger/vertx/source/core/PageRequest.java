package dev.henneberger.vertx.source.core;

import io.vertx.core.json.JsonObject;
import java.util.List;
import java.util.Objects;

/**
 * One page of a keyset-paginated scan: rows ordered by {@link #orderBy()} that sort strictly
 * after {@link #after()}, optionally restricted to cursor values at or above an inclusive bound.
 */
public final class PageRequest {

  private final ConfiguredStream stream;
  private final List<String> orderBy;
  private final JsonObject after;
  private final String cursorField;
  private final Object cursorLowerBound;
  private final int limit;

  public PageRequest(ConfiguredStream stream,
                     List<String> orderBy,
                     JsonObject after,
                     String cursorField,
                     Object cursorLowerBound,
                     int limit) {
    this.stream = Objects.requireNonNull(stream, "stream");
    this.orderBy = List.copyOf(orderBy);
    this.after = after == null ? null : after.copy();
    this.cursorField = cursorField;
    this.cursorLowerBound = cursorLowerBound;
    this.limit = limit;
    if (orderBy.isEmpty()) {
      throw new IllegalArgumentException("orderBy must not be empty");
    }
  }

  public ConfiguredStream stream() {
    return stream;
  }

  public List<String> orderBy() {
    return orderBy;
  }

  /**
   * Exclusive keyset lower bound over the order-by columns, {@code null} for the first page.
   */
  public JsonObject after() {
    return after == null ? null : after.copy();
  }

  public String cursorField() {
    return cursorField;
  }

  public Object cursorLowerBound() {
    return cursorLowerBound;
  }

  public int limit() {
    return limit;
  }
}
