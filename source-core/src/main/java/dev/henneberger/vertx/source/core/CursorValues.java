package dev.henneberger.vertx.source.core;

import io.vertx.core.json.JsonObject;
import java.math.BigDecimal;
import java.util.Iterator;
import java.util.Map;

/**
 * Ordering over the JSON-compatible values used as cursors and sort keys.
 */
public final class CursorValues {

  private CursorValues() {
  }

  /**
   * Compares two cursor values. {@code null} sorts first, numbers compare numerically and
   * everything else compares by its string form (ISO-8601 dates and timestamps sort correctly).
   */
  public static int compare(Object a, Object b) {
    if (a == b) {
      return 0;
    }
    if (a == null) {
      return -1;
    }
    if (b == null) {
      return 1;
    }
    if (a instanceof Number && b instanceof Number) {
      return toBigDecimal((Number) a).compareTo(toBigDecimal((Number) b));
    }
    if (a instanceof Boolean && b instanceof Boolean) {
      return Boolean.compare((Boolean) a, (Boolean) b);
    }
    return String.valueOf(a).compareTo(String.valueOf(b));
  }

  public static Object max(Object a, Object b) {
    return compare(a, b) >= 0 ? a : b;
  }

  /**
   * Compares two composite keys field by field in the iteration order of {@code a}.
   */
  public static int compareKeys(JsonObject a, JsonObject b) {
    if (a == null || b == null) {
      return a == null ? (b == null ? 0 : -1) : 1;
    }
    Iterator<Map.Entry<String, Object>> it = a.iterator();
    while (it.hasNext()) {
      Map.Entry<String, Object> entry = it.next();
      int cmp = compare(entry.getValue(), b.getValue(entry.getKey()));
      if (cmp != 0) {
        return cmp;
      }
    }
    return 0;
  }

  private static BigDecimal toBigDecimal(Number number) {
    if (number instanceof BigDecimal) {
      return (BigDecimal) number;
    }
    if (number instanceof Double || number instanceof Float) {
      return BigDecimal.valueOf(number.doubleValue());
    }
    return new BigDecimal(number.toString());
  }
}
