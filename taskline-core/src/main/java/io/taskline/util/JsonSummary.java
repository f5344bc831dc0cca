package io.taskline.util;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the small flat JSON objects stored as job results, e.g.
 * {@code {"refreshed":3,"failed":1}}. Keys keep insertion order.
 */
public final class JsonSummary {
  private final Map<String, Object> fields = new LinkedHashMap<>();

  public JsonSummary put(String key, long value) {
    fields.put(key, value);
    return this;
  }

  public JsonSummary put(String key, String value) {
    fields.put(key, value);
    return this;
  }

  public String toJson() {
    StringBuilder sb = new StringBuilder("{");
    boolean first = true;
    for (Map.Entry<String, Object> entry : fields.entrySet()) {
      if (!first) {
        sb.append(',');
      }
      first = false;
      sb.append('"').append(escape(entry.getKey())).append("\":");
      Object value = entry.getValue();
      if (value == null) {
        sb.append("null");
      } else if (value instanceof Long n) {
        sb.append(n.longValue());
      } else {
        sb.append('"').append(escape(value.toString())).append('"');
      }
    }
    return sb.append('}').toString();
  }

  @Override
  public String toString() {
    return toJson();
  }

  static String escape(String value) {
    StringBuilder sb = new StringBuilder(value.length());
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        default -> {
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
        }
      }
    }
    return sb.toString();
  }
}
