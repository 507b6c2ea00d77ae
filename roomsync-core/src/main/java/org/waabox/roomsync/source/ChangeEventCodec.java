package org.waabox.roomsync.source;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Static utility class for serializing and deserializing
 * {@link ChangeEvent} instances to and from JSON strings.
 *
 * <p>Uses Jackson's tree model ({@link JsonNode}). The wire format is
 * <pre>
 * {"eventType":"INSERT","table":"bookings","before":null,"after":{...}}
 * </pre>
 * where rows are flat objects keyed by snake_case column names. Instants
 * travel as ISO-8601 strings and are parsed lazily by {@link Row}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ChangeEventCodec {

  /** Shared ObjectMapper for tree model operations. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Private constructor to prevent instantiation. */
  private ChangeEventCodec() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Serializes a {@link ChangeEvent} into a JSON string.
   *
   * @param event the event to serialize, never null.
   * @return the JSON representation of the event, never null.
   */
  public static String serialize(final ChangeEvent event) {
    Objects.requireNonNull(event, "event cannot be null");

    final ObjectNode node = MAPPER.createObjectNode();
    node.put("eventType", event.eventType().name());
    node.put("table", event.table().tableName());
    writeRow(node, "before", event.before());
    writeRow(node, "after", event.after());

    return node.toString();
  }

  /**
   * Deserializes a JSON string into a {@link ChangeEvent}.
   *
   * @param json the JSON string to parse, never null.
   * @return the parsed {@link ChangeEvent}, never null.
   * @throws IllegalArgumentException if the JSON is malformed, misses
   *     required fields or names an unknown table or event type.
   */
  public static ChangeEvent deserialize(final String json) {
    Objects.requireNonNull(json, "json cannot be null");

    try {
      final JsonNode node = MAPPER.readTree(json);

      final ChangeType eventType = ChangeType.valueOf(
          requireField(node, "eventType").asText().toUpperCase());
      final Table table = Table.fromName(requireField(node, "table").asText());
      final Row before = readRow(node.get("before"));
      final Row after = readRow(node.get("after"));

      return new ChangeEvent(eventType, table, before, after);
    } catch (final IllegalArgumentException e) {
      throw e;
    } catch (final Exception e) {
      throw new IllegalArgumentException(
          "Failed to deserialize ChangeEvent from JSON: " + json, e);
    }
  }

  private static void writeRow(final ObjectNode parent, final String field,
      final Row row) {
    if (row == null) {
      parent.putNull(field);
      return;
    }
    final ObjectNode node = parent.putObject(field);
    for (Map.Entry<String, Object> column : row.asMap().entrySet()) {
      final Object value = column.getValue();
      if (value instanceof Boolean) {
        node.put(column.getKey(), (Boolean) value);
      } else if (value instanceof Integer || value instanceof Long) {
        node.put(column.getKey(), ((Number) value).longValue());
      } else if (value instanceof Number) {
        node.put(column.getKey(), ((Number) value).doubleValue());
      } else {
        node.put(column.getKey(), value.toString());
      }
    }
  }

  private static Row readRow(final JsonNode node) {
    if (node == null || node.isNull()) {
      return null;
    }
    if (!node.isObject()) {
      throw new IllegalArgumentException("Row must be a JSON object: " + node);
    }
    final Map<String, Object> columns = new LinkedHashMap<>();
    final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      final Map.Entry<String, JsonNode> field = fields.next();
      final JsonNode value = field.getValue();
      if (value.isNull()) {
        continue;
      }
      if (value.isBoolean()) {
        columns.put(field.getKey(), value.booleanValue());
      } else if (value.isIntegralNumber()) {
        columns.put(field.getKey(), value.longValue());
      } else if (value.isNumber()) {
        columns.put(field.getKey(), value.doubleValue());
      } else {
        columns.put(field.getKey(), value.asText());
      }
    }
    return Row.of(columns);
  }

  /** Returns the field node for the given key or throws if missing.
   *
   * @param node the parent JSON node.
   * @param field the field name to look up.
   * @return the field node, never null.
   * @throws IllegalArgumentException if the field is missing.
   */
  private static JsonNode requireField(final JsonNode node,
      final String field) {
    final JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      throw new IllegalArgumentException(
          "Missing field: " + field + " in JSON: " + node);
    }
    return value;
  }
}
