package io.firewatch.model;

import com.google.firestore.v1.Value;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts wire values into plain Java objects.
 *
 * <p>Mapping: null to {@code null}, booleans to {@link Boolean}, integers to {@link Long}, doubles to
 * {@link Double}, strings and references to {@link String}, timestamps to {@link com.google.protobuf.Timestamp},
 * bytes to {@link com.google.protobuf.ByteString}, geo points to {@link com.google.type.LatLng}, arrays to
 * {@link List} and maps to {@link Map}.
 */
public final class Values {

  private Values() {
  }

  /**
   * Converts a single value.
   *
   * @throws IllegalArgumentException if the value type is not set or not supported
   */
  public static Object toJava(Value value) {
    switch (value.getValueTypeCase()) {
      case NULL_VALUE:
        return null;
      case BOOLEAN_VALUE:
        return value.getBooleanValue();
      case INTEGER_VALUE:
        return value.getIntegerValue();
      case DOUBLE_VALUE:
        return value.getDoubleValue();
      case TIMESTAMP_VALUE:
        return value.getTimestampValue();
      case STRING_VALUE:
        return value.getStringValue();
      case BYTES_VALUE:
        return value.getBytesValue();
      case REFERENCE_VALUE:
        return value.getReferenceValue();
      case GEO_POINT_VALUE:
        return value.getGeoPointValue();
      case ARRAY_VALUE:
        List<Object> list = new ArrayList<>(value.getArrayValue().getValuesCount());
        for (Value element : value.getArrayValue().getValuesList()) {
          list.add(toJava(element));
        }
        return Collections.unmodifiableList(list);
      case MAP_VALUE:
        return toJava(value.getMapValue().getFieldsMap());
      default:
        throw new IllegalArgumentException("Unsupported value type: " + value.getValueTypeCase());
    }
  }

  /**
   * Converts a field map, preserving null values.
   */
  public static Map<String, Object> toJava(Map<String, Value> fields) {
    Map<String, Object> result = new LinkedHashMap<>();
    fields.forEach((key, value) -> result.put(key, toJava(value)));
    return Collections.unmodifiableMap(result);
  }
}
