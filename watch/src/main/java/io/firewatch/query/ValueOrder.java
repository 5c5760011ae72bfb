package io.firewatch.query;

import com.google.firestore.v1.Value;
import com.google.protobuf.ByteString;
import com.google.protobuf.util.Timestamps;
import com.google.type.LatLng;
import io.firewatch.model.ResourcePath;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * {@code ValueOrder} is the total order the backend uses to sort query results. Values of different types order by
 * type: null, boolean, number, timestamp, string, bytes, reference, geo point, array, map. Integers and doubles are
 * compared numerically and NaN sorts before every other number.
 */
public final class ValueOrder implements Comparator<Value> {

  public static final ValueOrder INSTANCE = new ValueOrder();

  private enum TypeOrder {
    NULL,
    BOOLEAN,
    NUMBER,
    TIMESTAMP,
    STRING,
    BLOB,
    REFERENCE,
    GEO_POINT,
    ARRAY,
    OBJECT
  }

  private ValueOrder() {
  }

  @Override
  public int compare(Value left, Value right) {
    TypeOrder leftType = typeOrder(left);
    TypeOrder rightType = typeOrder(right);
    if (leftType != rightType) {
      return leftType.compareTo(rightType);
    }

    switch (leftType) {
      case NULL:
        return 0;
      case BOOLEAN:
        return Boolean.compare(left.getBooleanValue(), right.getBooleanValue());
      case NUMBER:
        return compareNumbers(left, right);
      case TIMESTAMP:
        return Timestamps.compare(left.getTimestampValue(), right.getTimestampValue());
      case STRING:
        return compareUtf8Strings(left.getStringValue(), right.getStringValue());
      case BLOB:
        return compareBytes(left.getBytesValue(), right.getBytesValue());
      case REFERENCE:
        return ResourcePath.parse(left.getReferenceValue()).compareTo(ResourcePath.parse(right.getReferenceValue()));
      case GEO_POINT:
        return compareGeoPoints(left.getGeoPointValue(), right.getGeoPointValue());
      case ARRAY:
        return compareArrays(left.getArrayValue().getValuesList(), right.getArrayValue().getValuesList());
      case OBJECT:
        return compareObjects(left.getMapValue().getFieldsMap(), right.getMapValue().getFieldsMap());
      default:
        throw new IllegalArgumentException("Cannot compare values of type " + leftType);
    }
  }

  private static TypeOrder typeOrder(Value value) {
    switch (value.getValueTypeCase()) {
      case NULL_VALUE:
        return TypeOrder.NULL;
      case BOOLEAN_VALUE:
        return TypeOrder.BOOLEAN;
      case INTEGER_VALUE:
      case DOUBLE_VALUE:
        return TypeOrder.NUMBER;
      case TIMESTAMP_VALUE:
        return TypeOrder.TIMESTAMP;
      case STRING_VALUE:
        return TypeOrder.STRING;
      case BYTES_VALUE:
        return TypeOrder.BLOB;
      case REFERENCE_VALUE:
        return TypeOrder.REFERENCE;
      case GEO_POINT_VALUE:
        return TypeOrder.GEO_POINT;
      case ARRAY_VALUE:
        return TypeOrder.ARRAY;
      case MAP_VALUE:
        return TypeOrder.OBJECT;
      default:
        throw new IllegalArgumentException("Unexpected value type: " + value.getValueTypeCase());
    }
  }

  private static int compareNumbers(Value left, Value right) {
    if (left.getValueTypeCase() == Value.ValueTypeCase.INTEGER_VALUE
        && right.getValueTypeCase() == Value.ValueTypeCase.INTEGER_VALUE) {
      return Long.compare(left.getIntegerValue(), right.getIntegerValue());
    }
    double leftDouble = asDouble(left);
    double rightDouble = asDouble(right);
    if (leftDouble < rightDouble) {
      return -1;
    }
    if (leftDouble > rightDouble) {
      return 1;
    }
    if (leftDouble == rightDouble) {
      return 0;
    }
    // at least one side is NaN
    if (Double.isNaN(leftDouble)) {
      return Double.isNaN(rightDouble) ? 0 : -1;
    }
    return 1;
  }

  private static double asDouble(Value value) {
    return value.getValueTypeCase() == Value.ValueTypeCase.INTEGER_VALUE
        ? (double) value.getIntegerValue()
        : value.getDoubleValue();
  }

  private static int compareBytes(ByteString left, ByteString right) {
    return ByteString.unsignedLexicographicalComparator().compare(left, right);
  }

  private static int compareGeoPoints(LatLng left, LatLng right) {
    int comparison = Double.compare(left.getLatitude(), right.getLatitude());
    return comparison != 0 ? comparison : Double.compare(left.getLongitude(), right.getLongitude());
  }

  private int compareArrays(List<Value> left, List<Value> right) {
    int length = Math.min(left.size(), right.size());
    for (int i = 0; i < length; i++) {
      int comparison = compare(left.get(i), right.get(i));
      if (comparison != 0) {
        return comparison;
      }
    }
    return Integer.compare(left.size(), right.size());
  }

  private int compareObjects(Map<String, Value> left, Map<String, Value> right) {
    List<String> leftKeys = sortedKeys(left);
    List<String> rightKeys = sortedKeys(right);
    int length = Math.min(leftKeys.size(), rightKeys.size());
    for (int i = 0; i < length; i++) {
      int comparison = compareUtf8Strings(leftKeys.get(i), rightKeys.get(i));
      if (comparison != 0) {
        return comparison;
      }
      comparison = compare(left.get(leftKeys.get(i)), right.get(rightKeys.get(i)));
      if (comparison != 0) {
        return comparison;
      }
    }
    return Integer.compare(leftKeys.size(), rightKeys.size());
  }

  private static List<String> sortedKeys(Map<String, Value> fields) {
    List<String> keys = new ArrayList<>(fields.keySet());
    Collections.sort(keys, ValueOrder::compareUtf8Strings);
    return keys;
  }

  /**
   * Compares two strings by their UTF-8 encoding without encoding them. Surrogate pairs encode code points above
   * U+FFFF, which take four bytes in UTF-8 and therefore sort after every other character.
   */
  static int compareUtf8Strings(String left, String right) {
    int length = Math.min(left.length(), right.length());
    for (int i = 0; i < length; i++) {
      char leftChar = left.charAt(i);
      char rightChar = right.charAt(i);
      if (leftChar != rightChar) {
        boolean leftSurrogate = Character.isSurrogate(leftChar);
        if (leftSurrogate == Character.isSurrogate(rightChar)) {
          return Character.compare(leftChar, rightChar);
        }
        return leftSurrogate ? 1 : -1;
      }
    }
    return Integer.compare(left.length(), right.length());
  }
}
