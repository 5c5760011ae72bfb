package io.firewatch.watch;

import com.google.firestore.v1.Document;
import com.google.firestore.v1.Value;
import com.google.protobuf.Timestamp;
import io.firewatch.model.DocumentSnapshot;
import io.firewatch.model.ResourcePath;
import java.util.Map;

/**
 * Default {@link DocumentDecoder}. It keeps the wire values as they are after checking that the document name is
 * valid and that every value, including nested ones, has a type.
 */
public class ProtoDocumentDecoder implements DocumentDecoder {

  @Override
  public DocumentSnapshot decode(Document document, Timestamp readTime) throws DocumentDecodeException {
    ResourcePath path = parsePath(document.getName());
    if (!path.isDocument()) {
      throw new DocumentDecodeException("'" + document.getName() + "' is not a document name");
    }
    if (!document.hasCreateTime() || !document.hasUpdateTime()) {
      throw new DocumentDecodeException("Document " + document.getName() + " has no create or update time");
    }

    for (Map.Entry<String, Value> field : document.getFieldsMap().entrySet()) {
      checkValue(document.getName(), field.getKey(), field.getValue());
    }

    return DocumentSnapshot.create(path, document.getFieldsMap(), document.getCreateTime(),
        document.getUpdateTime(), readTime);
  }

  private static ResourcePath parsePath(String name) throws DocumentDecodeException {
    try {
      return ResourcePath.parse(name);
    } catch (IllegalArgumentException e) {
      throw new DocumentDecodeException("Invalid document name '" + name + "'", e);
    }
  }

  private static void checkValue(String documentName, String field, Value value) throws DocumentDecodeException {
    switch (value.getValueTypeCase()) {
      case VALUETYPE_NOT_SET:
        throw new DocumentDecodeException(
            "Field '" + field + "' of document " + documentName + " has a value of unknown type");
      case ARRAY_VALUE:
        for (Value element : value.getArrayValue().getValuesList()) {
          checkValue(documentName, field, element);
        }
        break;
      case MAP_VALUE:
        for (Map.Entry<String, Value> entry : value.getMapValue().getFieldsMap().entrySet()) {
          checkValue(documentName, field + "." + entry.getKey(), entry.getValue());
        }
        break;
      case REFERENCE_VALUE:
        parsePath(value.getReferenceValue());
        break;
      default:
        break;
    }
  }
}
