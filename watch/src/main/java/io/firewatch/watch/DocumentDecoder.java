package io.firewatch.watch;

import com.google.firestore.v1.Document;
import com.google.protobuf.Timestamp;
import io.firewatch.model.DocumentSnapshot;

/**
 * {@code DocumentDecoder} turns wire documents into snapshots.
 */
public interface DocumentDecoder {

  /**
   * Decodes a document.
   *
   * @param document the document as received from the backend
   * @param readTime the read time of the snapshot the document belongs to
   * @return an immutable snapshot of the document
   * @throws DocumentDecodeException if the document contains data that cannot be interpreted
   */
  DocumentSnapshot decode(Document document, Timestamp readTime) throws DocumentDecodeException;
}
