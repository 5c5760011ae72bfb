package io.firewatch.client;

import com.google.firestore.v1.Document;
import com.google.firestore.v1.DocumentChange;
import com.google.firestore.v1.ListenResponse;
import com.google.firestore.v1.TargetChange;
import com.google.firestore.v1.Value;
import com.google.protobuf.ByteString;
import com.google.protobuf.Timestamp;
import com.google.protobuf.util.Timestamps;
import io.firewatch.model.ResourcePath;

/**
 * Wire responses used by the client tests.
 */
final class ListenResponsesFixtures {

  static final ResourcePath DATABASE = ResourcePath.forDatabase("test-project", "(default)");
  static final ResourcePath ROOMS = DATABASE.append("rooms");

  private ListenResponsesFixtures() {
  }

  static Timestamp time(long seconds) {
    return Timestamps.fromSeconds(seconds);
  }

  static ListenResponse targetChange(TargetChange.TargetChangeType type, int... targetIds) {
    TargetChange.Builder change = TargetChange.newBuilder().setTargetChangeType(type);
    for (int targetId : targetIds) {
      change.addTargetIds(targetId);
    }
    return ListenResponse.newBuilder().setTargetChange(change).build();
  }

  static ListenResponse globalNoChange(long readSeconds, ByteString resumeToken) {
    return ListenResponse.newBuilder()
        .setTargetChange(TargetChange.newBuilder()
            .setTargetChangeType(TargetChange.TargetChangeType.NO_CHANGE)
            .setReadTime(time(readSeconds))
            .setResumeToken(resumeToken))
        .build();
  }

  static Document document(String id, long updateSeconds) {
    return Document.newBuilder()
        .setName(ROOMS.append(id).name())
        .putFields("title", Value.newBuilder().setStringValue(id).build())
        .setCreateTime(time(1))
        .setUpdateTime(time(updateSeconds))
        .build();
  }

  static ListenResponse documentChange(Document document, int targetId) {
    return ListenResponse.newBuilder()
        .setDocumentChange(DocumentChange.newBuilder()
            .setDocument(document)
            .addTargetIds(targetId))
        .build();
  }
}
