package io.firewatch.watch;

import static io.firewatch.watch.Watch.WATCH_TARGET_ID;

import com.google.common.collect.ImmutableList;
import com.google.firestore.v1.Document;
import com.google.firestore.v1.Value;
import com.google.protobuf.ByteString;
import com.google.protobuf.Timestamp;
import com.google.protobuf.util.Timestamps;
import io.firewatch.model.ResourcePath;

/**
 * Builders for the events and documents used by the watch tests.
 */
final class ListenEvents {

  static final ResourcePath ROOT = ResourcePath.forDatabase("test-project", "(default)");
  static final ResourcePath COLLECTION = ROOT.append("rooms");

  private ListenEvents() {
  }

  static Timestamp time(long seconds) {
    return Timestamps.fromSeconds(seconds);
  }

  static ByteString token(String value) {
    return ByteString.copyFromUtf8(value);
  }

  static String name(String id) {
    return COLLECTION.append(id).name();
  }

  static Document doc(String id, long updateSeconds, long n) {
    return Document.newBuilder()
        .setName(name(id))
        .putFields("n", Value.newBuilder().setIntegerValue(n).build())
        .setCreateTime(time(1))
        .setUpdateTime(time(updateSeconds))
        .build();
  }

  static ListenEvent add() {
    return ListenEvent.TargetChanged.create(TargetChangeType.ADD, ImmutableList.of(WATCH_TARGET_ID),
        ByteString.EMPTY, null, null);
  }

  static ListenEvent current() {
    return ListenEvent.TargetChanged.create(TargetChangeType.CURRENT, ImmutableList.of(WATCH_TARGET_ID),
        ByteString.EMPTY, null, null);
  }

  static ListenEvent current(long readSeconds) {
    return ListenEvent.TargetChanged.create(TargetChangeType.CURRENT, ImmutableList.of(WATCH_TARGET_ID),
        ByteString.EMPTY, null, time(readSeconds));
  }

  static ListenEvent noChange(long readSeconds) {
    return noChange(readSeconds, ByteString.EMPTY);
  }

  static ListenEvent noChange(long readSeconds, ByteString resumeToken) {
    return ListenEvent.TargetChanged.create(TargetChangeType.NO_CHANGE, ImmutableList.of(), resumeToken, null,
        time(readSeconds));
  }

  static ListenEvent reset() {
    return ListenEvent.TargetChanged.create(TargetChangeType.RESET, ImmutableList.of(WATCH_TARGET_ID),
        ByteString.EMPTY, null, null);
  }

  static ListenEvent change(Document document) {
    return ListenEvent.DocumentUpdated.create(document, ImmutableList.of(WATCH_TARGET_ID), ImmutableList.of());
  }

  static ListenEvent delete(String id) {
    return ListenEvent.DocumentDeleted.create(name(id), ImmutableList.of(WATCH_TARGET_ID), null);
  }

  static ListenEvent remove(String id) {
    return ListenEvent.DocumentRemoved.create(name(id), ImmutableList.of(WATCH_TARGET_ID), null);
  }

  static ListenEvent filter(int count) {
    return ListenEvent.ExistenceFilter.create(WATCH_TARGET_ID, count);
  }
}
