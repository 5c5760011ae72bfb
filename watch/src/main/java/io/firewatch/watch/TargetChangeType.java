package io.firewatch.watch;

/**
 * The kind of transition a {@link ListenEvent.TargetChanged} event describes.
 */
public enum TargetChangeType {
  NO_CHANGE,
  ADD,
  REMOVE,
  CURRENT,
  RESET
}
