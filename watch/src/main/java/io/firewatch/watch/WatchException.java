package io.firewatch.watch;

import io.grpc.Metadata;
import io.grpc.Status;
import io.grpc.StatusException;
import javax.annotation.Nullable;

/**
 * {@code WatchException} is the terminal error of a watch.
 */
public class WatchException extends StatusException {

  public WatchException(Status status) {
    this(status, null);
  }

  public WatchException(Status status, @Nullable Metadata trailers) {
    super(status, trailers);
  }

  /**
   * Wraps the given error, keeping its gRPC status if it has one.
   */
  public static WatchException fromThrowable(Throwable error) {
    if (error instanceof WatchException) {
      return (WatchException) error;
    }
    return new WatchException(Status.fromThrowable(error), Status.trailersFromThrowable(error));
  }
}
