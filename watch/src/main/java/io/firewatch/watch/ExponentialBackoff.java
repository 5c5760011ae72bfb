package io.firewatch.watch;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * {@code ExponentialBackoff} computes the delays between reconnect attempts. The first attempt after a reset is
 * immediate; the base delay then starts at the initial delay and grows by the backoff factor up to the maximum
 * delay. Each delay is spread around its base value by the jitter factor.
 *
 * <p>Instances are not thread safe.
 */
public class ExponentialBackoff {

  private final long initialDelayMillis;
  private final long maxDelayMillis;
  private final double backoffFactor;
  private final double jitterFactor;
  private final DoubleSupplier random;

  private long currentBaseMillis;

  public ExponentialBackoff(BackoffSettings settings) {
    this(settings, () -> ThreadLocalRandom.current().nextDouble());
  }

  /**
   * Creates a backoff.
   *
   * @param settings the backoff settings
   * @param random   supplies values in {@code [0, 1)} used to compute the jitter
   */
  public ExponentialBackoff(BackoffSettings settings, DoubleSupplier random) {
    checkNotNull(settings, "settings");
    this.initialDelayMillis = settings.initialDelay().toMillis();
    this.maxDelayMillis = settings.maxDelay().toMillis();
    this.backoffFactor = settings.backoffFactor();
    this.jitterFactor = settings.jitterFactor();
    this.random = checkNotNull(random, "random");
  }

  /**
   * Returns the delay to wait before the next attempt and advances the base delay.
   */
  public long nextDelayMillis() {
    long delay = currentBaseMillis + jitterMillis();

    long nextBase = (long) (currentBaseMillis * backoffFactor);
    currentBaseMillis = Math.min(Math.max(nextBase, initialDelayMillis), maxDelayMillis);

    return Math.max(0L, delay);
  }

  /**
   * Makes the next attempt immediate. Called once the stream has made progress.
   */
  public void reset() {
    currentBaseMillis = 0;
  }

  /**
   * Makes the next attempt wait for the maximum delay. Called when the backend reports that it is overloaded.
   */
  public void resetToMax() {
    currentBaseMillis = maxDelayMillis;
  }

  long currentBaseMillis() {
    return currentBaseMillis;
  }

  private long jitterMillis() {
    return (long) ((random.getAsDouble() - 0.5) * jitterFactor * currentBaseMillis);
  }
}
