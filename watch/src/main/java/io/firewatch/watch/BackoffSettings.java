package io.firewatch.watch;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import java.time.Duration;

/**
 * {@code BackoffSettings} controls the delay between attempts to reopen a listen stream.
 */
@AutoValue
public abstract class BackoffSettings {

  public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(1);
  public static final double DEFAULT_BACKOFF_FACTOR = 1.5;
  public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(60);
  public static final double DEFAULT_JITTER_FACTOR = 1.0;

  /**
   * Returns a builder initialized with the default settings.
   */
  public static Builder builder() {
    return new AutoValue_BackoffSettings.Builder()
        .initialDelay(DEFAULT_INITIAL_DELAY)
        .backoffFactor(DEFAULT_BACKOFF_FACTOR)
        .maxDelay(DEFAULT_MAX_DELAY)
        .jitterFactor(DEFAULT_JITTER_FACTOR);
  }

  public static BackoffSettings defaults() {
    return builder().build();
  }

  /**
   * Returns the delay before the second attempt. The first attempt after a reset is never delayed.
   */
  public abstract Duration initialDelay();

  /**
   * Returns the factor the delay grows by after each attempt.
   */
  public abstract double backoffFactor();

  /**
   * Returns the upper bound of the delay, before jitter is applied.
   */
  public abstract Duration maxDelay();

  /**
   * Returns how much the delay is randomized. A factor of 1.0 spreads the delay over +/- 50% of its base value.
   */
  public abstract double jitterFactor();

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {

    public abstract Builder initialDelay(Duration initialDelay);

    public abstract Builder backoffFactor(double backoffFactor);

    public abstract Builder maxDelay(Duration maxDelay);

    public abstract Builder jitterFactor(double jitterFactor);

    abstract BackoffSettings autoBuild();

    /**
     * Builds the settings.
     *
     * @throws IllegalArgumentException if the settings are inconsistent
     */
    public BackoffSettings build() {
      BackoffSettings settings = autoBuild();
      checkArgument(!settings.initialDelay().isNegative(), "initialDelay cannot be negative");
      checkArgument(settings.maxDelay().compareTo(settings.initialDelay()) >= 0,
          "maxDelay must not be shorter than initialDelay");
      checkArgument(settings.backoffFactor() >= 1.0, "backoffFactor must be at least 1.0");
      checkArgument(settings.jitterFactor() >= 0.0 && settings.jitterFactor() <= 1.0,
          "jitterFactor must be between 0.0 and 1.0");
      return settings;
    }
  }
}
