package dev.henneberger.vertx.subscription.core;

import java.time.Duration;

/**
 * The awaited condition was not observed within the time budget. This is not a failure of the
 * condition itself; callers decide whether to wait longer.
 */
public final class ConvergenceTimeoutException extends SubscriptionException {

  private final String condition;
  private final Duration timeout;
  private final long attempts;

  public ConvergenceTimeoutException(String condition, Duration timeout, long attempts, Throwable lastError) {
    super(null,
      "condition '" + condition + "' not observed within " + timeout.toMillis() + "ms after " + attempts + " polls"
        + (lastError == null ? "" : " (last error: " + lastError.getMessage() + ")"),
      lastError);
    this.condition = condition;
    this.timeout = timeout;
    this.attempts = attempts;
  }

  public String condition() {
    return condition;
  }

  public Duration timeout() {
    return timeout;
  }

  public long attempts() {
    return attempts;
  }
}
