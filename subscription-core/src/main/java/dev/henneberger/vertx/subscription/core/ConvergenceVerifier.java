package dev.henneberger.vertx.subscription.core;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polls a {@link ConvergenceCheck} until it holds or the time budget is spent.
 *
 * <p>Errors raised by the check count as "not yet" and are retried until the deadline. Polling
 * uses the fixed {@code pollInterval} unless an enabled backoff {@link RetryPolicy} is supplied.
 * With a backoff the first sleep is still {@code pollInterval}; the policy's multiplier, jitter and
 * {@code maxDelay} then grow it per attempt, and its own {@code initialDelay} is not used. Sleeps
 * never overshoot the deadline, so a timeout is reported no later than {@code timeout} plus one
 * poll.
 */
public final class ConvergenceVerifier {

  private static final Logger LOG = LoggerFactory.getLogger(ConvergenceVerifier.class);

  @FunctionalInterface
  interface Sleeper {
    void sleep(long millis) throws InterruptedException;
  }

  private final LongSupplier nanoClock;
  private final Sleeper sleeper;
  private final RetryPolicy backoff;

  public ConvergenceVerifier() {
    this(RetryPolicy.disabled());
  }

  public ConvergenceVerifier(RetryPolicy backoff) {
    this(System::nanoTime, Thread::sleep, backoff);
  }

  ConvergenceVerifier(LongSupplier nanoClock, Sleeper sleeper, RetryPolicy backoff) {
    this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.backoff = Objects.requireNonNull(backoff, "backoff").copy();
    this.backoff.validate();
  }

  public long waitUntil(ConvergenceCheck check, Duration timeout, Duration pollInterval) {
    return waitUntil(check, timeout, pollInterval, () -> false);
  }

  /**
   * @return number of polls it took to observe the condition
   * @throws ConvergenceTimeoutException if the condition was not observed in time
   * @throws CancellationException if {@code cancelled} turned true or the thread was interrupted
   */
  public long waitUntil(ConvergenceCheck check,
                        Duration timeout,
                        Duration pollInterval,
                        BooleanSupplier cancelled) {
    Objects.requireNonNull(check, "check");
    Objects.requireNonNull(cancelled, "cancelled");
    OptionValidation.requirePositive("timeout", timeout);
    OptionValidation.requirePositive("pollInterval", pollInterval);

    RetryPolicy cadence = cadence(pollInterval);
    long deadline = nanoClock.getAsLong() + timeout.toNanos();
    long attempt = 0;
    Throwable lastError = null;

    while (true) {
      if (cancelled.getAsBoolean()) {
        throw new CancellationException("wait for '" + check.describe() + "' cancelled");
      }

      attempt++;
      try {
        if (check.satisfied()) {
          LOG.debug("condition '{}' observed after {} polls", check.describe(), attempt);
          return attempt;
        }
        lastError = null;
      } catch (InterruptedException e) {
        throw interrupted(check, e);
      } catch (Exception e) {
        lastError = e;
        LOG.debug("poll {} of '{}' failed: {}", attempt, check.describe(), e.toString());
      }

      long remainingNanos = deadline - nanoClock.getAsLong();
      if (remainingNanos <= 0) {
        throw new ConvergenceTimeoutException(check.describe(), timeout, attempt, lastError);
      }

      long remainingMillis = TimeUnit.NANOSECONDS.toMillis(remainingNanos) + 1;
      try {
        sleeper.sleep(Math.min(Math.max(1L, cadence.computeDelayMillis(attempt)), remainingMillis));
      } catch (InterruptedException e) {
        throw interrupted(check, e);
      }
    }
  }

  private RetryPolicy cadence(Duration pollInterval) {
    if (!backoff.isEnabled()) {
      return RetryPolicy.fixedInterval(pollInterval);
    }
    Duration maxDelay = backoff.getMaxDelay().compareTo(pollInterval) < 0 ? pollInterval : backoff.getMaxDelay();
    return backoff.copy().setInitialDelay(pollInterval).setMaxDelay(maxDelay);
  }

  private static CancellationException interrupted(ConvergenceCheck check, InterruptedException e) {
    Thread.currentThread().interrupt();
    CancellationException cancelled = new CancellationException("wait for '" + check.describe() + "' interrupted");
    cancelled.initCause(e);
    return cancelled;
  }
}
