package dev.henneberger.vertx.subscription.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class ConvergenceVerifierTest {

  private final FakeClock clock = new FakeClock();
  private final ConvergenceVerifier verifier =
    new ConvergenceVerifier(clock::nanoTime, clock::sleep, RetryPolicy.disabled());

  @Test
  void returnsImmediatelyWithoutSleepingWhenAlreadySatisfied() {
    long polls = verifier.waitUntil(() -> true, Duration.ofSeconds(5), Duration.ofMillis(200));

    assertEquals(1L, polls);
    assertTrue(clock.sleeps.isEmpty());
  }

  @Test
  void pollsAtFixedIntervalUntilSatisfied() {
    AtomicInteger calls = new AtomicInteger();

    long polls = verifier.waitUntil(() -> calls.incrementAndGet() == 3,
      Duration.ofSeconds(5), Duration.ofMillis(200));

    assertEquals(3L, polls);
    assertEquals(List.of(200L, 200L), clock.sleeps);
  }

  @Test
  void timesOutNoLaterThanTimeoutPlusOnePollInterval() {
    Duration timeout = Duration.ofMillis(1000);
    Duration pollInterval = Duration.ofMillis(300);

    ConvergenceTimeoutException error = assertThrows(ConvergenceTimeoutException.class,
      () -> verifier.waitUntil(ConvergenceCheck.named("never", () -> false), timeout, pollInterval));

    assertEquals("never", error.condition());
    assertTrue(clock.elapsedMillis() >= timeout.toMillis());
    assertTrue(clock.elapsedMillis() <= timeout.toMillis() + pollInterval.toMillis());
  }

  @Test
  void treatsQueryErrorsAsRetryable() {
    AtomicInteger calls = new AtomicInteger();

    long polls = verifier.waitUntil(() -> {
      if (calls.incrementAndGet() < 3) {
        throw new SQLException("connection reset", "08006");
      }
      return true;
    }, Duration.ofSeconds(5), Duration.ofMillis(100));

    assertEquals(3L, polls);
  }

  @Test
  void attachesLastErrorToTimeout() {
    SQLException failure = new SQLException("connection refused", "08001");

    ConvergenceTimeoutException error = assertThrows(ConvergenceTimeoutException.class,
      () -> verifier.waitUntil(() -> {
        throw failure;
      }, Duration.ofMillis(500), Duration.ofMillis(100)));

    assertSame(failure, error.getCause());
  }

  @Test
  void stopsWhenCancelled() {
    AtomicInteger calls = new AtomicInteger();

    assertThrows(CancellationException.class, () -> verifier.waitUntil(() -> false,
      Duration.ofSeconds(10), Duration.ofMillis(100), () -> calls.incrementAndGet() > 2));
  }

  @Test
  void backoffPolicyGrowsDelay() {
    ConvergenceVerifier backingOff = new ConvergenceVerifier(clock::nanoTime, clock::sleep,
      RetryPolicy.exponentialBackoff()
        .setInitialDelay(Duration.ofMillis(100))
        .setMaxDelay(Duration.ofMillis(400))
        .setJitter(0.0d));
    AtomicInteger calls = new AtomicInteger();

    backingOff.waitUntil(() -> calls.incrementAndGet() == 4, Duration.ofSeconds(10), Duration.ofMillis(100));

    assertEquals(List.of(100L, 200L, 400L), clock.sleeps);
  }

  @Test
  void backoffStartsFromCallerPollInterval() {
    ConvergenceVerifier backingOff = new ConvergenceVerifier(clock::nanoTime, clock::sleep,
      RetryPolicy.exponentialBackoff()
        .setInitialDelay(Duration.ofSeconds(2))
        .setMaxDelay(Duration.ofMillis(300))
        .setJitter(0.0d));
    AtomicInteger calls = new AtomicInteger();

    backingOff.waitUntil(() -> calls.incrementAndGet() == 5, Duration.ofSeconds(10), Duration.ofMillis(50));

    assertEquals(List.of(50L, 100L, 200L, 300L), clock.sleeps);
  }

  private static final class FakeClock {
    private long nanos = TimeUnit.SECONDS.toNanos(42);
    private final long start = nanos;
    private final List<Long> sleeps = new ArrayList<>();

    long nanoTime() {
      return nanos;
    }

    void sleep(long millis) {
      sleeps.add(millis);
      nanos += TimeUnit.MILLISECONDS.toNanos(millis);
    }

    long elapsedMillis() {
      return TimeUnit.NANOSECONDS.toMillis(nanos - start);
    }
  }
}
