/*
 * Copyright (C) 2026 Daniel Henneberger
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.henneberger.vertx.pg.subscription;

import dev.henneberger.vertx.subscription.core.ConvergenceCheck;
import dev.henneberger.vertx.subscription.core.ConvergenceVerifier;
import dev.henneberger.vertx.subscription.core.ListenerRegistration;
import dev.henneberger.vertx.subscription.core.PreflightFailedException;
import dev.henneberger.vertx.subscription.core.PreflightReport;
import dev.henneberger.vertx.subscription.core.PreflightReports;
import dev.henneberger.vertx.subscription.core.RetryPolicy;
import dev.henneberger.vertx.subscription.core.StateConflictException;
import dev.henneberger.vertx.subscription.core.SubscriptionPhaseChange;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asynchronous entry point for managing logical replication subscriptions.
 *
 * <p>Every operation runs on a Vert.x worker thread and completes its future with the observed
 * state. Operations that detect a concurrent modification are retried as a whole according to
 * {@link SubscriptionManagerOptions#getConflictRetryPolicy()}. Waits are bounded by
 * {@link SubscriptionManagerOptions#getConvergenceTimeout()} and cancelled by {@link #close()}.
 */
public class PostgresSubscriptionManager implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(PostgresSubscriptionManager.class);

  private final Vertx vertx;
  private final SubscriptionManagerOptions options;
  private final SubscriptionLifecycleController controller;
  private final ReplicationOriginReconciler reconciler;
  private final SubscriptionConditions conditions;
  private final SubscriptionPreflight preflight;
  private final ConvergenceVerifier verifier;
  private final List<Handler<SubscriptionPhaseChange>> phaseHandlers = new CopyOnWriteArrayList<>();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  public PostgresSubscriptionManager(Vertx vertx, SubscriptionManagerOptions options) {
    this(vertx, options, new JdbcConnectionGateway(validated(options)));
  }

  PostgresSubscriptionManager(Vertx vertx, SubscriptionManagerOptions options, ConnectionGateway gateway) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.options = new SubscriptionManagerOptions(Objects.requireNonNull(options, "options"));
    this.options.validate();
    Objects.requireNonNull(gateway, "gateway");
    this.reconciler = new ReplicationOriginReconciler(gateway);
    this.controller = new SubscriptionLifecycleController(gateway, new SubscriptionStateReader(gateway),
      reconciler, this.options.isSweepOrphansOnDrop());
    this.conditions = new SubscriptionConditions(gateway);
    this.preflight = new SubscriptionPreflight(gateway);
    this.verifier = new ConvergenceVerifier(this.options.getPollBackoff());
    this.controller.onPhaseChange(this::dispatchPhaseChange);
  }

  public SubscriptionManagerOptions options() {
    return new SubscriptionManagerOptions(options);
  }

  /**
   * Handlers run on a Vert.x context after the operation that caused the change has committed.
   */
  public ListenerRegistration onPhaseChange(Handler<SubscriptionPhaseChange> handler) {
    Handler<SubscriptionPhaseChange> resolved = Objects.requireNonNull(handler, "handler");
    phaseHandlers.add(resolved);
    return () -> phaseHandlers.remove(resolved);
  }

  public Future<SubscriptionState> create(SubscriptionSpec spec) {
    SubscriptionSpec copy = new SubscriptionSpec(Objects.requireNonNull(spec, "spec"));
    return blocking(() -> {
      if (options.isPreflightEnabled()) {
        SubscriptionTransitions.checkCreate(copy);
        copy.validate();
        PreflightReport report = preflight.run(copy.getDatabase());
        if (!report.ok()) {
          throw new PreflightFailedException(copy.getName(), copy.getDatabase(), report);
        }
        if (!report.issues().isEmpty()) {
          LOG.warn("Preflight for subscription {} in {} passed with warnings: {}",
            copy.getName(), copy.getDatabase(), PreflightReports.describe(report));
        }
      }
      return controller.create(copy);
    });
  }

  public Future<SubscriptionState> setEnabled(String database, String name, boolean enabled) {
    return setEnabled(database, name, enabled, null);
  }

  /**
   * @param startLsn start position applied on the disabled to enabled edge only, or {@code null}
   */
  public Future<SubscriptionState> setEnabled(String database, String name, boolean enabled, Lsn startLsn) {
    return blocking(() -> controller.setEnabled(database, name, enabled, startLsn));
  }

  public Future<SubscriptionState> update(SubscriptionSpec spec) {
    SubscriptionSpec copy = new SubscriptionSpec(Objects.requireNonNull(spec, "spec"));
    return blocking(() -> controller.update(copy));
  }

  public Future<Void> drop(String database, String name, boolean dropSlot) {
    return blocking(() -> {
      controller.drop(database, name, dropSlot);
      return null;
    });
  }

  public Future<SubscriptionState> read(String database, String name) {
    return vertx.executeBlocking(() -> controller.read(database, name));
  }

  public Future<Boolean> verifyOriginExists(String database, String name) {
    return vertx.executeBlocking(() -> reconciler.verifyOriginExists(database, name));
  }

  /**
   * Sweeps orphaned subscription origins cluster-wide through the admin database.
   */
  public Future<OriginSweepReport> sweepOrphans() {
    return sweepOrphans(options.getAdminDatabase());
  }

  public Future<OriginSweepReport> sweepOrphans(String database) {
    return vertx.executeBlocking(() -> reconciler.sweepOrphans(database));
  }

  public Future<PreflightReport> preflight(String database) {
    return vertx.executeBlocking(() -> preflight.run(database));
  }

  public Future<Lsn> currentWalLsn(String database) {
    return vertx.executeBlocking(() -> controller.currentWalLsn(database));
  }

  public Future<Long> awaitEnabled(String database, String name, boolean enabled) {
    return await(conditions.enabledEquals(database, name, enabled));
  }

  public Future<Long> awaitAbsent(String database, String name) {
    return await(conditions.subscriptionAbsent(database, name));
  }

  public Future<Long> awaitOriginAbsent(String database, String originName) {
    return await(conditions.originAbsent(database, originName));
  }

  public Future<Long> awaitRowCount(String database, String table, long expected) {
    return await(conditions.rowCountEquals(database, table, expected));
  }

  public Future<Long> awaitRowCount(String database, String table, String column, String value, long expected) {
    return await(conditions.rowCountEquals(database, table, column, value, expected));
  }

  public Future<Long> await(ConvergenceCheck check) {
    return await(check, options.getConvergenceTimeout());
  }

  /**
   * Polls {@code check} until it holds. The future fails with a
   * {@link dev.henneberger.vertx.subscription.core.ConvergenceTimeoutException} when the timeout is
   * spent, or a {@link java.util.concurrent.CancellationException} when the manager is closed.
   *
   * @return number of polls it took
   */
  public Future<Long> await(ConvergenceCheck check, Duration timeout) {
    Objects.requireNonNull(check, "check");
    Objects.requireNonNull(timeout, "timeout");
    return vertx.executeBlocking(
      () -> verifier.waitUntil(check, timeout, options.getPollInterval(), closed::get), false);
  }

  public SubscriptionConditions conditions() {
    return conditions;
  }

  /**
   * Cancels outstanding waits. Lifecycle operations already running finish normally.
   */
  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      phaseHandlers.clear();
    }
  }

  private <T> Future<T> blocking(Supplier<T> operation) {
    if (closed.get()) {
      return Future.failedFuture(new IllegalStateException("subscription manager is closed"));
    }
    return vertx.executeBlocking(() -> withConflictRetry(operation));
  }

  private <T> T withConflictRetry(Supplier<T> operation) throws InterruptedException {
    RetryPolicy policy = options.getConflictRetryPolicy();
    long attempt = 0;
    while (true) {
      try {
        return operation.get();
      } catch (StateConflictException e) {
        attempt++;
        if (!policy.shouldRetry(e, attempt)) {
          throw e;
        }
        long delay = policy.computeDelayMillis(attempt);
        LOG.info("Retrying operation on subscription {} after a concurrent change (attempt {}, delay {}ms): {}",
          e.subscriptionName(), attempt, delay, e.getMessage());
        if (delay > 0) {
          Thread.sleep(delay);
        }
      }
    }
  }

  private void dispatchPhaseChange(SubscriptionPhaseChange change) {
    for (Handler<SubscriptionPhaseChange> handler : phaseHandlers) {
      vertx.runOnContext(v -> handler.handle(change));
    }
  }

  private static SubscriptionManagerOptions validated(SubscriptionManagerOptions options) {
    Objects.requireNonNull(options, "options").validate();
    return options;
  }
}
