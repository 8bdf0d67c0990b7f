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
import java.util.List;
import java.util.Objects;

/**
 * Ready-made {@link ConvergenceCheck}s over subscription and replicated table state. Every poll
 * opens its own session so no snapshot outlives a single observation.
 */
public final class SubscriptionConditions {

  private final ConnectionGateway gateway;
  private final SubscriptionStateReader reader;
  private final ReplicationOriginReconciler reconciler;

  public SubscriptionConditions(ConnectionGateway gateway) {
    this(gateway, new SubscriptionStateReader(gateway), new ReplicationOriginReconciler(gateway));
  }

  SubscriptionConditions(ConnectionGateway gateway,
                         SubscriptionStateReader reader,
                         ReplicationOriginReconciler reconciler) {
    this.gateway = Objects.requireNonNull(gateway, "gateway");
    this.reader = Objects.requireNonNull(reader, "reader");
    this.reconciler = Objects.requireNonNull(reconciler, "reconciler");
  }

  public ConvergenceCheck enabledEquals(String database, String name, boolean enabled) {
    return ConvergenceCheck.named("subscription " + name + " enabled=" + enabled, () -> {
      SubscriptionState state = reader.read(database, name);
      return state.exists() && state.enabled() == enabled;
    });
  }

  public ConvergenceCheck subscriptionAbsent(String database, String name) {
    return ConvergenceCheck.named("subscription " + name + " absent",
      () -> !reader.read(database, name).exists());
  }

  public ConvergenceCheck originPresent(String database, String subscriptionName) {
    return ConvergenceCheck.named("origin of subscription " + subscriptionName + " present",
      () -> reconciler.verifyOriginExists(database, subscriptionName));
  }

  public ConvergenceCheck originAbsent(String database, String originName) {
    return ConvergenceCheck.named("replication origin " + originName + " absent",
      () -> !reconciler.originExists(database, originName));
  }

  public ConvergenceCheck rowCountEquals(String database, String table, long expected) {
    return rowCount(database, table, null, null, expected);
  }

  /**
   * Counts only rows whose {@code column}, compared as text, equals {@code value}.
   */
  public ConvergenceCheck rowCountEquals(String database, String table, String column, String value, long expected) {
    Objects.requireNonNull(column, "column");
    Objects.requireNonNull(value, "value");
    return rowCount(database, table, column, value, expected);
  }

  long countRows(String database, String table, String column, String value) throws Exception {
    String sql = SubscriptionStatements.countRows(table, column);
    List<?> params = column == null ? List.of() : List.of(value);
    try (DatabaseSession session = gateway.open(database)) {
      return session.queryFirst(sql, params, row -> row.getLong("n")).orElse(0L);
    }
  }

  private ConvergenceCheck rowCount(String database, String table, String column, String value, long expected) {
    Objects.requireNonNull(database, "database");
    Objects.requireNonNull(table, "table");
    String description = column == null
      ? database + "." + table + " has " + expected + " row(s)"
      : database + "." + table + " has " + expected + " row(s) where " + column + " = " + value;
    return ConvergenceCheck.named(description,
      () -> countRows(database, table, column, value) == expected);
  }
}
