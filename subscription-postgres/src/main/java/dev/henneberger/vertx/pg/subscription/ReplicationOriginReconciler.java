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

import dev.henneberger.vertx.subscription.core.StateReadException;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Observes and cleans the replication origins the server keeps per subscription.
 *
 * <p>Origins are owned by the cluster. They are created together with the subscription and are
 * normally removed by {@code DROP SUBSCRIPTION}, but a failed or interrupted drop can leave
 * {@code pg_<oid>} behind with no subscription pointing at it.
 */
public final class ReplicationOriginReconciler {

  private static final Logger LOG = LoggerFactory.getLogger(ReplicationOriginReconciler.class);

  // Table sync origins (pg_<oid>_<relid>) belong to table sync workers and are not matched.
  static final String SELECT_ORPHANED_ORIGINS =
    "SELECT ro.roname AS origin FROM pg_catalog.pg_replication_origin ro "
      + "WHERE ro.roname ~ '^pg_[0-9]+$' "
      + "AND NOT EXISTS (SELECT 1 FROM pg_catalog.pg_subscription s WHERE ro.roname = 'pg_' || s.oid::text) "
      + "ORDER BY ro.roname";

  static final String SELECT_ORIGIN =
    "SELECT ro.roname AS origin FROM pg_catalog.pg_replication_origin ro WHERE ro.roname = ?";

  static final String SELECT_ORIGIN_IF_ORPHANED =
    "SELECT ro.roname AS origin FROM pg_catalog.pg_replication_origin ro "
      + "WHERE ro.roname = ? "
      + "AND NOT EXISTS (SELECT 1 FROM pg_catalog.pg_subscription s WHERE ro.roname = 'pg_' || s.oid::text)";

  private final ConnectionGateway gateway;
  private final SubscriptionStateReader reader;

  public ReplicationOriginReconciler(ConnectionGateway gateway) {
    this(gateway, new SubscriptionStateReader(gateway));
  }

  ReplicationOriginReconciler(ConnectionGateway gateway, SubscriptionStateReader reader) {
    this.gateway = Objects.requireNonNull(gateway, "gateway");
    this.reader = Objects.requireNonNull(reader, "reader");
  }

  /**
   * @return whether the origin derived from the subscription's identifier is present; {@code false}
   *   when the subscription itself does not exist
   * @throws StateReadException only when the catalog could not be queried
   */
  public boolean verifyOriginExists(String database, String subscriptionName) {
    Objects.requireNonNull(database, "database");
    Objects.requireNonNull(subscriptionName, "subscriptionName");
    try (DatabaseSession session = gateway.open(database)) {
      SubscriptionState state = reader.read(session, subscriptionName);
      if (!state.exists()) {
        LOG.debug("Subscription {} does not exist in {}; no origin to verify", subscriptionName, database);
        return false;
      }
      boolean present = originExists(session, state.originName());
      LOG.debug("Replication origin {} for subscription {} (oid {}) present={}",
        state.originName(), subscriptionName, state.oid(), present);
      return present;
    } catch (SQLException e) {
      throw new StateReadException(subscriptionName,
        "could not verify replication origin of " + subscriptionName + ": " + e.getMessage(), e);
    }
  }

  public boolean originExists(String database, String originName) {
    Objects.requireNonNull(database, "database");
    Objects.requireNonNull(originName, "originName");
    try (DatabaseSession session = gateway.open(database)) {
      return originExists(session, originName);
    } catch (SQLException e) {
      throw new StateReadException(null,
        "could not look up replication origin " + originName + ": " + e.getMessage(), e);
    }
  }

  /**
   * Drops every {@code pg_<oid>} origin whose subscription no longer exists anywhere in the
   * cluster. Each drop is independent; failures are logged and reported, not thrown.
   *
   * @throws StateReadException if the orphan list itself could not be read
   */
  public OriginSweepReport sweepOrphans(String adminDatabase) {
    Objects.requireNonNull(adminDatabase, "adminDatabase");
    try (DatabaseSession session = gateway.open(adminDatabase)) {
      List<String> orphans = session.query(SELECT_ORPHANED_ORIGINS, List.of(), row -> row.getString("origin"));
      if (orphans.isEmpty()) {
        LOG.debug("No orphaned replication origins found");
        return OriginSweepReport.empty();
      }

      OriginSweepReport report = orphans.stream()
        .map(origin -> dropOne(session, origin))
        .reduce(OriginSweepReport.empty(), OriginSweepReport::merge);
      LOG.info("Orphaned replication origin sweep cleaned {} of {} ({} failures)",
        report.cleanedCount(), orphans.size(), report.failures().size());
      return report;
    } catch (SQLException e) {
      throw new StateReadException(null, "could not list orphaned replication origins: " + e.getMessage(), e);
    }
  }

  /**
   * Drops {@code originName} only if no subscription in the cluster still owns it.
   *
   * @return whether an origin was dropped
   */
  public boolean dropOriginIfOrphaned(String database, String originName) throws SQLException {
    Objects.requireNonNull(originName, "originName");
    try (DatabaseSession session = gateway.open(database)) {
      boolean orphaned = session.queryFirst(SELECT_ORIGIN_IF_ORPHANED, List.of(originName),
        row -> row.getString("origin")).isPresent();
      if (!orphaned) {
        return false;
      }
      try {
        session.execute(SubscriptionStatements.DROP_ORIGIN, List.of(originName));
      } catch (SQLException e) {
        if (PostgresErrors.isOriginMissing(e)) {
          return false;
        }
        throw e;
      }
      LOG.info("Dropped orphaned replication origin {}", originName);
      return true;
    }
  }

  private OriginSweepReport dropOne(DatabaseSession session, String origin) {
    try {
      session.execute(SubscriptionStatements.DROP_ORIGIN, List.of(origin));
      LOG.info("Dropped orphaned replication origin {}", origin);
      return OriginSweepReport.cleaned(origin);
    } catch (SQLException e) {
      if (PostgresErrors.isOriginMissing(e)) {
        LOG.debug("Replication origin {} disappeared before it could be dropped", origin);
        return OriginSweepReport.empty();
      }
      LOG.warn("Could not drop orphaned replication origin {}: {}", origin, e.getMessage());
      return OriginSweepReport.failed(new OriginSweepReport.Failure(origin, String.valueOf(e.getMessage()), e));
    }
  }

  private static boolean originExists(DatabaseSession session, String originName) throws SQLException {
    return session.queryFirst(SELECT_ORIGIN, List.of(originName), row -> row.getString("origin")).isPresent();
  }
}
