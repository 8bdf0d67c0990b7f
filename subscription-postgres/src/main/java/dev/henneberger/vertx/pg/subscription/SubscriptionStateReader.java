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
 * Produces {@link SubscriptionState} snapshots from {@code pg_subscription}.
 *
 * <p>{@code pg_subscription} is shared across the cluster, so the lookup is scoped to the database
 * the session is connected to.
 */
public final class SubscriptionStateReader {

  private static final Logger LOG = LoggerFactory.getLogger(SubscriptionStateReader.class);

  static final String SELECT_SUBSCRIPTION =
    "SELECT s.oid AS oid, s.subenabled AS enabled, s.subslotname AS slot_name, "
      + "s.subpublications AS publications "
      + "FROM pg_catalog.pg_subscription s "
      + "JOIN pg_catalog.pg_database d ON d.oid = s.subdbid "
      + "WHERE s.subname = ? AND d.datname = current_database()";

  // subconninfo is revoked from PUBLIC and checked at parse time, so it needs its own query
  static final String CONNINFO_READABLE =
    "SELECT has_column_privilege('pg_catalog.pg_subscription', 'subconninfo', 'SELECT') AS readable";

  static final String SELECT_CONNINFO =
    "SELECT s.subconninfo AS conninfo FROM pg_catalog.pg_subscription s WHERE s.oid = ?";

  private final ConnectionGateway gateway;

  public SubscriptionStateReader(ConnectionGateway gateway) {
    this.gateway = Objects.requireNonNull(gateway, "gateway");
  }

  /**
   * @return the observed state; an absent state when no such subscription exists. The connection
   *   string is only filled in when the current role may read it.
   * @throws StateReadException if the catalog could not be queried
   */
  public SubscriptionState read(String database, String name) {
    Objects.requireNonNull(database, "database");
    Objects.requireNonNull(name, "name");
    try (DatabaseSession session = gateway.open(database)) {
      return withConnInfo(session, read(session, name));
    } catch (SQLException e) {
      throw new StateReadException(name, "could not read subscription " + name + " in " + database + ": "
        + e.getMessage(), e);
    }
  }

  SubscriptionState read(DatabaseSession session, String name) throws SQLException {
    return session.queryFirst(SELECT_SUBSCRIPTION, List.of(name), row -> SubscriptionState.present(
        name,
        session.database(),
        row.getLong("oid"),
        row.getBoolean("enabled"),
        row.getString("slot_name"),
        row.getStringList("publications"),
        null))
      .orElseGet(() -> SubscriptionState.absent(name, session.database()));
  }

  /**
   * Adds the connection string to {@code state}. Roles without SELECT on
   * {@code pg_subscription.subconninfo} get {@code state} back unchanged.
   */
  SubscriptionState withConnInfo(DatabaseSession session, SubscriptionState state) throws SQLException {
    if (!state.exists()) {
      return state;
    }
    boolean readable = session.queryFirst(CONNINFO_READABLE, List.of(), row -> row.getBoolean("readable"))
      .orElse(false);
    if (!readable) {
      LOG.debug("Role cannot read the connection string of subscription {}", state.name());
      return state;
    }
    return session.queryFirst(SELECT_CONNINFO, List.of(state.oid()), row -> row.getString("conninfo"))
      .map(state::withConnInfo)
      .orElse(state);
  }
}
