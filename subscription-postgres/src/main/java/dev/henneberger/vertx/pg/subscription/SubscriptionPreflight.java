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

import dev.henneberger.vertx.subscription.core.PreflightIssue;
import dev.henneberger.vertx.subscription.core.PreflightReport;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Checks that a subscriber database can host logical replication subscriptions.
 */
public final class SubscriptionPreflight {

  static final long MIN_SERVER_VERSION_NUM = 100000L;

  static final String CURRENT_SETTING = "SELECT current_setting(?) AS value";
  static final String ROLE_IS_SUPERUSER =
    "SELECT rolsuper AS superuser FROM pg_catalog.pg_roles WHERE rolname = current_user";

  private final ConnectionGateway gateway;

  public SubscriptionPreflight(ConnectionGateway gateway) {
    this.gateway = Objects.requireNonNull(gateway, "gateway");
  }

  public PreflightReport run(String database) {
    Objects.requireNonNull(database, "database");
    List<PreflightIssue> issues = new ArrayList<>();

    try (DatabaseSession session = gateway.open(database)) {
      if (!checkServerVersion(session, issues)) {
        return new PreflightReport(issues);
      }
      checkRole(session, issues);
      checkPositiveSetting(session, "max_logical_replication_workers", issues,
        "MAX_LOGICAL_REPLICATION_WORKERS_INVALID");
      checkPositiveSetting(session, "max_replication_slots", issues, "MAX_REPLICATION_SLOTS_INVALID");
    } catch (SQLException e) {
      issues.add(PreflightIssue.error(
        "CONNECTION_FAILED",
        "Could not connect to database '" + database + "': " + e.getMessage(),
        "Verify host, port, database, user, password, and SSL settings."
      ));
    }

    return new PreflightReport(issues);
  }

  private static boolean checkServerVersion(DatabaseSession session, List<PreflightIssue> issues) throws SQLException {
    Optional<String> version = setting(session, "server_version_num");
    if (version.isEmpty()) {
      issues.add(PreflightIssue.error(
        "SERVER_VERSION_UNKNOWN",
        "Could not read server_version_num",
        "Connect to a PostgreSQL 10 or newer server."
      ));
      return false;
    }
    long versionNum = parseLong(version.get());
    if (versionNum < MIN_SERVER_VERSION_NUM) {
      issues.add(PreflightIssue.error(
        "SUBSCRIPTIONS_UNSUPPORTED",
        "Server version " + version.get() + " does not support logical replication subscriptions",
        "Upgrade the subscriber to PostgreSQL 10 or newer."
      ));
      return false;
    }
    return true;
  }

  private static void checkRole(DatabaseSession session, List<PreflightIssue> issues) throws SQLException {
    boolean superuser = session.queryFirst(ROLE_IS_SUPERUSER, List.of(), row -> row.getBoolean("superuser"))
      .orElse(false);
    if (!superuser) {
      issues.add(PreflightIssue.warning(
        "ROLE_NOT_SUPERUSER",
        "Current user is not a superuser",
        "Creating subscriptions and managing replication origins usually requires a superuser role."
      ));
    }
  }

  private static void checkPositiveSetting(DatabaseSession session,
                                           String name,
                                           List<PreflightIssue> issues,
                                           String code) throws SQLException {
    Optional<String> value = setting(session, name);
    if (value.isPresent() && parseLong(value.get()) < 1) {
      issues.add(PreflightIssue.error(
        code,
        name + " is set to " + value.get(),
        "Set " + name + " to at least 1 and restart PostgreSQL."
      ));
    }
  }

  private static Optional<String> setting(DatabaseSession session, String name) throws SQLException {
    return session.queryFirst(CURRENT_SETTING, List.of(name), row -> row.getString("value"));
  }

  private static long parseLong(String value) {
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      return -1L;
    }
  }
}
