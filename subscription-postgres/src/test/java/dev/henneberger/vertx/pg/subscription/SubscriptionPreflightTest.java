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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.henneberger.vertx.subscription.core.PreflightIssue;
import dev.henneberger.vertx.subscription.core.PreflightReport;
import org.junit.jupiter.api.Test;

class SubscriptionPreflightTest {

  @Test
  void passesOnCapableServer() {
    PreflightReport report = new SubscriptionPreflight(new FakePostgres()).run("warehouse");

    assertTrue(report.ok());
    assertTrue(report.issues().isEmpty());
  }

  @Test
  void nonSuperuserIsOnlyAWarning() {
    FakePostgres postgres = new FakePostgres();
    postgres.superuser(false);

    PreflightReport report = new SubscriptionPreflight(postgres).run("warehouse");

    assertTrue(report.ok());
    assertTrue(report.hasIssue("ROLE_NOT_SUPERUSER"));
    assertEquals(PreflightIssue.Severity.WARNING, report.issues().get(0).severity());
  }

  @Test
  void reportsServerWithoutSubscriptions() {
    FakePostgres postgres = new FakePostgres();
    postgres.setting("server_version_num", "90624");

    PreflightReport report = new SubscriptionPreflight(postgres).run("warehouse");

    assertFalse(report.ok());
    assertTrue(report.hasIssue("SUBSCRIPTIONS_UNSUPPORTED"));
  }

  @Test
  void reportsMissingWorkers() {
    FakePostgres postgres = new FakePostgres();
    postgres.setting("max_logical_replication_workers", "0");

    PreflightReport report = new SubscriptionPreflight(postgres).run("warehouse");

    assertFalse(report.ok());
    assertTrue(report.hasIssue("MAX_LOGICAL_REPLICATION_WORKERS_INVALID"));
    assertFalse(report.hasIssue("MAX_REPLICATION_SLOTS_INVALID"));
  }

  @Test
  void unreachableDatabaseIsReportedNotThrown() {
    FakePostgres postgres = new FakePostgres();
    postgres.failOpen(FakePostgres.sqlError("3D000", "database \"warehouse\" does not exist"));

    PreflightReport report = new SubscriptionPreflight(postgres).run("warehouse");

    assertFalse(report.ok());
    assertTrue(report.hasIssue("CONNECTION_FAILED"));
  }
}
