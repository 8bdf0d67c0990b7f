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

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SubscriptionAppConfigTest {

  @Test
  void mapsEnvironmentAndBuildsOptions() {
    Map<String, String> env = new HashMap<>();
    env.put("PGHOST", "pg.internal");
    env.put("PGPORT", "15432");
    env.put("PGUSER", "replicator");
    env.put("PG_PASSWORD_ENV", "APP_DB_PASSWORD");
    env.put("PGSSL", "true");
    env.put("PG_ADMIN_DATABASE", "admin");
    env.put("SUBSCRIPTION_POLL_INTERVAL_MS", "250");
    env.put("SUBSCRIPTION_CONVERGENCE_TIMEOUT_MS", "120000");

    SubscriptionAppConfig cfg = SubscriptionAppConfig.fromMap(env);

    assertEquals("pg.internal", cfg.pgHost());
    assertEquals(15432, cfg.pgPort());
    assertEquals("replicator", cfg.pgUser());
    assertEquals("APP_DB_PASSWORD", cfg.pgPasswordEnv());
    assertTrue(cfg.ssl());
    assertEquals("admin", cfg.adminDatabase());

    SubscriptionManagerOptions options = cfg.toManagerOptions();
    assertEquals("pg.internal", options.getHost());
    assertEquals(15432, options.getPort());
    assertEquals("APP_DB_PASSWORD", options.getPasswordEnv());
    assertEquals(Duration.ofMillis(250), options.getPollInterval());
    assertEquals(Duration.ofMinutes(2), options.getConvergenceTimeout());
  }

  @Test
  void fallsBackToDefaultsOnMissingOrBadValues() {
    Map<String, String> env = new HashMap<>();
    env.put("PGPORT", "not-a-port");
    env.put("SUBSCRIPTION_POLL_INTERVAL_MS", "-5");

    SubscriptionAppConfig cfg = SubscriptionAppConfig.fromMap(env);

    assertEquals("localhost", cfg.pgHost());
    assertEquals(5432, cfg.pgPort());
    assertEquals("postgres", cfg.pgUser());
    assertEquals("PGPASSWORD", cfg.pgPasswordEnv());
    assertFalse(cfg.ssl());
    assertEquals("postgres", cfg.adminDatabase());
    assertEquals(SubscriptionManagerOptions.DEFAULT_POLL_INTERVAL, cfg.pollInterval());
  }

  @Test
  void portBeyondIntRangeFallsBackToDefault() {
    Map<String, String> env = new HashMap<>();
    env.put("PGPORT", "4294967297");

    SubscriptionAppConfig cfg = SubscriptionAppConfig.fromMap(env);

    assertEquals(SubscriptionManagerOptions.DEFAULT_PORT, cfg.pgPort());
  }
}
