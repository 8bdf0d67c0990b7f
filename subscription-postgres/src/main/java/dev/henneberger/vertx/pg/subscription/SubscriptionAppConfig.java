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

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

public final class SubscriptionAppConfig {

  private final String pgHost;
  private final int pgPort;
  private final String pgUser;
  private final String pgPasswordEnv;
  private final boolean ssl;
  private final String adminDatabase;
  private final Duration pollInterval;
  private final Duration convergenceTimeout;

  private SubscriptionAppConfig(String pgHost,
                                int pgPort,
                                String pgUser,
                                String pgPasswordEnv,
                                boolean ssl,
                                String adminDatabase,
                                Duration pollInterval,
                                Duration convergenceTimeout) {
    this.pgHost = pgHost;
    this.pgPort = pgPort;
    this.pgUser = pgUser;
    this.pgPasswordEnv = pgPasswordEnv;
    this.ssl = ssl;
    this.adminDatabase = adminDatabase;
    this.pollInterval = pollInterval;
    this.convergenceTimeout = convergenceTimeout;
  }

  public static SubscriptionAppConfig fromEnv() {
    return fromMap(System.getenv());
  }

  static SubscriptionAppConfig fromMap(Map<String, String> env) {
    Objects.requireNonNull(env, "env");

    String host = envOrDefault(env, "PGHOST", SubscriptionManagerOptions.DEFAULT_HOST);
    int port = intEnvOrDefault(env, "PGPORT", SubscriptionManagerOptions.DEFAULT_PORT);
    String user = envOrDefault(env, "PGUSER", "postgres");
    String passwordEnv = envOrDefault(env, "PG_PASSWORD_ENV", "PGPASSWORD");
    boolean ssl = boolEnvOrDefault(env, "PGSSL", false);
    String adminDatabase = envOrDefault(env, "PG_ADMIN_DATABASE", SubscriptionManagerOptions.DEFAULT_ADMIN_DATABASE);
    Duration pollInterval = Duration.ofMillis(longEnvOrDefault(env, "SUBSCRIPTION_POLL_INTERVAL_MS",
      SubscriptionManagerOptions.DEFAULT_POLL_INTERVAL.toMillis()));
    Duration convergenceTimeout = Duration.ofMillis(longEnvOrDefault(env, "SUBSCRIPTION_CONVERGENCE_TIMEOUT_MS",
      SubscriptionManagerOptions.DEFAULT_CONVERGENCE_TIMEOUT.toMillis()));

    return new SubscriptionAppConfig(host, port, user, passwordEnv, ssl, adminDatabase, pollInterval,
      convergenceTimeout);
  }

  public String pgHost() {
    return pgHost;
  }

  public int pgPort() {
    return pgPort;
  }

  public String pgUser() {
    return pgUser;
  }

  public String pgPasswordEnv() {
    return pgPasswordEnv;
  }

  public boolean ssl() {
    return ssl;
  }

  public String adminDatabase() {
    return adminDatabase;
  }

  public Duration pollInterval() {
    return pollInterval;
  }

  public Duration convergenceTimeout() {
    return convergenceTimeout;
  }

  public SubscriptionManagerOptions toManagerOptions() {
    return new SubscriptionManagerOptions()
      .setHost(pgHost)
      .setPort(pgPort)
      .setUser(pgUser)
      .setPasswordEnv(pgPasswordEnv)
      .setSsl(ssl)
      .setAdminDatabase(adminDatabase)
      .setPollInterval(pollInterval)
      .setConvergenceTimeout(convergenceTimeout);
  }

  private static String envOrDefault(Map<String, String> env, String key, String defaultValue) {
    String value = env.get(key);
    return value == null || value.isBlank() ? defaultValue : value;
  }

  private static int intEnvOrDefault(Map<String, String> env, String key, int defaultValue) {
    long value = longEnvOrDefault(env, key, defaultValue);
    return value > Integer.MAX_VALUE ? defaultValue : (int) value;
  }

  private static long longEnvOrDefault(Map<String, String> env, String key, long defaultValue) {
    String value = env.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      long parsed = Long.parseLong(value.trim());
      return parsed > 0 ? parsed : defaultValue;
    } catch (NumberFormatException ignore) {
      return defaultValue;
    }
  }

  private static boolean boolEnvOrDefault(Map<String, String> env, String key, boolean defaultValue) {
    String value = env.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return "true".equalsIgnoreCase(value) || "1".equals(value) || "yes".equalsIgnoreCase(value);
  }
}
