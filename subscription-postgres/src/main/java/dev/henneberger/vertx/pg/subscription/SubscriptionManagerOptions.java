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

import dev.henneberger.vertx.subscription.core.OptionValidation;
import dev.henneberger.vertx.subscription.core.RetryPolicy;
import io.vertx.codegen.annotations.DataObject;
import io.vertx.codegen.annotations.GenIgnore;
import io.vertx.codegen.json.annotations.JsonGen;
import io.vertx.core.json.JsonObject;
import java.time.Duration;
import java.util.Objects;

/**
 * Server connection settings and operation defaults for {@link PostgresSubscriptionManager}. The
 * database is not part of the options; every operation names the database it acts on.
 */
@DataObject
@JsonGen(publicConverter = false)
public class SubscriptionManagerOptions {

  public static final String DEFAULT_HOST = "localhost";
  public static final int DEFAULT_PORT = 5432;
  public static final String DEFAULT_ADMIN_DATABASE = "postgres";
  public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(500);
  public static final Duration DEFAULT_CONVERGENCE_TIMEOUT = Duration.ofSeconds(60);
  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

  private String host;
  private int port;
  private String user;
  private String password;
  private String passwordEnv;
  private boolean ssl;
  private String adminDatabase;
  private Duration pollInterval;
  private Duration convergenceTimeout;
  private Duration connectTimeout;
  private RetryPolicy pollBackoff;
  private RetryPolicy conflictRetryPolicy;
  private boolean preflightEnabled;
  private boolean sweepOrphansOnDrop;

  public SubscriptionManagerOptions() {
    init();
  }

  public SubscriptionManagerOptions(JsonObject json) {
    init();
    SubscriptionManagerOptionsConverter.fromJson(json, this);
  }

  public SubscriptionManagerOptions(SubscriptionManagerOptions other) {
    this.host = other.host;
    this.port = other.port;
    this.user = other.user;
    this.password = other.password;
    this.passwordEnv = other.passwordEnv;
    this.ssl = other.ssl;
    this.adminDatabase = other.adminDatabase;
    this.pollInterval = other.pollInterval;
    this.convergenceTimeout = other.convergenceTimeout;
    this.connectTimeout = other.connectTimeout;
    this.pollBackoff = other.pollBackoff.copy();
    this.conflictRetryPolicy = other.conflictRetryPolicy.copy();
    this.preflightEnabled = other.preflightEnabled;
    this.sweepOrphansOnDrop = other.sweepOrphansOnDrop;
  }

  public String getHost() {
    return host;
  }

  public SubscriptionManagerOptions setHost(String host) {
    this.host = host;
    return this;
  }

  public Integer getPort() {
    return port;
  }

  public SubscriptionManagerOptions setPort(Integer port) {
    this.port = port == null ? DEFAULT_PORT : port;
    return this;
  }

  public String getUser() {
    return user;
  }

  public SubscriptionManagerOptions setUser(String user) {
    this.user = user;
    return this;
  }

  public String getPassword() {
    return password;
  }

  public SubscriptionManagerOptions setPassword(String password) {
    this.password = password;
    return this;
  }

  public String getPasswordEnv() {
    return passwordEnv;
  }

  public SubscriptionManagerOptions setPasswordEnv(String passwordEnv) {
    this.passwordEnv = passwordEnv;
    return this;
  }

  public Boolean getSsl() {
    return ssl;
  }

  public SubscriptionManagerOptions setSsl(Boolean ssl) {
    this.ssl = Boolean.TRUE.equals(ssl);
    return this;
  }

  /**
   * Database used for cluster-wide work such as the orphaned origin sweep.
   */
  public String getAdminDatabase() {
    return adminDatabase;
  }

  public SubscriptionManagerOptions setAdminDatabase(String adminDatabase) {
    this.adminDatabase = adminDatabase;
    return this;
  }

  @GenIgnore
  public Duration getPollInterval() {
    return pollInterval;
  }

  @GenIgnore
  public SubscriptionManagerOptions setPollInterval(Duration pollInterval) {
    this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
    return this;
  }

  @GenIgnore
  public Duration getConvergenceTimeout() {
    return convergenceTimeout;
  }

  @GenIgnore
  public SubscriptionManagerOptions setConvergenceTimeout(Duration convergenceTimeout) {
    this.convergenceTimeout = Objects.requireNonNull(convergenceTimeout, "convergenceTimeout");
    return this;
  }

  @GenIgnore
  public Duration getConnectTimeout() {
    return connectTimeout;
  }

  @GenIgnore
  public SubscriptionManagerOptions setConnectTimeout(Duration connectTimeout) {
    this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
    return this;
  }

  /**
   * Delay schedule between convergence polls. Disabled means a fixed {@link #getPollInterval()}.
   */
  @GenIgnore
  public RetryPolicy getPollBackoff() {
    return pollBackoff;
  }

  /**
   * Growth of the wait between polls. The first wait is always {@link #getPollInterval()}.
   */
  @GenIgnore
  public SubscriptionManagerOptions setPollBackoff(RetryPolicy pollBackoff) {
    this.pollBackoff = Objects.requireNonNull(pollBackoff, "pollBackoff");
    return this;
  }

  /**
   * Whole-operation retries after a concurrent modification was detected.
   */
  @GenIgnore
  public RetryPolicy getConflictRetryPolicy() {
    return conflictRetryPolicy;
  }

  @GenIgnore
  public SubscriptionManagerOptions setConflictRetryPolicy(RetryPolicy conflictRetryPolicy) {
    this.conflictRetryPolicy = Objects.requireNonNull(conflictRetryPolicy, "conflictRetryPolicy");
    return this;
  }

  public boolean isPreflightEnabled() {
    return preflightEnabled;
  }

  public SubscriptionManagerOptions setPreflightEnabled(boolean preflightEnabled) {
    this.preflightEnabled = preflightEnabled;
    return this;
  }

  public boolean isSweepOrphansOnDrop() {
    return sweepOrphansOnDrop;
  }

  public SubscriptionManagerOptions setSweepOrphansOnDrop(boolean sweepOrphansOnDrop) {
    this.sweepOrphansOnDrop = sweepOrphansOnDrop;
    return this;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    SubscriptionManagerOptionsConverter.toJson(this, json);
    return json;
  }

  public SubscriptionManagerOptions merge(JsonObject other) {
    JsonObject json = toJson();
    json.mergeIn(other);
    SubscriptionManagerOptions merged = new SubscriptionManagerOptions(json);
    if (!other.containsKey("pollBackoff")) {
      merged.pollBackoff = pollBackoff.copy();
    }
    if (!other.containsKey("conflictRetryPolicy")) {
      merged.conflictRetryPolicy = conflictRetryPolicy.copy();
    }
    return merged;
  }

  void validate() {
    OptionValidation.require("host", host);
    OptionValidation.requirePort(port);
    OptionValidation.require("user", user);
    OptionValidation.require("adminDatabase", adminDatabase);
    OptionValidation.requirePositive("pollInterval", pollInterval);
    OptionValidation.requirePositive("convergenceTimeout", convergenceTimeout);
    OptionValidation.requirePositive("connectTimeout", connectTimeout);
    pollBackoff.validate();
    conflictRetryPolicy.validate();
  }

  private void init() {
    host = DEFAULT_HOST;
    port = DEFAULT_PORT;
    ssl = false;
    adminDatabase = DEFAULT_ADMIN_DATABASE;
    pollInterval = DEFAULT_POLL_INTERVAL;
    convergenceTimeout = DEFAULT_CONVERGENCE_TIMEOUT;
    connectTimeout = DEFAULT_CONNECT_TIMEOUT;
    pollBackoff = RetryPolicy.disabled();
    conflictRetryPolicy = RetryPolicy.onStateConflict(1);
    preflightEnabled = false;
    sweepOrphansOnDrop = true;
  }
}
