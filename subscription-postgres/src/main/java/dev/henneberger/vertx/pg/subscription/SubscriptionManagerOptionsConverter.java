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

import dev.henneberger.vertx.subscription.core.RetryPolicy;
import io.vertx.core.json.JsonObject;
import java.time.Duration;

final class SubscriptionManagerOptionsConverter {

  private SubscriptionManagerOptionsConverter() {
  }

  static void fromJson(JsonObject json, SubscriptionManagerOptions options) {
    if (json == null) {
      return;
    }

    if (json.containsKey("host")) {
      options.setHost(json.getString("host"));
    }
    if (json.containsKey("port")) {
      options.setPort(json.getInteger("port"));
    }
    if (json.containsKey("user")) {
      options.setUser(json.getString("user"));
    }
    if (json.containsKey("password")) {
      options.setPassword(json.getString("password"));
    }
    if (json.containsKey("passwordEnv")) {
      options.setPasswordEnv(json.getString("passwordEnv"));
    }
    if (json.containsKey("ssl")) {
      options.setSsl(json.getBoolean("ssl"));
    }
    if (json.containsKey("adminDatabase")) {
      options.setAdminDatabase(json.getString("adminDatabase"));
    }
    if (json.containsKey("pollIntervalMs")) {
      options.setPollInterval(Duration.ofMillis(json.getLong("pollIntervalMs")));
    }
    if (json.containsKey("convergenceTimeoutMs")) {
      options.setConvergenceTimeout(Duration.ofMillis(json.getLong("convergenceTimeoutMs")));
    }
    if (json.containsKey("connectTimeoutMs")) {
      options.setConnectTimeout(Duration.ofMillis(json.getLong("connectTimeoutMs")));
    }
    if (json.containsKey("preflightEnabled")) {
      options.setPreflightEnabled(json.getBoolean("preflightEnabled"));
    }
    if (json.containsKey("sweepOrphansOnDrop")) {
      options.setSweepOrphansOnDrop(json.getBoolean("sweepOrphansOnDrop"));
    }

    JsonObject pollBackoffJson = json.getJsonObject("pollBackoff");
    if (pollBackoffJson != null) {
      RetryPolicy parsed = RetryPolicy.exponentialBackoff();
      parsed.setInitialDelay(Duration.ofMillis(pollBackoffJson.getLong("initialDelayMs", 250L)));
      parsed.setMaxDelay(Duration.ofMillis(pollBackoffJson.getLong("maxDelayMs", 5000L)));
      parsed.setMultiplier(pollBackoffJson.getDouble("multiplier", 2.0d));
      parsed.setJitter(pollBackoffJson.getDouble("jitter", 0.0d));
      options.setPollBackoff(parsed);
    }

    JsonObject conflictJson = json.getJsonObject("conflictRetryPolicy");
    if (conflictJson != null) {
      options.setConflictRetryPolicy(RetryPolicy.onStateConflict(conflictJson.getLong("maxAttempts", 1L)));
    }
  }

  static void toJson(SubscriptionManagerOptions options, JsonObject json) {
    json.put("host", options.getHost());
    json.put("port", options.getPort());
    json.put("user", options.getUser());
    json.put("password", options.getPassword());
    json.put("passwordEnv", options.getPasswordEnv());
    json.put("ssl", options.getSsl());
    json.put("adminDatabase", options.getAdminDatabase());
    json.put("pollIntervalMs", options.getPollInterval().toMillis());
    json.put("convergenceTimeoutMs", options.getConvergenceTimeout().toMillis());
    json.put("connectTimeoutMs", options.getConnectTimeout().toMillis());
    json.put("preflightEnabled", options.isPreflightEnabled());
    json.put("sweepOrphansOnDrop", options.isSweepOrphansOnDrop());

    RetryPolicy pollBackoff = options.getPollBackoff();
    if (pollBackoff.isEnabled()) {
      json.put("pollBackoff", new JsonObject()
        .put("initialDelayMs", pollBackoff.getInitialDelay().toMillis())
        .put("maxDelayMs", pollBackoff.getMaxDelay().toMillis())
        .put("multiplier", pollBackoff.getMultiplier())
        .put("jitter", pollBackoff.getJitter()));
    }
    json.put("conflictRetryPolicy", new JsonObject()
      .put("maxAttempts", options.getConflictRetryPolicy().getMaxAttempts()));
  }
}
