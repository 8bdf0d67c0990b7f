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
import java.time.Duration;
import java.util.Objects;

public final class SubscriptionOptionPresets {

  private SubscriptionOptionPresets() {
  }

  public static void applyProductionDefaults(SubscriptionManagerOptions options) {
    Objects.requireNonNull(options, "options");
    options
      .setPreflightEnabled(true)
      .setSweepOrphansOnDrop(true)
      .setConvergenceTimeout(Duration.ofMinutes(5))
      .setConflictRetryPolicy(RetryPolicy.onStateConflict(3))
      .setPollBackoff(
        RetryPolicy.exponentialBackoff()
          .setMaxDelay(Duration.ofSeconds(10))
          .setMultiplier(2.0d)
          .setJitter(0.2d)
      );
  }

  public static void applyLocalDevDefaults(SubscriptionManagerOptions options) {
    Objects.requireNonNull(options, "options");
    options
      .setPreflightEnabled(false)
      .setSweepOrphansOnDrop(true)
      .setConvergenceTimeout(Duration.ofSeconds(30))
      .setPollInterval(Duration.ofMillis(200))
      .setConflictRetryPolicy(RetryPolicy.onStateConflict(1))
      .setPollBackoff(RetryPolicy.disabled());
  }
}
