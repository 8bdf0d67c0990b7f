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

import dev.henneberger.vertx.subscription.core.ListenerRegistration;
import java.util.Objects;
import org.slf4j.Logger;

public final class SubscriptionLogging {

  private SubscriptionLogging() {
  }

  public static ListenerRegistration attachDefaultLogging(PostgresSubscriptionManager manager,
                                                          Logger logger,
                                                          String managerName) {
    Objects.requireNonNull(manager, "manager");
    Objects.requireNonNull(logger, "logger");
    String name = managerName == null || managerName.isBlank() ? "subscriptions" : managerName;

    return manager.onPhaseChange(change -> {
      if (change.startLsn() != null) {
        logger.info("manager={} subscription={} database={} phase={} prev={} startLsn={}",
          name,
          change.subscriptionName(),
          change.database(),
          change.phase(),
          change.previousPhase(),
          change.startLsn());
      } else {
        logger.info("manager={} subscription={} database={} phase={} prev={}",
          name,
          change.subscriptionName(),
          change.database(),
          change.phase(),
          change.previousPhase());
      }
    });
  }
}
