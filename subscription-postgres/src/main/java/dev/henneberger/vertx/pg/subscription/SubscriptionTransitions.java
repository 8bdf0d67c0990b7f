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

import dev.henneberger.vertx.subscription.core.InvalidSpecException;
import dev.henneberger.vertx.subscription.core.InvalidTransitionException;
import dev.henneberger.vertx.subscription.core.StateConflictException;
import dev.henneberger.vertx.subscription.core.SubscriptionPhase;
import java.util.Objects;

/**
 * Guards for the subscription state machine.
 *
 * <pre>
 *   ABSENT --create--> DISABLED | ENABLED
 *   DISABLED --enable [start LSN allowed]--> ENABLED
 *   ENABLED --disable--> DISABLED
 *   DISABLED | ENABLED --drop--> ABSENT
 * </pre>
 *
 * A start position is a one-shot side effect of the DISABLED to ENABLED edge, never a property of
 * the desired state.
 */
public final class SubscriptionTransitions {

  public enum Edge {
    NONE,
    ENABLE,
    ENABLE_AT_LSN,
    DISABLE
  }

  private SubscriptionTransitions() {
  }

  /**
   * @throws InvalidSpecException if the spec carries a start position
   */
  public static void checkCreate(SubscriptionSpec spec) {
    if (spec.getStartLsn() != null) {
      throw new InvalidSpecException(spec.getName(),
        "startLsn cannot be set when creating subscription " + spec.getName()
          + "; create it disabled and enable it with the start position");
    }
  }

  /**
   * Decides which edge moves {@code current} to the requested enabled flag.
   *
   * @throws InvalidTransitionException if {@code startLsn} is set on any edge but DISABLED to ENABLED
   * @throws StateConflictException if the subscription does not exist
   */
  public static Edge plan(SubscriptionState current, boolean enabled, Lsn startLsn) {
    Objects.requireNonNull(current, "current");
    SubscriptionPhase phase = current.phase();

    if (startLsn != null) {
      if (phase == SubscriptionPhase.ABSENT) {
        throw invalid(current, enabled, "subscription " + current.name() + " does not exist; "
          + "a start position can only be applied to an existing disabled subscription");
      }
      if (!enabled) {
        throw invalid(current, false, "a start position can only be applied when enabling subscription "
          + current.name());
      }
      if (phase == SubscriptionPhase.ENABLED) {
        throw invalid(current, true, "subscription " + current.name() + " is already enabled; "
          + "a start position can only be applied on the disabled to enabled transition");
      }
      return Edge.ENABLE_AT_LSN;
    }

    if (phase == SubscriptionPhase.ABSENT) {
      throw StateConflictException.absentFromStart(current.name(),
        "subscription " + current.name() + " does not exist in " + current.database());
    }
    if (enabled == current.enabled()) {
      return Edge.NONE;
    }
    return enabled ? Edge.ENABLE : Edge.DISABLE;
  }

  private static InvalidTransitionException invalid(SubscriptionState current, boolean enabled, String message) {
    return new InvalidTransitionException(current.name(), current.phase(), enabled, message);
  }
}
