package dev.henneberger.vertx.subscription.core;

import java.util.Objects;

/**
 * One observation of server state. Each call must read fresh state; implementations must not hold
 * a transaction open between calls.
 */
@FunctionalInterface
public interface ConvergenceCheck {

  boolean satisfied() throws Exception;

  default String describe() {
    return "condition";
  }

  static ConvergenceCheck named(String description, ConvergenceCheck check) {
    Objects.requireNonNull(description, "description");
    Objects.requireNonNull(check, "check");
    return new ConvergenceCheck() {
      @Override
      public boolean satisfied() throws Exception {
        return check.satisfied();
      }

      @Override
      public String describe() {
        return description;
      }
    };
  }
}
