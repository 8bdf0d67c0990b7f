package dev.henneberger.vertx.subscription.core;

public enum SubscriptionPhase {
  ABSENT,
  DISABLED,
  ENABLED;

  public static SubscriptionPhase of(boolean exists, boolean enabled) {
    if (!exists) {
      return ABSENT;
    }
    return enabled ? ENABLED : DISABLED;
  }
}
