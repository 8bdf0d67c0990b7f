package dev.henneberger.vertx.subscription.core;

import java.util.Objects;

public final class SubscriptionPhaseChange {
  private final String subscriptionName;
  private final String database;
  private final SubscriptionPhase previousPhase;
  private final SubscriptionPhase phase;
  private final String startLsn;

  public SubscriptionPhaseChange(String subscriptionName,
                                 String database,
                                 SubscriptionPhase previousPhase,
                                 SubscriptionPhase phase,
                                 String startLsn) {
    this.subscriptionName = Objects.requireNonNull(subscriptionName, "subscriptionName");
    this.database = Objects.requireNonNull(database, "database");
    this.previousPhase = Objects.requireNonNull(previousPhase, "previousPhase");
    this.phase = Objects.requireNonNull(phase, "phase");
    this.startLsn = startLsn;
  }

  public String subscriptionName() {
    return subscriptionName;
  }

  public String database() {
    return database;
  }

  public SubscriptionPhase previousPhase() {
    return previousPhase;
  }

  public SubscriptionPhase phase() {
    return phase;
  }

  /**
   * Position replay was advanced to on this change, or {@code null}.
   */
  public String startLsn() {
    return startLsn;
  }
}
