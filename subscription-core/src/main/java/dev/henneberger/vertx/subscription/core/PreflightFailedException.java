package dev.henneberger.vertx.subscription.core;

import java.util.Objects;

public final class PreflightFailedException extends SubscriptionException {

  private final PreflightReport report;
  private final String database;

  public PreflightFailedException(String subscriptionName, String database, PreflightReport report) {
    super(subscriptionName, PreflightReports.describeFailure(Objects.requireNonNull(report, "report")));
    this.report = report;
    this.database = database;
  }

  public PreflightReport report() {
    return report;
  }

  public String database() {
    return database;
  }
}
