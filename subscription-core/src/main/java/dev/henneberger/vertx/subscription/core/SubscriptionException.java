package dev.henneberger.vertx.subscription.core;

/**
 * Base type for every failure surfaced by subscription lifecycle operations.
 */
public class SubscriptionException extends RuntimeException {

  private final String subscriptionName;

  public SubscriptionException(String subscriptionName, String message) {
    super(message);
    this.subscriptionName = subscriptionName;
  }

  public SubscriptionException(String subscriptionName, String message, Throwable cause) {
    super(message, cause);
    this.subscriptionName = subscriptionName;
  }

  public String subscriptionName() {
    return subscriptionName;
  }
}
