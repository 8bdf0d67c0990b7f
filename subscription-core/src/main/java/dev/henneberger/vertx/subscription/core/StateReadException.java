package dev.henneberger.vertx.subscription.core;

public final class StateReadException extends SubscriptionException {

  public StateReadException(String subscriptionName, String message, Throwable cause) {
    super(subscriptionName, message, cause);
  }
}
