package dev.henneberger.vertx.subscription.core;

/**
 * The requested subscription definition is rejected before any statement reaches the server.
 */
public final class InvalidSpecException extends SubscriptionException {

  public InvalidSpecException(String subscriptionName, String message) {
    super(subscriptionName, message);
  }

  public InvalidSpecException(String subscriptionName, String message, Throwable cause) {
    super(subscriptionName, message, cause);
  }
}
