package dev.henneberger.vertx.subscription.core;

/**
 * The session could not be opened or was lost during an administrative call.
 */
public final class ConnectionFailedException extends SubscriptionException {

  public ConnectionFailedException(String subscriptionName, String message, Throwable cause) {
    super(subscriptionName, message, cause);
  }
}
