package dev.henneberger.vertx.subscription.core;

/**
 * A start position was requested on an edge other than disabled to enabled.
 */
public final class InvalidTransitionException extends SubscriptionException {

  private final SubscriptionPhase currentPhase;
  private final boolean requestedEnabled;

  public InvalidTransitionException(String subscriptionName,
                                    SubscriptionPhase currentPhase,
                                    boolean requestedEnabled,
                                    String message) {
    super(subscriptionName, message);
    this.currentPhase = currentPhase;
    this.requestedEnabled = requestedEnabled;
  }

  public SubscriptionPhase currentPhase() {
    return currentPhase;
  }

  public boolean requestedEnabled() {
    return requestedEnabled;
  }
}
