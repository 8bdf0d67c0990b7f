package dev.henneberger.vertx.subscription.core;

/**
 * Server state did not match what the operation needs. Unless {@link #isRetryable()} is false,
 * the state changed between read and act and retrying the whole operation is safe.
 */
public final class StateConflictException extends SubscriptionException {

  private final boolean retryable;

  public StateConflictException(String subscriptionName, String message) {
    this(subscriptionName, message, null, true);
  }

  public StateConflictException(String subscriptionName, String message, Throwable cause) {
    this(subscriptionName, message, cause, true);
  }

  private StateConflictException(String subscriptionName, String message, Throwable cause, boolean retryable) {
    super(subscriptionName, message, cause);
    this.retryable = retryable;
  }

  /**
   * The subscription was already absent when the operation first read it. Nothing moved between
   * read and act, so a retry would observe the same state.
   */
  public static StateConflictException absentFromStart(String subscriptionName, String message) {
    return new StateConflictException(subscriptionName, message, null, false);
  }

  public boolean isRetryable() {
    return retryable;
  }
}
