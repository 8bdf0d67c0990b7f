package dev.henneberger.vertx.subscription.core;

import java.sql.SQLException;

/**
 * The server refused a statement. The message is the server's own text.
 */
public final class ServerErrorException extends SubscriptionException {

  private final String sqlState;

  public ServerErrorException(String subscriptionName, SQLException cause) {
    super(subscriptionName, cause.getMessage(), cause);
    this.sqlState = cause.getSQLState();
  }

  public String sqlState() {
    return sqlState;
  }
}
