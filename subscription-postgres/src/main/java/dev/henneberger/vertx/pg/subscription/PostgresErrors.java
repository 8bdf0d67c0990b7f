/*
 * Copyright (C) 2026 Daniel Henneberger
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.henneberger.vertx.pg.subscription;

import dev.henneberger.vertx.subscription.core.ConnectionFailedException;
import dev.henneberger.vertx.subscription.core.ServerErrorException;
import dev.henneberger.vertx.subscription.core.SubscriptionException;
import java.sql.SQLException;

/**
 * SQLSTATE classification for the statements issued by this module.
 */
final class PostgresErrors {

  static final String DUPLICATE_OBJECT = "42710";
  static final String UNDEFINED_OBJECT = "42704";
  static final String OBJECT_IN_USE = "55006";

  private PostgresErrors() {
  }

  static boolean isAlreadyExists(SQLException error) {
    return DUPLICATE_OBJECT.equals(error.getSQLState());
  }

  static boolean isSubscriptionMissing(SQLException error) {
    String message = error.getMessage();
    return UNDEFINED_OBJECT.equals(error.getSQLState())
      && message != null
      && message.contains("subscription")
      && message.contains("does not exist");
  }

  static boolean isOriginMissing(SQLException error) {
    String message = error.getMessage();
    return UNDEFINED_OBJECT.equals(error.getSQLState())
      && message != null
      && message.contains("replication origin");
  }

  /**
   * The publisher reported the subscription's slot as already gone. The server wraps this as a
   * connection failure, so the message is the only reliable signal.
   */
  static boolean isRemoteSlotMissing(SQLException error) {
    String message = error.getMessage();
    return message != null
      && message.contains("could not drop replication slot")
      && message.contains("does not exist");
  }

  static boolean isConnectionFailure(SQLException error) {
    if (isRemoteSlotMissing(error)) {
      return false;
    }
    String state = error.getSQLState();
    return state != null && (state.startsWith("08") || "57P01".equals(state));
  }

  static SubscriptionException translate(String subscriptionName, SQLException error) {
    if (isConnectionFailure(error)) {
      return new ConnectionFailedException(subscriptionName, error.getMessage(), error);
    }
    return new ServerErrorException(subscriptionName, error);
  }
}
