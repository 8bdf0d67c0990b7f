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

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Properties;
import org.postgresql.PGProperty;

/**
 * Opens plain JDBC sessions with the PostgreSQL driver.
 */
public final class JdbcConnectionGateway implements ConnectionGateway {

  private static final String APPLICATION_NAME = "vertx-pg-subscription";

  private final SubscriptionManagerOptions options;

  public JdbcConnectionGateway(SubscriptionManagerOptions options) {
    this.options = new SubscriptionManagerOptions(Objects.requireNonNull(options, "options"));
  }

  @Override
  public DatabaseSession open(String database) throws SQLException {
    Objects.requireNonNull(database, "database");
    Connection connection = DriverManager.getConnection(postgresJdbcUrl(database), connectionProperties());
    try {
      connection.setAutoCommit(true);
    } catch (SQLException e) {
      connection.close();
      throw e;
    }
    return new JdbcDatabaseSession(database, connection);
  }

  String postgresJdbcUrl(String database) {
    return "jdbc:postgresql://" + options.getHost() + ':' + options.getPort() + '/' + database;
  }

  Properties connectionProperties() {
    Properties props = new Properties();
    PGProperty.USER.set(props, options.getUser());

    String password = resolvePassword();
    if (password != null && !password.isBlank()) {
      PGProperty.PASSWORD.set(props, password);
    }

    if (Boolean.TRUE.equals(options.getSsl())) {
      PGProperty.SSL.set(props, "true");
    }
    PGProperty.APPLICATION_NAME.set(props, APPLICATION_NAME);
    PGProperty.CONNECT_TIMEOUT.set(props, (int) Math.max(1L, options.getConnectTimeout().getSeconds()));
    return props;
  }

  private String resolvePassword() {
    String password = options.getPassword();
    if (password == null || password.isBlank()) {
      String envName = options.getPasswordEnv();
      if (envName != null && !envName.isBlank()) {
        password = System.getenv(envName);
      }
    }
    return password;
  }
}
