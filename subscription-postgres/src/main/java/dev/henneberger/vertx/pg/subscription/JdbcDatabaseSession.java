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

import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class JdbcDatabaseSession implements DatabaseSession {

  private static final Logger LOG = LoggerFactory.getLogger(JdbcDatabaseSession.class);

  private final String database;
  private final Connection connection;
  private boolean inTransaction;

  JdbcDatabaseSession(String database, Connection connection) {
    this.database = Objects.requireNonNull(database, "database");
    this.connection = Objects.requireNonNull(connection, "connection");
  }

  @Override
  public String database() {
    return database;
  }

  @Override
  public <T> List<T> query(String sql, List<?> params, RowMapper<T> mapper) throws SQLException {
    try (PreparedStatement statement = prepare(sql, params);
         ResultSet rs = statement.executeQuery()) {
      SqlRow row = new ResultSetRow(rs);
      List<T> rows = new ArrayList<>();
      while (rs.next()) {
        rows.add(mapper.map(row));
      }
      return rows;
    }
  }

  @Override
  public void execute(String sql, List<?> params) throws SQLException {
    try (PreparedStatement statement = prepare(sql, params)) {
      statement.execute();
    }
  }

  @Override
  public <T> T inTransaction(Work<T> work) throws SQLException {
    Objects.requireNonNull(work, "work");
    if (inTransaction) {
      throw new IllegalStateException("transaction already open on session for " + database);
    }

    connection.setAutoCommit(false);
    inTransaction = true;
    try {
      T result = work.run(this);
      connection.commit();
      return result;
    } catch (SQLException | RuntimeException | Error e) {
      rollbackQuietly(e);
      throw e;
    } finally {
      inTransaction = false;
      restoreAutoCommit();
    }
  }

  @Override
  public void close() throws SQLException {
    connection.close();
  }

  private PreparedStatement prepare(String sql, List<?> params) throws SQLException {
    PreparedStatement statement = connection.prepareStatement(sql);
    try {
      for (int i = 0; i < params.size(); i++) {
        statement.setObject(i + 1, params.get(i));
      }
    } catch (SQLException e) {
      statement.close();
      throw e;
    }
    return statement;
  }

  private void rollbackQuietly(Throwable cause) {
    try {
      connection.rollback();
    } catch (SQLException rollbackError) {
      cause.addSuppressed(rollbackError);
      LOG.warn("Rollback failed on database {}", database, rollbackError);
    }
  }

  private void restoreAutoCommit() {
    try {
      if (!connection.isClosed()) {
        connection.setAutoCommit(true);
      }
    } catch (SQLException e) {
      LOG.warn("Could not restore autocommit on database {}", database, e);
    }
  }

  private static final class ResultSetRow implements SqlRow {

    private final ResultSet rs;

    private ResultSetRow(ResultSet rs) {
      this.rs = rs;
    }

    @Override
    public String getString(String column) throws SQLException {
      return rs.getString(column);
    }

    @Override
    public long getLong(String column) throws SQLException {
      return rs.getLong(column);
    }

    @Override
    public boolean getBoolean(String column) throws SQLException {
      return rs.getBoolean(column);
    }

    @Override
    public List<String> getStringList(String column) throws SQLException {
      Array array = rs.getArray(column);
      if (array == null) {
        return Collections.emptyList();
      }
      try {
        Object[] values = (Object[]) array.getArray();
        List<String> result = new ArrayList<>(values.length);
        for (Object value : Arrays.asList(values)) {
          result.add(value == null ? null : value.toString());
        }
        return result;
      } finally {
        array.free();
      }
    }
  }
}
