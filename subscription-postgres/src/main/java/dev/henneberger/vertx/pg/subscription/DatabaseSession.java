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

import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * One session against a single database. Sessions run in autocommit mode except inside
 * {@link #inTransaction(Work)}; they are not thread-safe and must be closed by the opener.
 */
public interface DatabaseSession extends AutoCloseable {

  @FunctionalInterface
  interface RowMapper<T> {
    T map(SqlRow row) throws SQLException;
  }

  @FunctionalInterface
  interface Work<T> {
    T run(DatabaseSession session) throws SQLException;
  }

  String database();

  <T> List<T> query(String sql, List<?> params, RowMapper<T> mapper) throws SQLException;

  default <T> Optional<T> queryFirst(String sql, List<?> params, RowMapper<T> mapper) throws SQLException {
    List<T> rows = query(sql, params, mapper);
    return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
  }

  void execute(String sql, List<?> params) throws SQLException;

  default void execute(String sql) throws SQLException {
    execute(sql, List.of());
  }

  /**
   * Runs {@code work} in a transaction that commits on normal return and rolls back on any
   * exception or error. The session returns to autocommit afterwards. Transactions do not nest.
   */
  <T> T inTransaction(Work<T> work) throws SQLException;

  @Override
  void close() throws SQLException;
}
