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

/**
 * Column access for one result row.
 */
public interface SqlRow {

  String getString(String column) throws SQLException;

  long getLong(String column) throws SQLException;

  boolean getBoolean(String column) throws SQLException;

  /**
   * Reads a {@code text[]} / {@code name[]} column; SQL {@code NULL} yields an empty list.
   */
  List<String> getStringList(String column) throws SQLException;
}
