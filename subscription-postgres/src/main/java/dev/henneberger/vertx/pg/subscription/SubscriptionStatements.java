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
import java.util.Collection;
import java.util.Iterator;
import org.postgresql.core.Utils;

/**
 * Renders the administrative statements. Identifiers and literals are escaped with the driver's
 * own routines because DDL cannot take bind parameters.
 */
final class SubscriptionStatements {

  static final String ADVANCE_ORIGIN = "SELECT pg_replication_origin_advance(?, ?::pg_lsn)";
  static final String DROP_ORIGIN = "SELECT pg_replication_origin_drop(?)";
  static final String CURRENT_WAL_LSN = "SELECT pg_current_wal_lsn()::text AS lsn";

  private SubscriptionStatements() {
  }

  static String create(SubscriptionSpec spec) {
    StringBuilder sql = new StringBuilder("CREATE SUBSCRIPTION ");
    identifier(sql, spec.getName());
    sql.append(" CONNECTION ");
    literal(sql, spec.getConnInfo());
    sql.append(" PUBLICATION ");
    identifierList(sql, spec.getPublications());
    sql.append(" WITH (enabled = ").append(spec.isEnabled())
      .append(", connect = ").append(spec.isConnect())
      .append(", create_slot = ").append(spec.isCreateSlot());
    if (spec.getSlotName() != null && !spec.getSlotName().isBlank()) {
      sql.append(", slot_name = ");
      literal(sql, spec.getSlotName());
    }
    sql.append(", copy_data = ").append(spec.isCopyData()).append(')');
    return sql.toString();
  }

  static String enable(String name) {
    return alter(name).append(" ENABLE").toString();
  }

  static String disable(String name) {
    return alter(name).append(" DISABLE").toString();
  }

  /**
   * {@code refresh} must be false for a disabled subscription; the server refuses it otherwise.
   * {@code copyData} only applies when refreshing.
   */
  static String setPublications(String name, Collection<String> publications, boolean refresh, boolean copyData) {
    StringBuilder sql = alter(name).append(" SET PUBLICATION ");
    identifierList(sql, publications);
    sql.append(" WITH (refresh = ").append(refresh);
    if (refresh) {
      sql.append(", copy_data = ").append(copyData);
    }
    return sql.append(')').toString();
  }

  static String setConnection(String name, String connInfo) {
    StringBuilder sql = alter(name).append(" CONNECTION ");
    literal(sql, connInfo);
    return sql.toString();
  }

  /**
   * @param slotName new slot, or {@code null} to detach the subscription from any slot
   */
  static String setSlotName(String name, String slotName) {
    StringBuilder sql = alter(name).append(" SET (slot_name = ");
    if (slotName == null) {
      sql.append("NONE");
    } else {
      literal(sql, slotName);
    }
    return sql.append(')').toString();
  }

  static String drop(String name) {
    StringBuilder sql = new StringBuilder("DROP SUBSCRIPTION ");
    identifier(sql, name);
    return sql.toString();
  }

  /**
   * Counts rows of {@code table}, optionally schema qualified as {@code schema.table}. With a
   * column, only rows whose column text equals the single bind parameter are counted.
   */
  static String countRows(String table, String column) {
    StringBuilder sql = new StringBuilder("SELECT count(*) AS n FROM ");
    int dot = table.indexOf('.');
    if (dot > 0) {
      identifier(sql, table.substring(0, dot));
      sql.append('.');
      identifier(sql, table.substring(dot + 1));
    } else {
      identifier(sql, table);
    }
    if (column != null) {
      sql.append(" WHERE ");
      identifier(sql, column);
      sql.append("::text = ?");
    }
    return sql.toString();
  }

  private static StringBuilder alter(String name) {
    StringBuilder sql = new StringBuilder("ALTER SUBSCRIPTION ");
    identifier(sql, name);
    return sql;
  }

  private static void identifierList(StringBuilder sql, Collection<String> names) {
    Iterator<String> it = names.iterator();
    while (it.hasNext()) {
      identifier(sql, it.next());
      if (it.hasNext()) {
        sql.append(", ");
      }
    }
  }

  private static void identifier(StringBuilder sql, String value) {
    try {
      Utils.escapeIdentifier(sql, value);
    } catch (SQLException e) {
      throw new IllegalArgumentException("invalid identifier: " + e.getMessage(), e);
    }
  }

  private static void literal(StringBuilder sql, String value) {
    sql.append('\'');
    try {
      Utils.escapeLiteral(sql, value, true);
    } catch (SQLException e) {
      throw new IllegalArgumentException("invalid literal: " + e.getMessage(), e);
    }
    sql.append('\'');
  }
}
