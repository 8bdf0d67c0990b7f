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
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * In-memory stand-in for one cluster. It answers the catalog queries issued by this module,
 * applies the subscription statements it recognises, and records everything in {@link #log()}.
 */
final class FakePostgres implements ConnectionGateway {

  static final class Subscription {
    final String name;
    final long oid;
    boolean enabled;
    String slotName;
    List<String> publications;
    String connInfo;

    Subscription(String name, long oid, boolean enabled, String slotName, Collection<String> publications,
                 String connInfo) {
      this.name = name;
      this.oid = oid;
      this.enabled = enabled;
      this.slotName = slotName;
      this.publications = new ArrayList<>(publications);
      this.connInfo = connInfo;
    }

    Subscription copy() {
      return new Subscription(name, oid, enabled, slotName, publications, connInfo);
    }
  }

  private static final class ScriptedFailure {
    final Predicate<String> matcher;
    final SQLException error;
    int remaining;

    ScriptedFailure(Predicate<String> matcher, SQLException error, int remaining) {
      this.matcher = matcher;
      this.error = error;
      this.remaining = remaining;
    }
  }

  private Map<String, Subscription> subscriptions = new LinkedHashMap<>();
  private Set<String> origins = new TreeSet<>();
  private final List<String> log = new ArrayList<>();
  private final List<List<?>> executedParams = new ArrayList<>();
  private final List<ScriptedFailure> failures = new ArrayList<>();
  private final Map<String, String> settings = new HashMap<>();
  private final Map<String, Long> rowCounts = new HashMap<>();
  private Subscription createResult;
  private boolean superuser = true;
  private boolean connInfoReadable = true;
  private boolean dropLeavesOrigin;
  private String walLsn = "0/3000060";
  private long nextOid = 16400;
  private SQLException openFailure;
  private int openSessions;

  FakePostgres() {
    settings.put("server_version_num", "160002");
    settings.put("max_logical_replication_workers", "4");
    settings.put("max_replication_slots", "10");
  }

  Subscription addSubscription(String name, boolean enabled, String slotName, String... publications) {
    Subscription sub = new Subscription(name, nextOid++, enabled, slotName, List.of(publications),
      "host=publisher dbname=src");
    subscriptions.put(name, sub);
    origins.add(SubscriptionState.originNameFor(sub.oid));
    return sub;
  }

  Subscription subscription(String name) {
    return subscriptions.get(name);
  }

  void removeSubscription(String name) {
    subscriptions.remove(name);
  }

  void addOrigin(String origin) {
    origins.add(origin);
  }

  Set<String> origins() {
    return origins;
  }

  /**
   * Row installed when the next {@code CREATE SUBSCRIPTION} is executed.
   */
  void onCreate(String name, boolean enabled, String slotName, String... publications) {
    createResult = new Subscription(name, nextOid++, enabled, slotName, List.of(publications),
      "host=publisher dbname=src");
  }

  void failOn(String sqlPrefix, SQLException error) {
    failOn(sqlPrefix, error, Integer.MAX_VALUE);
  }

  void failOn(String sqlPrefix, SQLException error, int times) {
    failures.add(new ScriptedFailure(sql -> sql.startsWith(sqlPrefix), error, times));
  }

  void failOpen(SQLException error) {
    openFailure = error;
  }

  void setting(String name, String value) {
    settings.put(name, value);
  }

  void superuser(boolean superuser) {
    this.superuser = superuser;
  }

  /**
   * Models a role without SELECT on {@code pg_subscription.subconninfo}, which is every role
   * that is not a superuser.
   */
  void connInfoReadable(boolean connInfoReadable) {
    this.connInfoReadable = connInfoReadable;
  }

  /**
   * Models an origin that survives its subscription, as after a crash mid-drop.
   */
  void dropLeavesOrigin(boolean dropLeavesOrigin) {
    this.dropLeavesOrigin = dropLeavesOrigin;
  }

  void walLsn(String walLsn) {
    this.walLsn = walLsn;
  }

  void rowCount(String sql, long count) {
    rowCounts.put(sql, count);
  }

  List<String> log() {
    return log;
  }

  List<String> statements() {
    List<String> out = new ArrayList<>();
    for (String entry : log) {
      if (!entry.startsWith("SELECT") && !entry.equals("BEGIN") && !entry.equals("COMMIT")
        && !entry.equals("ROLLBACK")) {
        out.add(entry);
      }
    }
    return out;
  }

  List<?> paramsOf(String sql) {
    for (int i = log.size() - 1, p = executedParams.size() - 1; i >= 0; i--) {
      String entry = log.get(i);
      if (entry.equals("BEGIN") || entry.equals("COMMIT") || entry.equals("ROLLBACK")) {
        continue;
      }
      if (entry.equals(sql)) {
        return executedParams.get(p);
      }
      p--;
    }
    return null;
  }

  int openSessions() {
    return openSessions;
  }

  static SQLException sqlError(String sqlState, String message) {
    return new SQLException(message, sqlState);
  }

  @Override
  public DatabaseSession open(String database) throws SQLException {
    if (openFailure != null) {
      throw openFailure;
    }
    openSessions++;
    return new Session(database);
  }

  private final class Session implements DatabaseSession {
    private final String database;
    private boolean inTransaction;

    Session(String database) {
      this.database = database;
    }

    @Override
    public String database() {
      return database;
    }

    @Override
    public <T> List<T> query(String sql, List<?> params, RowMapper<T> mapper) throws SQLException {
      record(sql, params);
      List<T> out = new ArrayList<>();
      for (Map<String, Object> row : rows(sql, params)) {
        out.add(mapper.map(new MapRow(row)));
      }
      return out;
    }

    @Override
    public void execute(String sql, List<?> params) throws SQLException {
      record(sql, params);
      apply(sql, params);
    }

    @Override
    public <T> T inTransaction(Work<T> work) throws SQLException {
      if (inTransaction) {
        throw new IllegalStateException("transactions do not nest");
      }
      Map<String, Subscription> savedSubscriptions = new LinkedHashMap<>();
      subscriptions.forEach((name, sub) -> savedSubscriptions.put(name, sub.copy()));
      Set<String> savedOrigins = new TreeSet<>(origins);
      inTransaction = true;
      log.add("BEGIN");
      try {
        T result = work.run(this);
        log.add("COMMIT");
        return result;
      } catch (SQLException | RuntimeException | Error e) {
        subscriptions = savedSubscriptions;
        origins = savedOrigins;
        log.add("ROLLBACK");
        throw e;
      } finally {
        inTransaction = false;
      }
    }

    @Override
    public void close() {
      openSessions--;
    }
  }

  private void record(String sql, List<?> params) throws SQLException {
    log.add(sql);
    executedParams.add(params);
    for (ScriptedFailure failure : failures) {
      if (failure.remaining > 0 && failure.matcher.test(sql)) {
        failure.remaining--;
        throw failure.error;
      }
    }
  }

  private List<Map<String, Object>> rows(String sql, List<?> params) {
    if (sql.equals(SubscriptionStateReader.SELECT_SUBSCRIPTION)) {
      Subscription sub = subscriptions.get((String) params.get(0));
      if (sub == null) {
        return List.of();
      }
      Map<String, Object> row = new HashMap<>();
      row.put("oid", sub.oid);
      row.put("enabled", sub.enabled);
      row.put("slot_name", sub.slotName);
      row.put("publications", new ArrayList<>(sub.publications));
      return List.of(row);
    }
    if (sql.equals(SubscriptionStateReader.CONNINFO_READABLE)) {
      return List.of(Map.of("readable", connInfoReadable));
    }
    if (sql.equals(SubscriptionStateReader.SELECT_CONNINFO)) {
      if (!connInfoReadable) {
        throw new IllegalStateException("conninfo selected without column privilege");
      }
      long oid = (Long) params.get(0);
      for (Subscription sub : subscriptions.values()) {
        if (sub.oid == oid) {
          Map<String, Object> row = new HashMap<>();
          row.put("conninfo", sub.connInfo);
          return List.of(row);
        }
      }
      return List.of();
    }
    if (sql.equals(ReplicationOriginReconciler.SELECT_ORPHANED_ORIGINS)) {
      List<Map<String, Object>> out = new ArrayList<>();
      for (String origin : origins) {
        if (origin.matches("^pg_[0-9]+$") && !owned(origin)) {
          out.add(Map.of("origin", origin));
        }
      }
      return out;
    }
    if (sql.equals(ReplicationOriginReconciler.SELECT_ORIGIN)) {
      String origin = (String) params.get(0);
      return origins.contains(origin) ? List.of(Map.of("origin", origin)) : List.of();
    }
    if (sql.equals(ReplicationOriginReconciler.SELECT_ORIGIN_IF_ORPHANED)) {
      String origin = (String) params.get(0);
      return origins.contains(origin) && !owned(origin) ? List.of(Map.of("origin", origin)) : List.of();
    }
    if (sql.equals(SubscriptionStatements.CURRENT_WAL_LSN)) {
      return List.of(Map.of("lsn", walLsn));
    }
    if (sql.equals(SubscriptionPreflight.CURRENT_SETTING)) {
      String value = settings.get((String) params.get(0));
      return value == null ? List.of() : List.of(Map.of("value", value));
    }
    if (sql.equals(SubscriptionPreflight.ROLE_IS_SUPERUSER)) {
      return List.of(Map.of("superuser", superuser));
    }
    Long count = rowCounts.get(sql);
    if (count != null) {
      return List.of(Map.of("n", count));
    }
    throw new IllegalStateException("unexpected query: " + sql);
  }

  private void apply(String sql, List<?> params) throws SQLException {
    if (sql.startsWith("CREATE SUBSCRIPTION ")) {
      if (createResult == null) {
        throw new IllegalStateException("no onCreate result scripted for: " + sql);
      }
      subscriptions.put(createResult.name, createResult);
      origins.add(SubscriptionState.originNameFor(createResult.oid));
      createResult = null;
      return;
    }
    if (sql.equals(SubscriptionStatements.ADVANCE_ORIGIN)) {
      if (!origins.contains((String) params.get(0))) {
        throw sqlError("42704", "replication origin \"" + params.get(0) + "\" does not exist");
      }
      return;
    }
    if (sql.equals(SubscriptionStatements.DROP_ORIGIN)) {
      if (!origins.remove((String) params.get(0))) {
        throw sqlError("42704", "replication origin \"" + params.get(0) + "\" does not exist");
      }
      return;
    }
    for (Subscription sub : new ArrayList<>(subscriptions.values())) {
      String name = sub.name;
      if (sql.equals(SubscriptionStatements.enable(name))) {
        sub.enabled = true;
        return;
      }
      if (sql.equals(SubscriptionStatements.disable(name))) {
        sub.enabled = false;
        return;
      }
      if (sql.equals(SubscriptionStatements.setSlotName(name, null))) {
        sub.slotName = null;
        return;
      }
      if (sql.equals(SubscriptionStatements.drop(name))) {
        subscriptions.remove(name);
        if (!dropLeavesOrigin) {
          origins.remove(SubscriptionState.originNameFor(sub.oid));
        }
        return;
      }
      if (sql.startsWith(SubscriptionStatements.drop(name).replace("DROP", "ALTER") + " ")) {
        applyAlter(sub, sql);
        return;
      }
    }
    if (sql.startsWith("ALTER SUBSCRIPTION ") || sql.startsWith("DROP SUBSCRIPTION ")) {
      throw sqlError("42704", "subscription does not exist");
    }
  }

  private static void applyAlter(Subscription sub, String sql) {
    String rest = sql.substring(("ALTER SUBSCRIPTION \"" + sub.name + "\" ").length());
    if (rest.startsWith("SET PUBLICATION ")) {
      String list = rest.substring("SET PUBLICATION ".length(), rest.indexOf(" WITH ("));
      Set<String> pubs = new LinkedHashSet<>();
      for (String part : list.split(", ")) {
        pubs.add(part.substring(1, part.length() - 1));
      }
      sub.publications = new ArrayList<>(pubs);
    } else if (rest.startsWith("SET (slot_name = '")) {
      sub.slotName = rest.substring("SET (slot_name = '".length(), rest.length() - 2);
    } else if (rest.startsWith("CONNECTION '")) {
      sub.connInfo = rest.substring("CONNECTION '".length(), rest.length() - 1);
    }
  }

  private boolean owned(String origin) {
    for (Subscription sub : subscriptions.values()) {
      if (origin.equals(SubscriptionState.originNameFor(sub.oid))) {
        return true;
      }
    }
    return false;
  }

  private static final class MapRow implements SqlRow {
    private final Map<String, Object> values;

    MapRow(Map<String, Object> values) {
      this.values = values;
    }

    @Override
    public String getString(String column) {
      Object value = values.get(column);
      return value == null ? null : value.toString();
    }

    @Override
    public long getLong(String column) {
      Object value = values.get(column);
      return value == null ? 0L : ((Number) value).longValue();
    }

    @Override
    public boolean getBoolean(String column) {
      return Boolean.TRUE.equals(values.get(column));
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<String> getStringList(String column) {
      Object value = values.get(column);
      return value == null ? List.of() : (List<String>) value;
    }
  }
}
