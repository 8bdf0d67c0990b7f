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

import dev.henneberger.vertx.subscription.core.SubscriptionPhase;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Snapshot of one subscription as the catalog reports it. Never cached across operations.
 */
public final class SubscriptionState {

  /**
   * Prefix of the replication origin the server creates for every subscription.
   */
  public static final String ORIGIN_PREFIX = "pg_";

  private final String name;
  private final String database;
  private final boolean exists;
  private final long oid;
  private final boolean enabled;
  private final String slotName;
  private final Set<String> publications;
  private final String connInfo;

  private SubscriptionState(String name,
                            String database,
                            boolean exists,
                            long oid,
                            boolean enabled,
                            String slotName,
                            Collection<String> publications,
                            String connInfo) {
    this.name = Objects.requireNonNull(name, "name");
    this.database = Objects.requireNonNull(database, "database");
    this.exists = exists;
    this.oid = oid;
    this.enabled = enabled;
    this.slotName = slotName;
    this.publications = Collections.unmodifiableSet(new LinkedHashSet<>(publications));
    this.connInfo = connInfo;
  }

  public static SubscriptionState absent(String name, String database) {
    return new SubscriptionState(name, database, false, 0L, false, null, Set.of(), null);
  }

  public static SubscriptionState present(String name,
                                          String database,
                                          long oid,
                                          boolean enabled,
                                          String slotName,
                                          Collection<String> publications,
                                          String connInfo) {
    return new SubscriptionState(name, database, true, oid, enabled, slotName,
      publications == null ? Set.of() : publications, connInfo);
  }

  SubscriptionState withConnInfo(String connInfo) {
    return new SubscriptionState(name, database, exists, oid, enabled, slotName, publications, connInfo);
  }

  public static String originNameFor(long oid) {
    return ORIGIN_PREFIX + Long.toUnsignedString(oid);
  }

  public String name() {
    return name;
  }

  public String database() {
    return database;
  }

  public boolean exists() {
    return exists;
  }

  /**
   * Server-assigned identifier, meaningful only when {@link #exists()}.
   */
  public long oid() {
    return oid;
  }

  public boolean enabled() {
    return enabled;
  }

  /**
   * Associated slot, or {@code null} when the subscription has {@code slot_name = NONE}.
   */
  public String slotName() {
    return slotName;
  }

  public Set<String> publications() {
    return publications;
  }

  public String connInfo() {
    return connInfo;
  }

  /**
   * Name of the replication origin tracking replay progress, or {@code null} when absent.
   */
  public String originName() {
    return exists ? originNameFor(oid) : null;
  }

  public SubscriptionPhase phase() {
    return SubscriptionPhase.of(exists, enabled);
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject()
      .put("name", name)
      .put("database", database)
      .put("exists", exists);
    if (exists) {
      json.put("oid", oid)
        .put("enabled", enabled)
        .put("slotName", slotName)
        .put("originName", originName())
        .put("publications", new JsonArray(new ArrayList<>(publications)));
    }
    return json;
  }

  @Override
  public String toString() {
    if (!exists) {
      return "SubscriptionState{" + database + '.' + name + " absent}";
    }
    return "SubscriptionState{" + database + '.' + name
      + " oid=" + oid
      + " enabled=" + enabled
      + " slot=" + slotName
      + " publications=" + publications + '}';
  }
}
