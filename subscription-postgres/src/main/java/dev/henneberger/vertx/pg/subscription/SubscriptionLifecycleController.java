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
import dev.henneberger.vertx.subscription.core.ListenerRegistration;
import dev.henneberger.vertx.subscription.core.ServerErrorException;
import dev.henneberger.vertx.subscription.core.StateConflictException;
import dev.henneberger.vertx.subscription.core.StateReadException;
import dev.henneberger.vertx.subscription.core.SubscriptionPhase;
import dev.henneberger.vertx.subscription.core.SubscriptionPhaseChange;
import io.vertx.core.Handler;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Blocking lifecycle operations for a single subscription: create, enable or disable, update and
 * drop. Every operation reads the current catalog state first and issues only the statements the
 * observed state requires, so repeating a successful call is a no-op.
 *
 * <p>Instances are thread-safe; each call opens its own session.
 */
public final class SubscriptionLifecycleController {

  private static final Logger LOG = LoggerFactory.getLogger(SubscriptionLifecycleController.class);

  private final ConnectionGateway gateway;
  private final SubscriptionStateReader reader;
  private final ReplicationOriginReconciler reconciler;
  private final boolean cleanupOriginOnDrop;
  private final List<Handler<SubscriptionPhaseChange>> phaseListeners = new CopyOnWriteArrayList<>();

  public SubscriptionLifecycleController(ConnectionGateway gateway) {
    this(gateway, true);
  }

  public SubscriptionLifecycleController(ConnectionGateway gateway, boolean cleanupOriginOnDrop) {
    this(gateway, new SubscriptionStateReader(gateway), new ReplicationOriginReconciler(gateway),
      cleanupOriginOnDrop);
  }

  SubscriptionLifecycleController(ConnectionGateway gateway,
                                  SubscriptionStateReader reader,
                                  ReplicationOriginReconciler reconciler,
                                  boolean cleanupOriginOnDrop) {
    this.gateway = Objects.requireNonNull(gateway, "gateway");
    this.reader = Objects.requireNonNull(reader, "reader");
    this.reconciler = Objects.requireNonNull(reconciler, "reconciler");
    this.cleanupOriginOnDrop = cleanupOriginOnDrop;
  }

  /**
   * Registers a listener notified after every operation that moved a subscription between phases.
   * Listeners run on the calling thread.
   */
  public ListenerRegistration onPhaseChange(Handler<SubscriptionPhaseChange> listener) {
    Objects.requireNonNull(listener, "listener");
    phaseListeners.add(listener);
    return () -> phaseListeners.remove(listener);
  }

  public SubscriptionState read(String database, String name) {
    return reader.read(database, name);
  }

  /**
   * Current WAL insert position of the server behind {@code database}. Used to pick a start
   * position on the publisher before enabling a subscription elsewhere.
   */
  public Lsn currentWalLsn(String database) {
    Objects.requireNonNull(database, "database");
    try (DatabaseSession session = gateway.open(database)) {
      String lsn = session.queryFirst(SubscriptionStatements.CURRENT_WAL_LSN, List.of(), row -> row.getString("lsn"))
        .orElseThrow(() -> new SQLException("pg_current_wal_lsn() returned no row"));
      return Lsn.parse(lsn);
    } catch (SQLException e) {
      throw new StateReadException(null, "could not read the current WAL position of " + database + ": "
        + e.getMessage(), e);
    }
  }

  /**
   * Creates the subscription. Creating a subscription that already exists with the same
   * publications, slot, enabled flag and connection string succeeds without changes.
   */
  public SubscriptionState create(SubscriptionSpec spec) {
    Objects.requireNonNull(spec, "spec");
    SubscriptionTransitions.checkCreate(spec);
    spec.validate();
    String name = spec.getName();

    try (DatabaseSession session = open(spec.getDatabase(), name)) {
      try {
        session.execute(SubscriptionStatements.create(spec));
      } catch (SQLException e) {
        if (!PostgresErrors.isAlreadyExists(e)) {
          throw PostgresErrors.translate(name, e);
        }
        SubscriptionState existing = reader.withConnInfo(session, reader.read(session, name));
        if (!existing.exists() || !sameDefinition(spec, existing)) {
          throw new ServerErrorException(name, e);
        }
        LOG.info("Subscription {} already exists in {} with the requested definition", name, spec.getDatabase());
        return existing;
      }

      SubscriptionState created = reader.read(session, name);
      if (!created.exists()) {
        throw new StateConflictException(name, "subscription " + name + " disappeared right after it was created");
      }
      LOG.info("Created subscription {} in {} (enabled={}, slot={}, createSlot={}, copyData={})",
        name, spec.getDatabase(), created.enabled(), created.slotName(), spec.isCreateSlot(), spec.isCopyData());
      publish(created, SubscriptionPhase.ABSENT, null);
      return created;
    } catch (SQLException e) {
      throw PostgresErrors.translate(name, e);
    }
  }

  /**
   * Moves the subscription to the requested enabled flag. {@code startLsn} positions replication
   * and is only accepted on the disabled to enabled edge; it is applied in the same transaction as
   * the enable so the apply worker never starts from the old position.
   */
  public SubscriptionState setEnabled(String database, String name, boolean enabled, Lsn startLsn) {
    Objects.requireNonNull(database, "database");
    Objects.requireNonNull(name, "name");
    try (DatabaseSession session = open(database, name)) {
      SubscriptionState current = reader.read(session, name);
      SubscriptionTransitions.Edge edge = SubscriptionTransitions.plan(current, enabled, startLsn);
      if (edge == SubscriptionTransitions.Edge.NONE) {
        LOG.debug("Subscription {} is already {}", name, current.phase());
        return current;
      }
      applyEdge(session, current, edge, startLsn);
      SubscriptionState after = readExisting(session, name);
      publish(after, current.phase(), startLsn);
      return after;
    } catch (SQLException e) {
      throw PostgresErrors.translate(name, e);
    }
  }

  /**
   * Brings an existing subscription in line with {@code spec}: publications, slot name, connection
   * string and enabled flag. Only differing attributes are altered. A start position in the spec
   * follows the same rules as {@link #setEnabled(String, String, boolean, Lsn)}.
   */
  public SubscriptionState update(SubscriptionSpec spec) {
    Objects.requireNonNull(spec, "spec");
    spec.validate();
    String name = spec.getName();

    try (DatabaseSession session = open(spec.getDatabase(), name)) {
      SubscriptionState current = reader.read(session, name);
      SubscriptionTransitions.Edge edge = SubscriptionTransitions.plan(current, spec.isEnabled(), spec.getStartLsn());
      current = reader.withConnInfo(session, current);

      // slot changes are refused on an enabled subscription, so disable before altering
      SubscriptionState base = current;
      if (edge == SubscriptionTransitions.Edge.DISABLE) {
        applyEdge(session, current, edge, null);
        base = reader.withConnInfo(session, readExisting(session, name));
      }

      List<String> alters = alterations(spec, base);
      for (String sql : alters) {
        executeAlter(session, name, sql);
      }

      if (edge == SubscriptionTransitions.Edge.ENABLE || edge == SubscriptionTransitions.Edge.ENABLE_AT_LSN) {
        applyEdge(session, base, edge, spec.getStartLsn());
      }

      if (edge == SubscriptionTransitions.Edge.NONE && alters.isEmpty()) {
        LOG.debug("Subscription {} already matches the requested definition", name);
        return current;
      }
      SubscriptionState after = readExisting(session, name);
      LOG.info("Updated subscription {} in {} ({} alteration(s), transition {})",
        name, spec.getDatabase(), alters.size(), edge);
      publish(after, current.phase(), spec.getStartLsn());
      return after;
    } catch (SQLException e) {
      throw PostgresErrors.translate(name, e);
    }
  }

  /**
   * Drops the subscription. Dropping an absent subscription succeeds. With {@code dropSlot} the
   * publisher-side slot is dropped too, and a slot that is already gone there is not an error.
   * Without it the slot is detached first and left on the publisher.
   */
  public void drop(String database, String name, boolean dropSlot) {
    Objects.requireNonNull(database, "database");
    Objects.requireNonNull(name, "name");
    SubscriptionState current;
    try (DatabaseSession session = open(database, name)) {
      current = reader.read(session, name);
      if (!current.exists()) {
        LOG.info("Subscription {} is already absent from {}", name, database);
        return;
      }
      if (dropSlot) {
        dropWithSlot(session, current);
      } else {
        dropDetached(session, name);
      }
    } catch (SQLException e) {
      throw PostgresErrors.translate(name, e);
    }
    LOG.info("Dropped subscription {} from {} (dropSlot={})", name, database, dropSlot);
    publish(SubscriptionState.absent(name, database), current.phase(), null);

    if (cleanupOriginOnDrop) {
      cleanupOrigin(database, current);
    }
  }

  private void applyEdge(DatabaseSession session,
                         SubscriptionState current,
                         SubscriptionTransitions.Edge edge,
                         Lsn startLsn) throws SQLException {
    String name = current.name();
    switch (edge) {
      case ENABLE:
        executeAlter(session, name, SubscriptionStatements.enable(name));
        LOG.info("Enabled subscription {} in {}", name, current.database());
        break;
      case DISABLE:
        executeAlter(session, name, SubscriptionStatements.disable(name));
        LOG.info("Disabled subscription {} in {}", name, current.database());
        break;
      case ENABLE_AT_LSN:
        enableAt(session, current, startLsn);
        LOG.info("Enabled subscription {} in {} starting at {}", name, current.database(), startLsn);
        break;
      default:
        break;
    }
  }

  private void enableAt(DatabaseSession session, SubscriptionState current, Lsn startLsn) throws SQLException {
    String name = current.name();
    try {
      session.inTransaction(tx -> {
        SubscriptionState locked = reader.read(tx, name);
        if (!locked.exists() || locked.oid() != current.oid()) {
          throw new StateConflictException(name, "subscription " + name + " was dropped or recreated concurrently");
        }
        if (locked.enabled()) {
          throw new StateConflictException(name, "subscription " + name + " was enabled concurrently");
        }
        tx.execute(SubscriptionStatements.ADVANCE_ORIGIN, List.of(locked.originName(), startLsn.toString()));
        tx.execute(SubscriptionStatements.enable(name));
        return null;
      });
    } catch (SQLException e) {
      throw conflictOrTranslate(name, e);
    }
  }

  private void dropWithSlot(DatabaseSession session, SubscriptionState current) throws SQLException {
    String name = current.name();
    try {
      session.execute(SubscriptionStatements.drop(name));
    } catch (SQLException e) {
      if (PostgresErrors.isSubscriptionMissing(e)) {
        LOG.info("Subscription {} was dropped concurrently", name);
        return;
      }
      if (!PostgresErrors.isRemoteSlotMissing(e)) {
        throw PostgresErrors.translate(name, e);
      }
      LOG.warn("Replication slot {} of subscription {} no longer exists on the publisher; dropping without it",
        current.slotName(), name);
      dropDetached(session, name);
    }
  }

  private void dropDetached(DatabaseSession session, String name) throws SQLException {
    try {
      session.inTransaction(tx -> {
        SubscriptionState locked = reader.read(tx, name);
        if (!locked.exists()) {
          return null;
        }
        if (locked.enabled()) {
          tx.execute(SubscriptionStatements.disable(name));
        }
        if (locked.slotName() != null) {
          tx.execute(SubscriptionStatements.setSlotName(name, null));
        }
        tx.execute(SubscriptionStatements.drop(name));
        return null;
      });
    } catch (SQLException e) {
      if (PostgresErrors.isSubscriptionMissing(e)) {
        LOG.info("Subscription {} was dropped concurrently", name);
        return;
      }
      throw PostgresErrors.translate(name, e);
    }
  }

  private void cleanupOrigin(String database, SubscriptionState dropped) {
    String origin = dropped.originName();
    try {
      reconciler.dropOriginIfOrphaned(database, origin);
    } catch (SQLException | RuntimeException e) {
      LOG.warn("Could not clean up replication origin {} of dropped subscription {}: {}",
        origin, dropped.name(), e.getMessage());
    }
  }

  private List<String> alterations(SubscriptionSpec spec, SubscriptionState current) {
    String name = spec.getName();
    List<String> alters = new ArrayList<>();
    if (!spec.getPublications().equals(current.publications())) {
      alters.add(SubscriptionStatements.setPublications(name, spec.getPublications(), current.enabled(),
        spec.isCopyData()));
    }
    String slot = spec.effectiveSlotName();
    if (!Objects.equals(slot, current.slotName())) {
      alters.add(SubscriptionStatements.setSlotName(name, slot));
    }
    if (current.connInfo() == null) {
      LOG.debug("Connection string of subscription {} is not readable by this role; leaving it unchanged", name);
    } else if (!current.connInfo().equals(spec.getConnInfo())) {
      alters.add(SubscriptionStatements.setConnection(name, spec.getConnInfo()));
    }
    return alters;
  }

  private static boolean sameDefinition(SubscriptionSpec spec, SubscriptionState existing) {
    return spec.getPublications().equals(existing.publications())
      && Objects.equals(spec.effectiveSlotName(), existing.slotName())
      && spec.isEnabled() == existing.enabled()
      && (existing.connInfo() == null || existing.connInfo().equals(spec.getConnInfo()));
  }

  private void executeAlter(DatabaseSession session, String name, String sql) {
    try {
      session.execute(sql);
    } catch (SQLException e) {
      throw conflictOrTranslate(name, e);
    }
  }

  private SubscriptionState readExisting(DatabaseSession session, String name) throws SQLException {
    SubscriptionState state = reader.read(session, name);
    if (!state.exists()) {
      throw new StateConflictException(name, "subscription " + name + " was dropped concurrently");
    }
    return state;
  }

  private RuntimeException conflictOrTranslate(String name, SQLException e) {
    if (PostgresErrors.isSubscriptionMissing(e)) {
      return new StateConflictException(name, "subscription " + name + " was dropped concurrently", e);
    }
    if (PostgresErrors.OBJECT_IN_USE.equals(e.getSQLState())) {
      return new StateConflictException(name, e.getMessage(), e);
    }
    return PostgresErrors.translate(name, e);
  }

  private DatabaseSession open(String database, String name) {
    try {
      return gateway.open(database);
    } catch (SQLException e) {
      throw new ConnectionFailedException(name, "could not connect to " + database + ": " + e.getMessage(), e);
    }
  }

  private void publish(SubscriptionState after, SubscriptionPhase previous, Lsn startLsn) {
    if (after.phase() == previous) {
      return;
    }
    SubscriptionPhaseChange change = new SubscriptionPhaseChange(after.name(), after.database(), previous,
      after.phase(), startLsn == null ? null : startLsn.toString());
    for (Handler<SubscriptionPhaseChange> listener : phaseListeners) {
      try {
        listener.handle(change);
      } catch (RuntimeException e) {
        LOG.warn("Phase listener failed for subscription {}", after.name(), e);
      }
    }
  }
}
