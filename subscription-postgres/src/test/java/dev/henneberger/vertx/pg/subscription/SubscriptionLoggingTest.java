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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.henneberger.vertx.subscription.core.ListenerRegistration;
import io.vertx.core.Vertx;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.slf4j.Marker;
import org.slf4j.event.Level;
import org.slf4j.helpers.AbstractLogger;
import org.slf4j.helpers.MessageFormatter;

class SubscriptionLoggingTest {

  @Test
  void logsPhaseChangesWithStartPosition() throws Exception {
    Vertx vertx = Vertx.vertx();
    try {
      FakePostgres postgres = new FakePostgres();
      postgres.addSubscription("orders_sub", false, "orders_sub", "orders_pub");
      PostgresSubscriptionManager manager = new PostgresSubscriptionManager(vertx,
        new SubscriptionManagerOptions().setUser("replicator"), postgres);
      CapturingLogger logger = new CapturingLogger();
      ListenerRegistration registration = SubscriptionLogging.attachDefaultLogging(manager, logger, "warehouse");

      manager.setEnabled("warehouse", "orders_sub", true, Lsn.parse("0/16B4F50"))
        .toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
      waitFor(() -> !logger.lines.isEmpty());

      assertEquals("manager=warehouse subscription=orders_sub database=warehouse phase=ENABLED prev=DISABLED "
        + "startLsn=0/16B4F50", logger.lines.get(0));

      registration.cancel();
      manager.setEnabled("warehouse", "orders_sub", false)
        .toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
      Thread.sleep(100);
      assertEquals(1, logger.lines.size());
    } finally {
      vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }
  }

  private static void waitFor(java.util.function.BooleanSupplier condition) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (!condition.getAsBoolean() && System.nanoTime() < deadline) {
      Thread.sleep(10);
    }
    assertTrue(condition.getAsBoolean());
  }

  private static final class CapturingLogger extends AbstractLogger {
    final List<String> lines = new CopyOnWriteArrayList<>();

    CapturingLogger() {
      this.name = "capturing";
    }

    @Override
    protected String getFullyQualifiedCallerName() {
      return null;
    }

    @Override
    protected void handleNormalizedLoggingCall(Level level, Marker marker, String messagePattern,
                                               Object[] arguments, Throwable throwable) {
      lines.add(MessageFormatter.basicArrayFormat(messagePattern, arguments));
    }

    @Override
    public boolean isTraceEnabled() {
      return false;
    }

    @Override
    public boolean isTraceEnabled(Marker marker) {
      return false;
    }

    @Override
    public boolean isDebugEnabled() {
      return false;
    }

    @Override
    public boolean isDebugEnabled(Marker marker) {
      return false;
    }

    @Override
    public boolean isInfoEnabled() {
      return true;
    }

    @Override
    public boolean isInfoEnabled(Marker marker) {
      return true;
    }

    @Override
    public boolean isWarnEnabled() {
      return true;
    }

    @Override
    public boolean isWarnEnabled(Marker marker) {
      return true;
    }

    @Override
    public boolean isErrorEnabled() {
      return true;
    }

    @Override
    public boolean isErrorEnabled(Marker marker) {
      return true;
    }
  }
}
