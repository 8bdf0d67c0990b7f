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

import java.util.List;
import org.junit.jupiter.api.Test;

class SubscriptionStatementsTest {

  @Test
  void rendersCreateWithExplicitOptions() {
    SubscriptionSpec spec = new SubscriptionSpec()
      .setName("orders_sub")
      .setConnInfo("host=publisher dbname=shop password='s3cret'")
      .setPublications(List.of("orders_pub", "refunds_pub"))
      .setEnabled(false)
      .setCreateSlot(false)
      .setSlotName("orders_slot")
      .setCopyData(false);

    assertEquals("CREATE SUBSCRIPTION \"orders_sub\" "
        + "CONNECTION 'host=publisher dbname=shop password=''s3cret''' "
        + "PUBLICATION \"orders_pub\", \"refunds_pub\" "
        + "WITH (enabled = false, connect = true, create_slot = false, slot_name = 'orders_slot', copy_data = false)",
      SubscriptionStatements.create(spec));
  }

  @Test
  void omitsSlotNameWhenDefaulted() {
    SubscriptionSpec spec = new SubscriptionSpec()
      .setName("orders_sub")
      .setConnInfo("host=publisher")
      .addPublication("orders_pub");

    assertEquals("CREATE SUBSCRIPTION \"orders_sub\" CONNECTION 'host=publisher' PUBLICATION \"orders_pub\" "
        + "WITH (enabled = true, connect = true, create_slot = true, copy_data = true)",
      SubscriptionStatements.create(spec));
  }

  @Test
  void quotesIdentifiers() {
    assertEquals("ALTER SUBSCRIPTION \"Mixed\"\"Case\" ENABLE", SubscriptionStatements.enable("Mixed\"Case"));
    assertEquals("DROP SUBSCRIPTION \"orders_sub\"", SubscriptionStatements.drop("orders_sub"));
  }

  @Test
  void rendersAlterForms() {
    assertEquals("ALTER SUBSCRIPTION \"s\" SET PUBLICATION \"a\", \"b\" WITH (refresh = true, copy_data = false)",
      SubscriptionStatements.setPublications("s", List.of("a", "b"), true, false));
    assertEquals("ALTER SUBSCRIPTION \"s\" SET PUBLICATION \"a\" WITH (refresh = false)",
      SubscriptionStatements.setPublications("s", List.of("a"), false, true));
    assertEquals("ALTER SUBSCRIPTION \"s\" SET (slot_name = NONE)", SubscriptionStatements.setSlotName("s", null));
    assertEquals("ALTER SUBSCRIPTION \"s\" SET (slot_name = 'x')", SubscriptionStatements.setSlotName("s", "x"));
    assertEquals("ALTER SUBSCRIPTION \"s\" CONNECTION 'host=h'", SubscriptionStatements.setConnection("s", "host=h"));
    assertEquals("ALTER SUBSCRIPTION \"s\" DISABLE", SubscriptionStatements.disable("s"));
  }

  @Test
  void rendersRowCounts() {
    assertEquals("SELECT count(*) AS n FROM \"orders\"", SubscriptionStatements.countRows("orders", null));
    assertEquals("SELECT count(*) AS n FROM \"sales\".\"orders\" WHERE \"status\"::text = ?",
      SubscriptionStatements.countRows("sales.orders", "status"));
  }
}
