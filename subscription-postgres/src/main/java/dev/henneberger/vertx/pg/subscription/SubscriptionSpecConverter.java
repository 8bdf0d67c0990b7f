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

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.List;

final class SubscriptionSpecConverter {

  private SubscriptionSpecConverter() {
  }

  static void fromJson(JsonObject json, SubscriptionSpec spec) {
    if (json == null) {
      return;
    }

    if (json.containsKey("name")) {
      spec.setName(json.getString("name"));
    }
    if (json.containsKey("database")) {
      spec.setDatabase(json.getString("database"));
    }
    if (json.containsKey("connInfo")) {
      spec.setConnInfo(json.getString("connInfo"));
    }

    JsonArray publicationsJson = json.getJsonArray("publications");
    if (publicationsJson != null) {
      List<String> publications = new ArrayList<>();
      for (Object publication : publicationsJson) {
        publications.add(String.valueOf(publication));
      }
      spec.setPublications(publications);
    }

    if (json.containsKey("enabled")) {
      spec.setEnabled(json.getBoolean("enabled"));
    }
    if (json.containsKey("createSlot")) {
      spec.setCreateSlot(json.getBoolean("createSlot"));
    }
    if (json.containsKey("slotName")) {
      spec.setSlotName(json.getString("slotName"));
    }
    if (json.containsKey("copyData")) {
      spec.setCopyData(json.getBoolean("copyData"));
    }
    if (json.containsKey("connect")) {
      spec.setConnect(json.getBoolean("connect"));
    }

    String startLsn = json.getString("startLsn");
    if (startLsn != null && !startLsn.isBlank()) {
      spec.setStartLsn(Lsn.parse(startLsn));
    }
  }

  static void toJson(SubscriptionSpec spec, JsonObject json) {
    json.put("name", spec.getName());
    json.put("database", spec.getDatabase());
    json.put("connInfo", spec.getConnInfo());
    json.put("publications", new JsonArray(new ArrayList<>(spec.getPublications())));
    json.put("enabled", spec.isEnabled());
    json.put("createSlot", spec.isCreateSlot());
    json.put("slotName", spec.getSlotName());
    json.put("copyData", spec.isCopyData());
    json.put("connect", spec.isConnect());
    if (spec.getStartLsn() != null) {
      json.put("startLsn", spec.getStartLsn().toString());
    }
  }
}
