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

import dev.henneberger.vertx.subscription.core.InvalidSpecException;
import dev.henneberger.vertx.subscription.core.OptionValidation;
import io.vertx.codegen.annotations.DataObject;
import io.vertx.codegen.annotations.GenIgnore;
import io.vertx.codegen.json.annotations.JsonGen;
import io.vertx.core.json.JsonObject;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Desired state of one subscription. Supplied per operation and never persisted.
 *
 * <p>Defaults follow {@code CREATE SUBSCRIPTION}: enabled, connect, create_slot and copy_data are
 * all {@code true}, and the slot is named after the subscription.
 */
@DataObject
@JsonGen(publicConverter = false)
public class SubscriptionSpec {

  private String name;
  private String database;
  private String connInfo;
  private Set<String> publications = new LinkedHashSet<>();
  private boolean enabled;
  private boolean createSlot;
  private String slotName;
  private boolean copyData;
  private boolean connect;
  private Lsn startLsn;

  public SubscriptionSpec() {
    init();
  }

  public SubscriptionSpec(JsonObject json) {
    init();
    SubscriptionSpecConverter.fromJson(json, this);
  }

  public SubscriptionSpec(SubscriptionSpec other) {
    this.name = other.name;
    this.database = other.database;
    this.connInfo = other.connInfo;
    this.publications = new LinkedHashSet<>(other.publications);
    this.enabled = other.enabled;
    this.createSlot = other.createSlot;
    this.slotName = other.slotName;
    this.copyData = other.copyData;
    this.connect = other.connect;
    this.startLsn = other.startLsn;
  }

  public String getName() {
    return name;
  }

  public SubscriptionSpec setName(String name) {
    this.name = name;
    return this;
  }

  public String getDatabase() {
    return database;
  }

  public SubscriptionSpec setDatabase(String database) {
    this.database = database;
    return this;
  }

  public String getConnInfo() {
    return connInfo;
  }

  public SubscriptionSpec setConnInfo(String connInfo) {
    this.connInfo = connInfo;
    return this;
  }

  public Set<String> getPublications() {
    return Collections.unmodifiableSet(publications);
  }

  public SubscriptionSpec setPublications(Collection<String> publications) {
    this.publications = publications == null ? new LinkedHashSet<>() : new LinkedHashSet<>(publications);
    return this;
  }

  public SubscriptionSpec addPublication(String publication) {
    this.publications.add(publication);
    return this;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public SubscriptionSpec setEnabled(boolean enabled) {
    this.enabled = enabled;
    return this;
  }

  public boolean isCreateSlot() {
    return createSlot;
  }

  public SubscriptionSpec setCreateSlot(boolean createSlot) {
    this.createSlot = createSlot;
    return this;
  }

  public String getSlotName() {
    return slotName;
  }

  public SubscriptionSpec setSlotName(String slotName) {
    this.slotName = slotName;
    return this;
  }

  /**
   * Slot name the server will associate with the subscription.
   */
  public String effectiveSlotName() {
    return slotName == null || slotName.isBlank() ? name : slotName;
  }

  public boolean isCopyData() {
    return copyData;
  }

  public SubscriptionSpec setCopyData(boolean copyData) {
    this.copyData = copyData;
    return this;
  }

  public boolean isConnect() {
    return connect;
  }

  public SubscriptionSpec setConnect(boolean connect) {
    this.connect = connect;
    return this;
  }

  @GenIgnore
  public Lsn getStartLsn() {
    return startLsn;
  }

  @GenIgnore
  public SubscriptionSpec setStartLsn(Lsn startLsn) {
    this.startLsn = startLsn;
    return this;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    SubscriptionSpecConverter.toJson(this, json);
    return json;
  }

  /**
   * Checks the fields on their own. Whether {@code startLsn} is allowed depends on the observed
   * state and is decided by {@link SubscriptionTransitions}.
   *
   * @throws InvalidSpecException if a field is missing or the combination is refused by the server
   */
  public void validate() {
    try {
      OptionValidation.require("name", name);
      OptionValidation.require("database", database);
      OptionValidation.require("connInfo", connInfo);
      OptionValidation.requireNotEmpty("publications", publications);
      for (String publication : publications) {
        OptionValidation.require("publication", publication);
      }
    } catch (IllegalArgumentException e) {
      throw new InvalidSpecException(name, e.getMessage(), e);
    }
    if (!createSlot && (slotName == null || slotName.isBlank())) {
      throw new InvalidSpecException(name, "slotName is required when createSlot is false");
    }
    if (!connect && (enabled || createSlot || copyData)) {
      throw new InvalidSpecException(name, "connect = false requires enabled, createSlot and copyData to be false");
    }
  }

  private void init() {
    publications = new LinkedHashSet<>();
    enabled = true;
    createSlot = true;
    copyData = true;
    connect = true;
    startLsn = null;
  }
}
