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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of an orphaned replication origin sweep. One failed drop never hides the others.
 */
public final class OriginSweepReport {

  public static final class Failure {
    private final String originName;
    private final String message;
    private final Throwable cause;

    public Failure(String originName, String message, Throwable cause) {
      this.originName = Objects.requireNonNull(originName, "originName");
      this.message = Objects.requireNonNull(message, "message");
      this.cause = cause;
    }

    public String originName() {
      return originName;
    }

    public String message() {
      return message;
    }

    public Throwable cause() {
      return cause;
    }

    @Override
    public String toString() {
      return originName + ": " + message;
    }
  }

  private static final OriginSweepReport EMPTY = new OriginSweepReport(List.of(), List.of());

  private final List<String> cleaned;
  private final List<Failure> failures;

  private OriginSweepReport(List<String> cleaned, List<Failure> failures) {
    this.cleaned = Collections.unmodifiableList(new ArrayList<>(cleaned));
    this.failures = Collections.unmodifiableList(new ArrayList<>(failures));
  }

  public static OriginSweepReport empty() {
    return EMPTY;
  }

  public static OriginSweepReport cleaned(String originName) {
    return new OriginSweepReport(List.of(originName), List.of());
  }

  public static OriginSweepReport failed(Failure failure) {
    return new OriginSweepReport(List.of(), List.of(failure));
  }

  public OriginSweepReport merge(OriginSweepReport other) {
    if (other.cleaned.isEmpty() && other.failures.isEmpty()) {
      return this;
    }
    List<String> mergedCleaned = new ArrayList<>(cleaned);
    mergedCleaned.addAll(other.cleaned);
    List<Failure> mergedFailures = new ArrayList<>(failures);
    mergedFailures.addAll(other.failures);
    return new OriginSweepReport(mergedCleaned, mergedFailures);
  }

  public int cleanedCount() {
    return cleaned.size();
  }

  public List<String> cleaned() {
    return cleaned;
  }

  public List<Failure> failures() {
    return failures;
  }

  public boolean complete() {
    return failures.isEmpty();
  }

  @Override
  public String toString() {
    return "OriginSweepReport{cleaned=" + cleaned + ", failures=" + failures + '}';
  }
}
