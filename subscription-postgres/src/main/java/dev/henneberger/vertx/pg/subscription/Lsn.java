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

import java.util.Objects;
import org.postgresql.replication.LogSequenceNumber;

/**
 * A write-ahead log position in PostgreSQL's {@code HIGH/LOW} hexadecimal form.
 *
 * <p>Both halves are unsigned 32-bit values, so the position fits one unsigned 64-bit ordinal.
 * Ordering compares that ordinal unsigned.
 */
public final class Lsn implements Comparable<Lsn> {

  private final long value;

  private Lsn(long value) {
    this.value = value;
  }

  public static Lsn valueOf(long value) {
    return new Lsn(value);
  }

  public static Lsn of(long high, long low) {
    if (high < 0 || high > 0xFFFFFFFFL) {
      throw new IllegalArgumentException("high half out of range: " + high);
    }
    if (low < 0 || low > 0xFFFFFFFFL) {
      throw new IllegalArgumentException("low half out of range: " + low);
    }
    return new Lsn((high << 32) | low);
  }

  /**
   * Parses {@code HIGH/LOW}, for example {@code 0/16B4F50}.
   *
   * @throws IllegalArgumentException if the text is not a valid position
   */
  public static Lsn parse(String text) {
    Objects.requireNonNull(text, "text");
    String trimmed = text.trim();
    int slash = trimmed.indexOf('/');
    if (slash <= 0 || slash == trimmed.length() - 1 || trimmed.indexOf('/', slash + 1) >= 0) {
      throw new IllegalArgumentException("LSN must have the form HIGH/LOW: '" + text + "'");
    }
    return of(parseHalf(trimmed.substring(0, slash), text), parseHalf(trimmed.substring(slash + 1), text));
  }

  public static Lsn from(LogSequenceNumber lsn) {
    Objects.requireNonNull(lsn, "lsn");
    if (LogSequenceNumber.INVALID_LSN.equals(lsn)) {
      throw new IllegalArgumentException("invalid LSN");
    }
    return new Lsn(lsn.asLong());
  }

  public long asLong() {
    return value;
  }

  public long high() {
    return value >>> 32;
  }

  public long low() {
    return value & 0xFFFFFFFFL;
  }

  public LogSequenceNumber toLogSequenceNumber() {
    return LogSequenceNumber.valueOf(value);
  }

  public boolean isBefore(Lsn other) {
    return compareTo(other) < 0;
  }

  @Override
  public int compareTo(Lsn other) {
    return Long.compareUnsigned(value, other.value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Lsn)) {
      return false;
    }
    return value == ((Lsn) o).value;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(value);
  }

  @Override
  public String toString() {
    return Long.toHexString(high()).toUpperCase() + '/' + Long.toHexString(low()).toUpperCase();
  }

  private static long parseHalf(String half, String original) {
    if (half.length() > 8) {
      throw new IllegalArgumentException("LSN half exceeds 32 bits: '" + original + "'");
    }
    try {
      return Long.parseLong(half, 16);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("LSN is not hexadecimal: '" + original + "'", e);
    }
  }
}
