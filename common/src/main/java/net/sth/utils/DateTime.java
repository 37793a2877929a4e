// This file is part of STH.
// Copyright (C) 2024  The STH Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.sth.utils;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

import com.google.common.base.Strings;

/**
 * Helpers for dealing with the timestamps carried by history documents.
 * Reception times are rendered as ISO-8601 UTC strings with millisecond
 * precision, e.g. {@code 2024-01-01T10:05:00.000Z}, so that prefixes of the
 * string identify the second, minute, hour, day and month.
 */
public class DateTime {

  /** The fixed width formatter used for all reception times. */
  private static final DateTimeFormatter ISO_MILLIS =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'")
        .withZone(ZoneOffset.UTC);

  /**
   * Renders the timestamp in ISO-8601 UTC with milliseconds.
   * @param epoch_ms A Unix epoch timestamp in milliseconds.
   * @return The formatted string.
   */
  public static String toIsoString(final long epoch_ms) {
    return ISO_MILLIS.format(Instant.ofEpochMilli(epoch_ms));
  }

  /**
   * Parses an ISO-8601 instant such as {@code 2024-01-01T10:05Z} or
   * {@code 2024-01-01T10:05:00.000Z}.
   * @param datetime The string to parse.
   * @return A Unix epoch timestamp in milliseconds.
   * @throws IllegalArgumentException if the string was null, empty or
   * malformed.
   */
  public static long parseIsoString(final String datetime) {
    if (Strings.isNullOrEmpty(datetime)) {
      throw new IllegalArgumentException("Timestamp cannot be null or empty.");
    }
    try {
      return Instant.parse(datetime).toEpochMilli();
    } catch (DateTimeParseException e) {
      // Instant.parse wants seconds so retry with them appended
      if (datetime.endsWith("Z") && datetime.length() == 17) {
        try {
          return Instant.parse(datetime.substring(0, 16) + ":00Z")
              .toEpochMilli();
        } catch (DateTimeParseException ex) {
          throw new IllegalArgumentException("Invalid timestamp: "
              + datetime, ex);
        }
      }
      throw new IllegalArgumentException("Invalid timestamp: " + datetime, e);
    }
  }

  /**
   * Truncates the ISO representation of the timestamp to the given number
   * of characters.
   * @param epoch_ms A Unix epoch timestamp in milliseconds.
   * @param length The number of leading characters to keep.
   * @return The truncated ISO string.
   */
  public static String truncatedIsoString(final long epoch_ms,
                                          final int length) {
    final String iso = toIsoString(epoch_ms);
    return length >= iso.length() ? iso : iso.substring(0, length);
  }

  /**
   * Pass through to {@link System#currentTimeMillis()} so unit tests can
   * mock it.
   * @return The current epoch time in milliseconds.
   */
  public static long currentTimeMillis() {
    return System.currentTimeMillis();
  }
}
