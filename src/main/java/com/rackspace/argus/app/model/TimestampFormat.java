/*
 * Copyright 2022 Rackspace US, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.rackspace.argus.app.model;

import com.rackspace.argus.app.exceptions.InvalidConfigException;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * Timestamp layouts recognized in input filenames. Formatting and parsing operate on wall-clock
 * values; an {@link #EPOCH} timestamp counts the seconds of that wall-clock value as if it
 * were UTC, so the offset is never applied twice.
 */
public enum TimestampFormat {
  EPOCH("EPOCH", null),
  DASHED("yyyy-MM-dd-HH-mm-ss", "uuuu-MM-dd-HH-mm-ss"),
  COMPACT("yyyyMMddHHmmss", "uuuuMMddHHmmss");

  // canonical form only, so that parse followed by format gives back the same text
  private static final Pattern EPOCH_SECONDS = Pattern.compile("0|[1-9][0-9]{0,11}");

  private final String pattern;
  private final DateTimeFormatter formatter;

  TimestampFormat(String pattern, String strictPattern) {
    this.pattern = pattern;
    this.formatter = strictPattern == null ? null :
        DateTimeFormatter.ofPattern(strictPattern).withResolverStyle(ResolverStyle.STRICT);
  }

  /**
   * @return the pattern as it is declared to the scheduling service
   */
  public String getPattern() {
    return pattern;
  }

  public String format(LocalDateTime timestamp) {
    final LocalDateTime truncated = timestamp.withNano(0);
    if (this == EPOCH) {
      return Long.toString(truncated.toEpochSecond(ZoneOffset.UTC));
    }
    return formatter.format(truncated);
  }

  /**
   * @throws DateTimeParseException when the value does not follow this format exactly
   */
  public LocalDateTime parse(String value) {
    if (this == EPOCH) {
      if (!EPOCH_SECONDS.matcher(value).matches()) {
        throw new DateTimeParseException("Not canonical epoch seconds", value, 0);
      }
      return LocalDateTime.ofEpochSecond(Long.parseLong(value), 0, ZoneOffset.UTC);
    }
    return LocalDateTime.parse(value, formatter);
  }

  /**
   * Accepts the declared pattern (<code>yyyyMMddHHmmss</code>), <code>EPOCH</code> or the
   * constant name.
   */
  public static TimestampFormat fromPattern(String value) {
    if (value == null || value.isBlank()) {
      throw new InvalidConfigException("Timestamp format is required");
    }
    final String trimmed = value.trim();
    return Arrays.stream(values())
        .filter(format -> format.pattern.equals(trimmed) || format.name().equalsIgnoreCase(trimmed))
        .findFirst()
        .orElseThrow(() -> new InvalidConfigException("Unsupported timestamp format '" + value + "'"));
  }
}
