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

package com.rackspace.argus.app.utils;

import com.rackspace.argus.app.exceptions.InvalidConfigException;
import com.rackspace.argus.app.model.RelativeTime;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class DateTimeUtils {

  public static final String RELATIVE_TIME_PATTERN = "([0-9]+)(ms|s|m|h|d|w)-ago";
  public static final String EPOCH_MILLIS_PATTERN = "\\d{13,}";
  public static final String EPOCH_SECONDS_PATTERN = "\\d{1,12}";
  public static final String TIMEZONE_OFFSET_PATTERN = "(?<sign>[+-])(?<hours>\\d{2}):(?<minutes>\\d{2})";

  /**
   * Offsets are accepted in steps of this width.
   */
  public static final Duration TIMEZONE_OFFSET_STEP = Duration.ofMinutes(30);
  public static final Duration MAX_TIMEZONE_OFFSET = Duration.ofHours(12);

  private DateTimeUtils() {
  }

  /**
   * Gets the absolute Instant instance for relativeTime.
   */
  public static Instant getAbsoluteTimeFromRelativeTime(String relativeTime) {
    Matcher match = Pattern.compile(RELATIVE_TIME_PATTERN).matcher(relativeTime);
    if (match.matches()) {
      return Instant.now()
          .minus(Integer.parseInt(match.group(1)), RelativeTime.valueOf(match.group(2)).getValue());
    } else {
      throw new IllegalArgumentException("Invalid relative time format");
    }
  }

  /**
   * Checks if the string time is valid Instant in UTC.
   */
  public static boolean isValidInstantInstance(String time) {
    try {
      Instant.parse(time);
      return true;
    } catch (DateTimeParseException dateTimeParseException) {
      return false;
    }
  }

  public static boolean isValidEpochMillis(String time) {
    return Pattern.compile(EPOCH_MILLIS_PATTERN).matcher(time).matches();
  }

  public static boolean isValidEpochSeconds(String time) {
    return Pattern.compile(EPOCH_SECONDS_PATTERN).matcher(time).matches();
  }

  /**
   * Gets the instance of Instant based on the format of argument, where a null argument
   * means now.
   */
  public static Instant parseInstant(String instant) {
    if (instant == null) {
      return Instant.now();
    }
    return parseOptionalInstant(instant);
  }

  /**
   * Like {@link #parseInstant(String)} but keeps an absent value absent, which is how open
   * range bounds are passed around.
   */
  public static Instant parseOptionalInstant(String instant) {
    if (instant == null || instant.isBlank()) {
      return null;
    }
    if (isValidInstantInstance(instant)) {
      return Instant.parse(instant);
    } else if (isValidEpochMillis(instant)) {
      return Instant.ofEpochMilli(Long.parseLong(instant));
    } else if (isValidEpochSeconds(instant)) {
      return Instant.ofEpochSecond(Long.parseLong(instant));
    } else {
      return getAbsoluteTimeFromRelativeTime(instant);
    }
  }

  /**
   * Parses a <code>+HH:MM</code> or <code>-HH:MM</code> offset and checks it against the
   * supported range and step.
   */
  public static ZoneOffset parseTimezoneOffset(String offset) {
    if (offset == null) {
      throw new InvalidConfigException("Timezone offset is required");
    }
    Matcher match = Pattern.compile(TIMEZONE_OFFSET_PATTERN).matcher(offset.trim());
    if (!match.matches()) {
      throw new InvalidConfigException("Timezone offset must look like +HH:MM or -HH:MM: " + offset);
    }
    final int hours = Integer.parseInt(match.group("hours"));
    final int minutes = Integer.parseInt(match.group("minutes"));
    if (minutes > 59) {
      throw new InvalidConfigException("Invalid minutes in timezone offset: " + offset);
    }
    final int sign = match.group("sign").equals("-") ? -1 : 1;
    final long totalSeconds = sign * (hours * 3600L + minutes * 60L);
    if (Math.abs(totalSeconds) > MAX_TIMEZONE_OFFSET.getSeconds()) {
      throw new InvalidConfigException("Timezone offset is outside of -12:00..+12:00: " + offset);
    }
    return validateTimezoneOffset(ZoneOffset.ofTotalSeconds((int) totalSeconds));
  }

  public static ZoneOffset validateTimezoneOffset(ZoneOffset offset) {
    if (offset == null) {
      throw new InvalidConfigException("Timezone offset is required");
    }
    if (!isSupportedTimezoneOffset(offset)) {
      throw new InvalidConfigException(
          "Timezone offset must be a multiple of 30 minutes within -12:00..+12:00: " + offset);
    }
    return offset;
  }

  public static boolean isSupportedTimezoneOffset(ZoneOffset offset) {
    final int seconds = offset.getTotalSeconds();
    return Math.abs(seconds) <= MAX_TIMEZONE_OFFSET.getSeconds()
        && seconds % TIMEZONE_OFFSET_STEP.getSeconds() == 0;
  }

  /**
   * Always renders the <code>+HH:MM</code> form, including for UTC.
   */
  public static String formatTimezoneOffset(ZoneOffset offset) {
    final int seconds = offset.getTotalSeconds();
    final int abs = Math.abs(seconds);
    return String.format("%s%02d:%02d", seconds < 0 ? "-" : "+", abs / 3600, (abs % 3600) / 60);
  }
}
