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
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Upload frequencies accepted by the scheduling service. The frequency has to match the
 * resampling rate the referenced model was trained with, which can't be checked locally.
 */
public enum UploadFrequency {
  PT5M(Duration.ofMinutes(5)),
  PT10M(Duration.ofMinutes(10)),
  PT15M(Duration.ofMinutes(15)),
  PT30M(Duration.ofMinutes(30)),
  PT1H(Duration.ofHours(1));

  private final Duration duration;

  UploadFrequency(Duration duration) {
    this.duration = duration;
  }

  public Duration getDuration() {
    return duration;
  }

  public long getMinutes() {
    return duration.toMinutes();
  }

  public static boolean isSupported(Duration duration) {
    return duration != null && Arrays.stream(values())
        .anyMatch(frequency -> frequency.duration.equals(duration));
  }

  public static UploadFrequency fromDuration(Duration duration) {
    return Arrays.stream(values())
        .filter(frequency -> frequency.duration.equals(duration))
        .findFirst()
        .orElseThrow(() -> new InvalidConfigException(
            String.format("Unsupported upload frequency %s, expected one of %s", duration,
                Arrays.stream(values()).map(Enum::name).collect(Collectors.joining(", ")))));
  }

  /**
   * @param value an ISO-8601 duration such as <code>PT15M</code>
   */
  public static UploadFrequency parse(String value) {
    if (value == null) {
      throw new InvalidConfigException("Upload frequency is required");
    }
    try {
      return fromDuration(Duration.parse(value.trim()));
    } catch (DateTimeParseException e) {
      throw new InvalidConfigException("Upload frequency is not an ISO-8601 duration: " + value, e);
    }
  }
}
