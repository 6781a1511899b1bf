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
import com.rackspace.argus.app.utils.DateTimeUtils;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.Builder;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

/**
 * Validated, immutable settings of one inference scheduler. Every instance has passed
 * validation, so nothing invalid can reach the scheduling service. Changing any value means
 * deleting the scheduler and creating it again with a new instance.
 */
@Value
public class SchedulerConfig {

  private static final Pattern NAME = Pattern.compile("[0-9a-zA-Z_-]{1,200}");

  String schedulerName;
  String modelName;
  UploadFrequency uploadFrequency;
  ZoneOffset timezoneOffset;

  /**
   * Expected upload latency in minutes, null when not set.
   */
  Integer delayOffsetMinutes;

  TimestampFormat timestampFormat;
  ComponentDelimiter componentDelimiter;
  StorageLocation inputLocation;
  StorageLocation outputLocation;
  String executionRoleRef;

  @Builder(toBuilder = true)
  private SchedulerConfig(String schedulerName, String modelName,
                          UploadFrequency uploadFrequency, ZoneOffset timezoneOffset,
                          Integer delayOffsetMinutes, TimestampFormat timestampFormat,
                          ComponentDelimiter componentDelimiter, StorageLocation inputLocation,
                          StorageLocation outputLocation, String executionRoleRef) {
    this.schedulerName = requireName("Scheduler name", schedulerName);
    this.modelName = requireName("Model name", modelName);
    this.uploadFrequency = require("Upload frequency", uploadFrequency);
    this.timezoneOffset = DateTimeUtils.validateTimezoneOffset(
        timezoneOffset == null ? ZoneOffset.UTC : timezoneOffset);
    if (delayOffsetMinutes != null && delayOffsetMinutes < 0) {
      throw new InvalidConfigException("Delay offset must not be negative: " + delayOffsetMinutes);
    }
    this.delayOffsetMinutes = delayOffsetMinutes;
    this.timestampFormat = require("Timestamp format", timestampFormat);
    this.componentDelimiter = require("Component delimiter", componentDelimiter);
    this.inputLocation = require("Input location", inputLocation);
    this.outputLocation = require("Output location", outputLocation);
    if (StringUtils.isBlank(executionRoleRef)) {
      throw new InvalidConfigException("Execution role reference is required");
    }
    this.executionRoleRef = executionRoleRef;
  }

  public Optional<Duration> getDelayOffset() {
    return Optional.ofNullable(delayOffsetMinutes).map(Duration::ofMinutes);
  }

  private static String requireName(String what, String value) {
    if (value == null || !NAME.matcher(value).matches()) {
      throw new InvalidConfigException(
          what + " must be 1-200 letters, digits, '-' or '_': " + value);
    }
    return value;
  }

  private static <T> T require(String what, T value) {
    if (value == null) {
      throw new InvalidConfigException(what + " is required");
    }
    return value;
  }
}
