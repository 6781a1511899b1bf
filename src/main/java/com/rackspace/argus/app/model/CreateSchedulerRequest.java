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

import com.rackspace.argus.app.utils.DateTimeUtils;
import lombok.Data;

@Data
public class CreateSchedulerRequest {
  String schedulerName;
  String modelName;
  String dataUploadFrequency;
  Integer dataDelayOffsetInMinutes;
  String timezoneOffset;
  String timestampFormat;
  String componentTimestampDelimiter;
  String inputLocation;
  String outputLocation;
  String roleRef;

  public static CreateSchedulerRequest from(SchedulerConfig config) {
    return new CreateSchedulerRequest()
        .setSchedulerName(config.getSchedulerName())
        .setModelName(config.getModelName())
        .setDataUploadFrequency(config.getUploadFrequency().name())
        .setDataDelayOffsetInMinutes(config.getDelayOffsetMinutes())
        .setTimezoneOffset(DateTimeUtils.formatTimezoneOffset(config.getTimezoneOffset()))
        .setTimestampFormat(config.getTimestampFormat().getPattern())
        .setComponentTimestampDelimiter(String.valueOf(config.getComponentDelimiter().getSymbol()))
        .setInputLocation(config.getInputLocation().toString())
        .setOutputLocation(config.getOutputLocation().toString())
        .setRoleRef(config.getExecutionRoleRef());
  }
}
