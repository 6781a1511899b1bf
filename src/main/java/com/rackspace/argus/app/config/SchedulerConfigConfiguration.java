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

package com.rackspace.argus.app.config;

import com.rackspace.argus.app.model.SchedulerConfig;
import com.rackspace.argus.app.model.StorageLocation;
import com.rackspace.argus.app.model.UploadFrequency;
import com.rackspace.argus.app.utils.DateTimeUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class SchedulerConfigConfiguration {

  /**
   * Fails startup with an InvalidConfigException when the configured scheduler can't be
   * created, so nothing invalid is ever sent to the scheduling service.
   */
  @Bean
  public SchedulerConfig schedulerConfig(AppProperties appProperties) {
    final SchedulerConfig config = toSchedulerConfig(appProperties.getScheduler());
    log.info("Scheduler {}: model={} frequency={} offset={} delay={} format={} delimiter='{}'",
        config.getSchedulerName(), config.getModelName(), config.getUploadFrequency(),
        config.getTimezoneOffset(), config.getDelayOffsetMinutes(),
        config.getTimestampFormat().getPattern(), config.getComponentDelimiter().getSymbol());
    return config;
  }

  public static SchedulerConfig toSchedulerConfig(AppProperties.Scheduler scheduler) {
    return SchedulerConfig.builder()
        .schedulerName(scheduler.getName())
        .modelName(scheduler.getModelName())
        .uploadFrequency(UploadFrequency.fromDuration(scheduler.getUploadFrequency()))
        .timezoneOffset(DateTimeUtils.parseTimezoneOffset(scheduler.getTimezoneOffset()))
        .delayOffsetMinutes(scheduler.getDelayOffsetMinutes())
        .timestampFormat(scheduler.getTimestampFormat())
        .componentDelimiter(scheduler.getComponentDelimiter())
        .inputLocation(StorageLocation.parse(scheduler.getInputLocation()))
        .outputLocation(StorageLocation.parse(scheduler.getOutputLocation()))
        .executionRoleRef(scheduler.getExecutionRoleRef())
        .build();
  }
}
