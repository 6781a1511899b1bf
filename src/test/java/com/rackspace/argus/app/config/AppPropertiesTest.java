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

import static org.assertj.core.api.Assertions.assertThat;

import com.rackspace.argus.app.model.ComponentDelimiter;
import com.rackspace.argus.app.model.SchedulerConfig;
import com.rackspace.argus.app.model.StorageLocation;
import com.rackspace.argus.app.model.TimestampFormat;
import com.rackspace.argus.app.model.UploadFrequency;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

@ActiveProfiles("test")
@SpringBootTest(classes = AppPropertiesTest.TestConfig.class)
class AppPropertiesTest {

  @Configuration
  @EnableConfigurationProperties(AppProperties.class)
  @Import({SchedulerConfigConfiguration.class, StringToTimestampFormatConverter.class,
      StringToComponentDelimiterConverter.class})
  static class TestConfig {
  }

  @Autowired
  AppProperties appProperties;

  @Autowired
  SchedulerConfig schedulerConfig;

  @Test
  void bindsProperties() {
    assertThat(appProperties.getScheduler().getUploadFrequency()).isEqualTo(Duration.ofMinutes(5));
    assertThat(appProperties.getScheduler().getTimestampFormat()).isEqualTo(TimestampFormat.DASHED);
    assertThat(appProperties.getScheduler().getComponentDelimiter())
        .isEqualTo(ComponentDelimiter.HYPHEN);
    assertThat(appProperties.getPoll().getInterval()).isEqualTo(Duration.ofSeconds(1));
    assertThat(appProperties.getPoll().getMaxWait()).isEqualTo(Duration.ofSeconds(10));
    assertThat(appProperties.getCatalog().getTags())
        .containsExactlyInAnyOrderEntriesOf(Map.of("S0", "pump", "S1", "pump", "S2", "motor"));
  }

  @Test
  void buildsSchedulerConfig() {
    assertThat(schedulerConfig.getSchedulerName()).isEqualTo("test-scheduler");
    assertThat(schedulerConfig.getUploadFrequency()).isEqualTo(UploadFrequency.PT5M);
    assertThat(schedulerConfig.getTimezoneOffset()).isEqualTo(ZoneOffset.of("+05:30"));
    assertThat(schedulerConfig.getDelayOffset()).contains(Duration.ofMinutes(2));
    assertThat(schedulerConfig.getInputLocation())
        .isEqualTo(StorageLocation.parse("s3://test-bucket/input/"));
    assertThat(schedulerConfig.getExecutionRoleRef()).isEqualTo("test-role");
  }
}
