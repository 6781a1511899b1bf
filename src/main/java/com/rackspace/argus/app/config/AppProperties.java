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

import com.rackspace.argus.app.config.configValidator.SupportedUploadFrequency;
import com.rackspace.argus.app.config.configValidator.TimezoneOffset;
import com.rackspace.argus.app.model.ComponentDelimiter;
import com.rackspace.argus.app.model.TimestampFormat;
import java.nio.file.Path;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.Map;
import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("argus")
@Component
@Data
@Validated
public class AppProperties {

  @NotNull
  @Valid
  Scheduler scheduler = new Scheduler();

  @NotNull
  @Valid
  Poll poll = new Poll();

  @NotNull
  @Valid
  SchedulingService service = new SchedulingService();

  @NotNull
  @Valid
  Results results = new Results();

  @NotNull
  @Valid
  Catalog catalog = new Catalog();

  @Data
  public static class Scheduler {

    @NotBlank
    String name;

    /**
     * The trained model the scheduler runs inference with.
     */
    @NotBlank
    String modelName;

    /**
     * How often a new input file is uploaded, one of 5m, 10m, 15m, 30m or 1h. Has to equal
     * the resampling rate the model was trained with.
     */
    @NotNull
    @SupportedUploadFrequency
    @DurationUnit(ChronoUnit.MINUTES)
    Duration uploadFrequency = Duration.ofMinutes(5);

    /**
     * Offset of the wall-clock time used in input filenames, for example +05:30.
     */
    @NotNull
    @TimezoneOffset
    String timezoneOffset = "+00:00";

    /**
     * Expected upload latency. Unset means no delay.
     */
    @Min(0)
    Integer delayOffsetMinutes;

    /**
     * One of EPOCH, yyyy-MM-dd-HH-mm-ss or yyyyMMddHHmmss.
     */
    @NotNull
    TimestampFormat timestampFormat = TimestampFormat.COMPACT;

    /**
     * One of '-', '_' or ' '.
     */
    @NotNull
    ComponentDelimiter componentDelimiter = ComponentDelimiter.UNDERSCORE;

    @NotBlank
    String inputLocation;

    @NotBlank
    String outputLocation;

    /**
     * Credential the scheduling service assumes to read inputs and write results.
     */
    @NotBlank
    String executionRoleRef;
  }

  @Data
  public static class Poll {

    @NotNull
    @DurationUnit(ChronoUnit.SECONDS)
    Duration interval = Duration.ofSeconds(60);

    /**
     * Upper bound of a wait for the first execution. Unset waits indefinitely.
     */
    @DurationUnit(ChronoUnit.SECONDS)
    Duration maxWait;
  }

  @Data
  public static class SchedulingService {

    @NotBlank
    String baseUrl = "http://localhost:8081/api";

    @NotNull
    @DurationUnit(ChronoUnit.SECONDS)
    Duration responseTimeout = Duration.ofSeconds(30);
  }

  @Data
  public static class Results {

    /**
     * Local directory holding a copy of the output buckets, one directory per bucket.
     */
    @NotNull
    Path rootDirectory = Path.of("results");
  }

  @Data
  public static class Catalog {

    /**
     * Declared component of each sensor tag.
     */
    @NotNull
    Map<String, String> tags = new HashMap<>();
  }
}
