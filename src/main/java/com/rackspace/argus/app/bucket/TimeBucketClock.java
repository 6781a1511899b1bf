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

package com.rackspace.argus.app.bucket;

import com.rackspace.argus.app.model.SchedulerConfig;
import com.rackspace.argus.app.model.TimeBucket;
import com.rackspace.argus.app.model.UploadFrequency;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Maps wall-clock ticks onto scheduler buckets.
 */
@Component
public class TimeBucketClock {

  private static final long SECONDS_PER_MINUTE = 60;

  private final Map<UploadFrequency, TemporalNormalizer> normalizers =
      new EnumMap<>(UploadFrequency.class);

  public TimeBucketClock() {
    for (UploadFrequency frequency : UploadFrequency.values()) {
      normalizers.put(frequency, new TemporalNormalizer(frequency.getDuration()));
    }
  }

  /**
   * The filename time is taken at the window start rather than at the tick itself, so every
   * tick within a window, including the window start, yields the same bucket.
   *
   * @param reference the tick, typically now
   * @return the bucket the scheduler fires for at that tick
   */
  public TimeBucket computeBucket(Instant reference, SchedulerConfig config) {
    final Instant windowStart = windowStart(reference, config.getUploadFrequency());
    final LocalDateTime filenameTime = filenameTime(windowStart, config);
    return new TimeBucket(
        windowStart,
        windowStart.plus(config.getUploadFrequency().getDuration()),
        filenameTime,
        config.getTimestampFormat().format(filenameTime)
    );
  }

  /**
   * Acceptance window start, anchored to UTC and independent of the timezone offset and
   * delay.
   */
  public Instant windowStart(Instant reference, UploadFrequency frequency) {
    return reference.with(normalizers.get(frequency));
  }

  /**
   * Wall-clock time the input file for this tick is named after: the delay is taken off,
   * the timezone offset applied, and the result truncated to the upload frequency.
   */
  public LocalDateTime filenameTime(Instant reference, SchedulerConfig config) {
    final long localMinutes = Math.floorDiv(
        reference.getEpochSecond() + config.getTimezoneOffset().getTotalSeconds(),
        SECONDS_PER_MINUTE) - delayMinutes(config);
    final long width = config.getUploadFrequency().getMinutes();
    final long truncated = localMinutes - Math.floorMod(localMinutes, width);
    return LocalDateTime.ofEpochSecond(truncated * SECONDS_PER_MINUTE, 0, ZoneOffset.UTC);
  }

  /**
   * @param start start of range, inclusive
   * @param end end of range, exclusive
   * @return consecutive buckets whose windows cover the range
   */
  public List<TimeBucket> bucketsOverRange(Instant start, Instant end, SchedulerConfig config) {
    final Duration width = config.getUploadFrequency().getDuration();
    final List<TimeBucket> buckets = new ArrayList<>();
    for (Instant next = windowStart(start, config.getUploadFrequency());
        // use isBefore since 'end' is exclusive
        next.isBefore(end);
        next = next.plus(width)
    ) {
      buckets.add(computeBucket(next, config));
    }
    return buckets;
  }

  private static long delayMinutes(SchedulerConfig config) {
    return config.getDelayOffsetMinutes() == null ? 0 : config.getDelayOffsetMinutes();
  }
}
