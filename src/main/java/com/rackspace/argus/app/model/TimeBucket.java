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

import java.time.Instant;
import java.time.LocalDateTime;
import lombok.Value;

/**
 * One firing of the scheduler. The acceptance window is truncated in UTC while the filename
 * timestamp is truncated in operator wall-clock time, after the delay, starting from the
 * window start.
 */
@Value
public class TimeBucket {

  /**
   * Inclusive start of accepted data, UTC.
   */
  Instant windowStart;

  /**
   * Exclusive end of accepted data, UTC.
   */
  Instant windowEnd;

  /**
   * Truncated wall-clock time the expected input file is named after.
   */
  LocalDateTime filenameTime;

  String expectedFilenameTimestamp;

  public boolean accepts(Instant timestamp) {
    return !timestamp.isBefore(windowStart) && timestamp.isBefore(windowEnd);
  }
}
