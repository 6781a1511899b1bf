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
import lombok.Builder;
import lombok.Value;

/**
 * Narrows a listing of executions. An absent bound leaves that side of the range open.
 */
@Value
@Builder
public class ExecutionFilter {

  private static final ExecutionFilter NONE = ExecutionFilter.builder().build();

  /**
   * Executions whose data starts at or after this instant.
   */
  Instant startTime;

  /**
   * Executions whose data ends at or before this instant.
   */
  Instant endTime;

  ExecutionStatus status;

  public static ExecutionFilter none() {
    return NONE;
  }

  public boolean test(ExecutionRecord record) {
    if (startTime != null && record.getDataStartTime().isBefore(startTime)) {
      return false;
    }
    if (endTime != null && record.getDataEndTime().isAfter(endTime)) {
      return false;
    }
    return status == null || status == record.getStatus();
  }
}
