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
import lombok.Data;

/**
 * One scheduled inference run as listed by the scheduling service.
 * <code>resultLocation</code> is only set on success and <code>failureReason</code> only on
 * failure.
 */
@Data
public class ExecutionRecord {

  /**
   * Failure reason reported when the bucket's file holds no row inside the data window.
   * Terminal: the window is immutable, so resubmitting fails the same way.
   */
  public static final String NO_MATCHING_DATA_ROW = "NoMatchingDataRow";

  String schedulerName;
  Instant dataStartTime;
  Instant dataEndTime;
  ExecutionStatus status;
  StorageLocation resultLocation;
  String failureReason;

  public static ExecutionRecord inProgress(String schedulerName, TimeBucket bucket) {
    return new ExecutionRecord()
        .setSchedulerName(schedulerName)
        .setDataStartTime(bucket.getWindowStart())
        .setDataEndTime(bucket.getWindowEnd())
        .setStatus(ExecutionStatus.IN_PROGRESS);
  }

  public static ExecutionRecord succeeded(String schedulerName, TimeBucket bucket,
                                          StorageLocation resultLocation) {
    return inProgress(schedulerName, bucket)
        .setStatus(ExecutionStatus.SUCCESS)
        .setResultLocation(resultLocation);
  }

  public static ExecutionRecord failed(String schedulerName, TimeBucket bucket, String reason) {
    return inProgress(schedulerName, bucket)
        .setStatus(ExecutionStatus.FAILED)
        .setFailureReason(reason);
  }

  public String describe() {
    return String.format("%s@%s", schedulerName, dataStartTime);
  }
}
