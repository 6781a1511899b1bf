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

package com.rackspace.argus.app.exceptions;

import lombok.Getter;

/**
 * A result payload of a single execution could not be parsed. Ingestion records the failure
 * against that execution and carries on with the rest of the batch.
 */
@Getter
public class CorruptResultPayloadException extends RuntimeException {

  private final String execution;
  private final int lineNumber;

  public CorruptResultPayloadException(String execution, int lineNumber, String reason) {
    super(String.format("Corrupt result payload for execution %s at line %d: %s",
        execution, lineNumber, reason));
    this.execution = execution;
    this.lineNumber = lineNumber;
  }

  /**
   * For payloads that cannot be read at all, so no line is known.
   */
  public CorruptResultPayloadException(String execution, String reason, Throwable cause) {
    super(String.format("Corrupt result payload for execution %s: %s", execution, reason), cause);
    this.execution = execution;
    this.lineNumber = 0;
  }

  public CorruptResultPayloadException(String execution, int lineNumber, String reason,
                                       Throwable cause) {
    super(String.format("Corrupt result payload for execution %s at line %d: %s",
        execution, lineNumber, reason), cause);
    this.execution = execution;
    this.lineNumber = lineNumber;
  }
}
