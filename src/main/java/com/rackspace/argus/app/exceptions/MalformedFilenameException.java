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

public class MalformedFilenameException extends IllegalArgumentException {

  @Getter
  private final String filename;

  public MalformedFilenameException(String filename, String reason) {
    super(String.format("Malformed filename '%s': %s", filename, reason));
    this.filename = filename;
  }

  public MalformedFilenameException(String filename, String reason, Throwable cause) {
    super(String.format("Malformed filename '%s': %s", filename, reason), cause);
    this.filename = filename;
  }
}
