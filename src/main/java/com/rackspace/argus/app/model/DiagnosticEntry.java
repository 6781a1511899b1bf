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

import lombok.Value;

/**
 * One sensor's share of a predicted anomaly. The qualified name has the form
 * <code>component\tag</code>.
 */
@Value
public class DiagnosticEntry {

  public static final char SEPARATOR = '\\';

  String sensorQualifiedName;
  double contributionFraction;

  /**
   * @return the part before the separator, empty when there is none
   */
  public String getComponent() {
    final int i = sensorQualifiedName.indexOf(SEPARATOR);
    return i < 0 ? "" : sensorQualifiedName.substring(0, i);
  }

  public String getTag() {
    final int i = sensorQualifiedName.indexOf(SEPARATOR);
    return i < 0 ? sensorQualifiedName : sensorQualifiedName.substring(i + 1);
  }
}
