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

import com.rackspace.argus.app.exceptions.InvalidConfigException;
import java.util.Arrays;

/**
 * Separates the component name from the timestamp in input filenames.
 */
public enum ComponentDelimiter {
  HYPHEN('-'),
  UNDERSCORE('_'),
  SPACE(' ');

  private final char symbol;

  ComponentDelimiter(char symbol) {
    this.symbol = symbol;
  }

  public char getSymbol() {
    return symbol;
  }

  public int occurrencesIn(String value) {
    int count = 0;
    for (int i = 0; i < value.length(); i++) {
      if (value.charAt(i) == symbol) {
        count++;
      }
    }
    return count;
  }

  /**
   * Accepts either the delimiter character itself or the constant name.
   */
  public static ComponentDelimiter fromSymbol(String value) {
    if (value == null || value.isEmpty()) {
      throw new InvalidConfigException("Component delimiter is required");
    }
    if (value.length() == 1) {
      final char c = value.charAt(0);
      return Arrays.stream(values())
          .filter(delimiter -> delimiter.symbol == c)
          .findFirst()
          .orElseThrow(() -> new InvalidConfigException("Unsupported component delimiter '" + value + "'"));
    }
    try {
      return valueOf(value.trim().toUpperCase());
    } catch (IllegalArgumentException e) {
      throw new InvalidConfigException("Unsupported component delimiter '" + value + "'", e);
    }
  }
}
