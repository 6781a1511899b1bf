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

import java.time.Duration;
import java.time.temporal.ChronoField;
import java.time.temporal.Temporal;
import java.time.temporal.TemporalAdjuster;
import lombok.Getter;

/**
 * Truncates an instant down to a multiple of the given width, counted from the epoch.
 */
public class TemporalNormalizer implements TemporalAdjuster {

  @Getter
  final Duration width;

  public TemporalNormalizer(Duration width) {
    if (width.isNegative() || width.isZero() || width.getNano() != 0) {
      throw new IllegalArgumentException("Width must be a positive whole number of seconds: " + width);
    }
    this.width = width;
  }

  @Override
  public Temporal adjustInto(Temporal temporal) {
    return temporal
        .with(ChronoField.NANO_OF_SECOND, 0)
        .with(ChronoField.INSTANT_SECONDS, truncate(temporal.getLong(ChronoField.INSTANT_SECONDS)));
  }

  long truncate(long seconds) {
    // floorMod keeps instants before the epoch truncating downwards
    return seconds - Math.floorMod(seconds, width.getSeconds());
  }
}
