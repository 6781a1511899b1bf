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

package com.rackspace.argus.app.services;

import com.rackspace.argus.app.model.AnomalyEvent;
import com.rackspace.argus.app.model.PredictionRecord;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Groups anomalous predictions into events.
 */
@Component
public class AnomalyEventExtractor {

  /**
   * @param predictions ordered by timestamp
   * @param maxGap anomalous predictions at most this far apart belong to the same event
   */
  public List<AnomalyEvent> extract(List<PredictionRecord> predictions, Duration maxGap) {
    final List<AnomalyEvent> events = new ArrayList<>();
    Instant start = null;
    Instant end = null;
    int count = 0;

    for (PredictionRecord prediction : predictions) {
      if (!prediction.isPredicted()) {
        continue;
      }
      final Instant ts = prediction.getTimestamp();
      if (start != null && Duration.between(end, ts).compareTo(maxGap) > 0) {
        events.add(new AnomalyEvent(start, end, count));
        start = null;
      }
      if (start == null) {
        start = ts;
        count = 0;
      }
      end = ts;
      count++;
    }
    if (start != null) {
      events.add(new AnomalyEvent(start, end, count));
    }
    return events;
  }
}
