package com.rackspace.argus.app.model;

import java.time.Instant;
import lombok.Value;

@Value
public class AnomalyEvent {
  Instant start;

  /**
   * Timestamp of the last anomalous prediction in the event, inclusive.
   */
  Instant end;

  int predictionCount;
}
