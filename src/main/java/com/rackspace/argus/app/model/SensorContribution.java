package com.rackspace.argus.app.model;

import java.time.Instant;
import lombok.Value;

@Value
public class SensorContribution {
  Instant timestamp;
  String sensor;
  String component;
  String tag;
  double contribution;
}
