package com.rackspace.argus.app.model;

import java.time.Instant;
import lombok.Value;

@Value
public class ComponentAggregate {
  Instant timestamp;
  String component;
  double aggregatedContribution;
}
