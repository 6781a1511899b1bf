package com.rackspace.argus.app.model;

import java.time.Instant;
import lombok.Value;

@Value
public class IngestFailure {
  String schedulerName;
  Instant dataStartTime;
  String message;
}
