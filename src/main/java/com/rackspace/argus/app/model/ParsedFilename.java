package com.rackspace.argus.app.model;

import java.time.LocalDateTime;
import lombok.Value;

@Value
public class ParsedFilename {
  String componentName;
  LocalDateTime timestamp;
}
