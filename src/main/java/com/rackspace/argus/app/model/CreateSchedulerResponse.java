package com.rackspace.argus.app.model;

import lombok.Data;

@Data
public class CreateSchedulerResponse {
  String schedulerId;
}
