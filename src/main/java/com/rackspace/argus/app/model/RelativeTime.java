package com.rackspace.argus.app.model;

import java.time.temporal.ChronoUnit;

public enum RelativeTime {
  ms(ChronoUnit.MILLIS),
  s(ChronoUnit.SECONDS),
  m(ChronoUnit.MINUTES),
  h(ChronoUnit.HOURS),
  d(ChronoUnit.DAYS),
  w(ChronoUnit.WEEKS);

  ChronoUnit value;

  RelativeTime(ChronoUnit unit) {
    this.value = unit;
  }

  public ChronoUnit getValue() {
    return value;
  }
}
