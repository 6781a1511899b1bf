package com.rackspace.argus.app.services;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class DiagnosticsSessionFactory {

  private final ExecutionPoller poller;
  private final ResultAggregator aggregator;

  @Autowired
  public DiagnosticsSessionFactory(ExecutionPoller poller, ResultAggregator aggregator) {
    this.poller = poller;
    this.aggregator = aggregator;
  }

  public DiagnosticsSession open(String schedulerName) {
    return new DiagnosticsSession(schedulerName, poller, aggregator);
  }
}
