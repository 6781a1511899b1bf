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

package com.rackspace.argus.app.web;

import com.rackspace.argus.app.bucket.TimeBucketClock;
import com.rackspace.argus.app.config.AppProperties;
import com.rackspace.argus.app.model.AnomalyEvent;
import com.rackspace.argus.app.model.ComponentAggregation;
import com.rackspace.argus.app.model.ExecutionFilter;
import com.rackspace.argus.app.model.ExecutionRecord;
import com.rackspace.argus.app.model.ExecutionStatus;
import com.rackspace.argus.app.model.IngestResult;
import com.rackspace.argus.app.model.SchedulerConfig;
import com.rackspace.argus.app.model.TimeBucket;
import com.rackspace.argus.app.services.AnomalyEventExtractor;
import com.rackspace.argus.app.services.DiagnosticsSessionFactory;
import com.rackspace.argus.app.services.ExecutionPoller;
import com.rackspace.argus.app.services.ResultAggregator;
import com.rackspace.argus.app.services.SensorCatalog;
import com.rackspace.argus.app.utils.DateTimeUtils;
import java.time.Duration;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Read-only views over the configured scheduler. Each diagnostics request works on its own
 * session, freshly listed from the scheduling service.
 */
@RestController
@RequestMapping("/api")
public class SchedulerController {

  private final SchedulerConfig schedulerConfig;
  private final TimeBucketClock clock;
  private final ExecutionPoller poller;
  private final DiagnosticsSessionFactory sessionFactory;
  private final ResultAggregator aggregator;
  private final AnomalyEventExtractor eventExtractor;
  private final SensorCatalog sensorCatalog;
  private final AppProperties appProperties;

  @Autowired
  public SchedulerController(SchedulerConfig schedulerConfig, TimeBucketClock clock,
                             ExecutionPoller poller, DiagnosticsSessionFactory sessionFactory,
                             ResultAggregator aggregator, AnomalyEventExtractor eventExtractor,
                             SensorCatalog sensorCatalog, AppProperties appProperties) {
    this.schedulerConfig = schedulerConfig;
    this.clock = clock;
    this.poller = poller;
    this.sessionFactory = sessionFactory;
    this.aggregator = aggregator;
    this.eventExtractor = eventExtractor;
    this.sensorCatalog = sensorCatalog;
    this.appProperties = appProperties;
  }

  /**
   * @param at ISO-8601 instant, epoch seconds or millis, or relative such as 15m-ago;
   * defaults to now
   */
  @GetMapping("/bucket")
  public Mono<TimeBucket> bucket(@RequestParam(required = false) String at) {
    return Mono.fromCallable(() ->
        clock.computeBucket(DateTimeUtils.parseInstant(at), schedulerConfig));
  }

  @GetMapping("/executions")
  public Flux<ExecutionRecord> executions(
      @RequestParam(required = false) String start,
      @RequestParam(required = false) String end,
      @RequestParam(required = false) ExecutionStatus status) {
    return poller.poll(schedulerConfig.getSchedulerName(), filter(start, end, status))
        .flatMapMany(Flux::fromIterable);
  }

  /**
   * Holds the request until the scheduler lists a matching execution, polling every
   * <code>argus.poll.interval</code>. Responds with 504 once <code>argus.poll.max-wait</code>
   * has passed, when that is set.
   */
  @GetMapping("/executions/await")
  public Flux<ExecutionRecord> awaitExecutions(
      @RequestParam(required = false) String start,
      @RequestParam(required = false) String end,
      @RequestParam(required = false) ExecutionStatus status) {
    final AppProperties.Poll poll = appProperties.getPoll();
    return poller.awaitFirstExecution(schedulerConfig.getSchedulerName(),
        filter(start, end, status), poll.getInterval(), poll.getMaxWait())
        .flatMapMany(Flux::fromIterable);
  }

  @GetMapping("/diagnostics/components")
  public Mono<ComponentAggregation> components(
      @RequestParam(required = false) String start,
      @RequestParam(required = false) String end) {
    return ingest(start, end)
        .map(result -> aggregator.aggregateByComponent(result.getPredictions(),
            sensorCatalog.getTagToComponent()));
  }

  @GetMapping("/diagnostics/top-sensors")
  public Mono<List<String>> topSensors(
      @RequestParam(defaultValue = "5") int k,
      @RequestParam(required = false) String start,
      @RequestParam(required = false) String end) {
    if (k < 0) {
      throw new IllegalArgumentException("k must not be negative");
    }
    return ingest(start, end)
        .map(result -> aggregator.topContributors(result.getPredictions(), k));
  }

  /**
   * @param maxGap defaults to the upload frequency
   */
  @GetMapping("/diagnostics/events")
  public Flux<AnomalyEvent> events(
      @RequestParam(required = false) String start,
      @RequestParam(required = false) String end,
      @RequestParam(required = false) Duration maxGap) {
    final Duration gap = maxGap == null ? schedulerConfig.getUploadFrequency().getDuration() : maxGap;
    return ingest(start, end)
        .flatMapIterable(result -> eventExtractor.extract(result.getPredictions(), gap));
  }

  private Mono<IngestResult> ingest(String start, String end) {
    return sessionFactory.open(schedulerConfig.getSchedulerName())
        .refreshAndIngest(filter(start, end, null));
  }

  private static ExecutionFilter filter(String start, String end, ExecutionStatus status) {
    return ExecutionFilter.builder()
        .startTime(DateTimeUtils.parseOptionalInstant(start))
        .endTime(DateTimeUtils.parseOptionalInstant(end))
        .status(status)
        .build();
  }
}
