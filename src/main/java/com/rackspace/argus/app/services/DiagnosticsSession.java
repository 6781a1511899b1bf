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

import com.rackspace.argus.app.model.ExecutionFilter;
import com.rackspace.argus.app.model.ExecutionRecord;
import com.rackspace.argus.app.model.IngestResult;
import com.rackspace.argus.app.model.PredictionRecord;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Cached executions and predictions of one analysis against one scheduler. Every session
 * owns its own cache; two sessions on the same scheduler never see each other's state.
 * Everything cached can be rebuilt from the scheduling service by refreshing.
 */
@Slf4j
public class DiagnosticsSession {

  @Getter
  private final String schedulerName;
  private final ExecutionPoller poller;
  private final ResultAggregator aggregator;

  private List<ExecutionRecord> executions = List.of();
  private IngestResult ingested = new IngestResult(List.of(), List.of());

  DiagnosticsSession(String schedulerName, ExecutionPoller poller, ResultAggregator aggregator) {
    this.schedulerName = schedulerName;
    this.poller = poller;
    this.aggregator = aggregator;
  }

  /**
   * Replaces the cached executions with a fresh, unfiltered listing.
   */
  public Mono<List<ExecutionRecord>> refresh() {
    return poller.poll(schedulerName)
        .doOnNext(records -> {
          log.debug("Session on {} refreshed with {} execution(s)", schedulerName, records.size());
          executions = List.copyOf(records);
        });
  }

  public Mono<IngestResult> ingest() {
    return ingest(ExecutionFilter.none());
  }

  /**
   * Rebuilds the cached predictions from the cached executions passing the filter.
   */
  public Mono<IngestResult> ingest(ExecutionFilter filter) {
    final List<ExecutionRecord> selected = executions.stream()
        .filter(filter::test)
        .collect(Collectors.toList());
    return aggregator.ingest(selected)
        .doOnNext(result -> ingested = result);
  }

  public Mono<IngestResult> refreshAndIngest(ExecutionFilter filter) {
    return refresh().then(Mono.defer(() -> ingest(filter)));
  }

  public List<ExecutionRecord> getExecutions() {
    return executions;
  }

  public List<PredictionRecord> getPredictions() {
    return ingested.getPredictions();
  }

  public IngestResult getLastIngest() {
    return ingested;
  }
}
