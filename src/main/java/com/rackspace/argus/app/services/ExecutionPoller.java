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

import com.rackspace.argus.app.exceptions.PollTimeoutException;
import com.rackspace.argus.app.model.ExecutionFilter;
import com.rackspace.argus.app.model.ExecutionRecord;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Lists executions of a scheduler and waits for the first ones to show up.
 * Results are snapshots: a later unfiltered poll may always list more.
 */
@Service
@Slf4j
public class ExecutionPoller {

  private static final Comparator<ExecutionRecord> BY_DATA_START =
      Comparator.comparing(ExecutionRecord::getDataStartTime);

  private final InferenceSchedulerClient schedulerClient;
  private final Counter emptyPollCounter;
  private final Counter foundPollCounter;

  @Autowired
  public ExecutionPoller(InferenceSchedulerClient schedulerClient, MeterRegistry meterRegistry) {
    this.schedulerClient = schedulerClient;
    emptyPollCounter = meterRegistry.counter("argus.poll", "outcome", "empty");
    foundPollCounter = meterRegistry.counter("argus.poll", "outcome", "found");
  }

  public Mono<List<ExecutionRecord>> poll(String schedulerName) {
    return poll(schedulerName, ExecutionFilter.none());
  }

  /**
   * @return the executions currently known to the service that pass the filter, ordered by
   * the start of their data
   */
  public Mono<List<ExecutionRecord>> poll(String schedulerName, ExecutionFilter filter) {
    // deferred so every repetition of a wait issues a fresh listing
    return Flux.defer(() -> schedulerClient.listExecutions(schedulerName, filter))
        .filter(filter::test)
        .collectSortedList(BY_DATA_START)
        .doOnNext(records -> {
          log.debug("Polled scheduler {}: {} execution(s)", schedulerName, records.size());
          (records.isEmpty() ? emptyPollCounter : foundPollCounter).increment();
        });
  }

  public Mono<List<ExecutionRecord>> awaitFirstExecution(String schedulerName,
                                                         Duration pollInterval,
                                                         @Nullable Duration maxWait) {
    return awaitFirstExecution(schedulerName, ExecutionFilter.none(), pollInterval, maxWait);
  }

  /**
   * Polls until a listing is non-empty, sleeping <code>pollInterval</code> between attempts.
   * Only empty listings are retried; errors from the service end the wait. Cancelling the
   * subscription stops polling.
   *
   * @param maxWait when set, the wait fails with {@link PollTimeoutException} after this long,
   * otherwise it never gives up
   */
  public Mono<List<ExecutionRecord>> awaitFirstExecution(String schedulerName,
                                                         ExecutionFilter filter,
                                                         Duration pollInterval,
                                                         @Nullable Duration maxWait) {
    if (pollInterval.isNegative() || pollInterval.isZero()) {
      throw new IllegalArgumentException("Poll interval must be positive: " + pollInterval);
    }
    final Mono<List<ExecutionRecord>> waiting = poll(schedulerName, filter)
        .filter(records -> !records.isEmpty())
        .repeatWhenEmpty(attempts -> attempts
            .doOnNext(attempt -> log.trace("No executions of {} yet, attempt {}",
                schedulerName, attempt + 1))
            .delayElements(pollInterval));

    if (maxWait == null) {
      return waiting;
    }
    return waiting.timeout(maxWait,
        Mono.defer(() -> Mono.<List<ExecutionRecord>>error(
            new PollTimeoutException(schedulerName, maxWait))));
  }
}
