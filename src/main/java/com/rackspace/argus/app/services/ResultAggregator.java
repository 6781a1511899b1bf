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

import com.rackspace.argus.app.exceptions.CorruptResultPayloadException;
import com.rackspace.argus.app.model.ComponentAggregate;
import com.rackspace.argus.app.model.ComponentAggregation;
import com.rackspace.argus.app.model.DiagnosticEntry;
import com.rackspace.argus.app.model.ExecutionRecord;
import com.rackspace.argus.app.model.ExecutionStatus;
import com.rackspace.argus.app.model.IngestFailure;
import com.rackspace.argus.app.model.IngestResult;
import com.rackspace.argus.app.model.PredictionRecord;
import com.rackspace.argus.app.model.SensorContribution;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.charset.CharacterCodingException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Turns execution results into prediction series and rolls their diagnostics up per sensor
 * and per component.
 */
@Service
@Slf4j
public class ResultAggregator {

  private final ResultStore resultStore;
  private final ResultPayloadParser parser;
  private final Counter corruptCounter;
  private final Counter predictionCounter;
  private final Counter unmappedCounter;

  @Autowired
  public ResultAggregator(ResultStore resultStore, ResultPayloadParser parser,
                          MeterRegistry meterRegistry) {
    this.resultStore = resultStore;
    this.parser = parser;
    corruptCounter = meterRegistry.counter("argus.ingest.corrupt");
    predictionCounter = meterRegistry.counter("argus.ingest.predictions");
    unmappedCounter = meterRegistry.counter("argus.aggregate.unmapped");
  }

  /**
   * Fetches and merges the results of the successful executions. Executions in progress or
   * failed contribute nothing. A corrupt payload is recorded as a failure of its execution
   * while the remaining executions are still ingested; errors fetching a payload end the
   * ingestion.
   *
   * @return predictions ordered by timestamp where the first execution listing a timestamp
   * wins
   */
  public Mono<IngestResult> ingest(List<ExecutionRecord> executions) {
    return Flux.fromIterable(executions)
        .filter(execution -> execution.getStatus() == ExecutionStatus.SUCCESS)
        .concatMap(this::fetch)
        .collect(Batch::new, Batch::add)
        .map(batch -> {
          final IngestResult result = batch.toResult();
          predictionCounter.increment(result.getPredictions().size());
          log.info("Ingested {} prediction(s) from {} execution(s), {} failure(s)",
              result.getPredictions().size(), executions.size(), result.getFailureCount());
          return result;
        });
  }

  private Mono<Fetched> fetch(ExecutionRecord execution) {
    if (execution.getResultLocation() == null) {
      return Mono.just(Fetched.failure(execution, "successful execution without a result location"));
    }
    return resultStore.fetch(execution.getResultLocation())
        .onErrorMap(CharacterCodingException.class, e ->
            new CorruptResultPayloadException(execution.describe(), "payload is not valid UTF-8", e))
        .map(payload -> Fetched.success(parser.parse(payload, execution.describe())))
        .onErrorResume(CorruptResultPayloadException.class, e -> {
          log.warn("Skipping results of {}: {}", execution.describe(), e.getMessage());
          corruptCounter.increment();
          return Mono.just(Fetched.failure(execution, e.getMessage()));
        });
  }

  /**
   * Sums contributions per component at each timestamp. The component of a diagnostic comes
   * from the catalog entry of its tag; diagnostics whose tag isn't in the catalog are left
   * out and counted, since catalogs and trained sensor lists drift apart.
   *
   * @param tagToComponent the tag catalog
   */
  public ComponentAggregation aggregateByComponent(List<PredictionRecord> predictions,
                                                   Map<String, String> tagToComponent) {
    final List<ComponentAggregate> aggregates = new ArrayList<>();
    final Set<String> unmappedTags = new LinkedHashSet<>();
    int unmappedCount = 0;

    for (PredictionRecord prediction : predictions) {
      final Map<String, Double> sums = new LinkedHashMap<>();
      for (DiagnosticEntry entry : prediction.getDiagnostics()) {
        final String component = tagToComponent.get(entry.getTag());
        if (component == null) {
          unmappedTags.add(entry.getTag());
          unmappedCount++;
        } else {
          sums.merge(component, entry.getContributionFraction(), Double::sum);
        }
      }
      sums.forEach((component, sum) ->
          aggregates.add(new ComponentAggregate(prediction.getTimestamp(), component, sum)));
    }

    if (unmappedCount > 0) {
      unmappedCounter.increment(unmappedCount);
      log.warn("{} diagnostic(s) with tags missing from the catalog: {}", unmappedCount, unmappedTags);
    }
    return new ComponentAggregation(aggregates, unmappedCount, unmappedTags);
  }

  /**
   * Ranks sensors by mean contribution over the predictions that have diagnostics. A sensor
   * absent from such a prediction counts as zero there, predictions without diagnostics are
   * not counted at all.
   *
   * @return at most k sensor names, highest mean first, ties in order of first appearance
   */
  public List<String> topContributors(List<PredictionRecord> predictions, int k) {
    if (k < 0) {
      throw new IllegalArgumentException("k must not be negative: " + k);
    }
    final Map<String, Double> sums = new LinkedHashMap<>();
    long rows = 0;
    for (PredictionRecord prediction : predictions) {
      if (prediction.hasDiagnostics()) {
        rows++;
        for (DiagnosticEntry entry : prediction.getDiagnostics()) {
          sums.merge(entry.getSensorQualifiedName(), entry.getContributionFraction(), Double::sum);
        }
      }
    }
    final long divisor = rows;
    // stable sort keeps first-seen order among equal means
    return sums.entrySet().stream()
        .sorted(Comparator.comparingDouble((Map.Entry<String, Double> e) -> e.getValue() / divisor)
            .reversed())
        .limit(k)
        .map(Map.Entry::getKey)
        .collect(Collectors.toList());
  }

  /**
   * Flattens diagnostics into one row per sensor and timestamp.
   */
  public List<SensorContribution> sensorContributions(List<PredictionRecord> predictions) {
    return predictions.stream()
        .flatMap(prediction -> prediction.getDiagnostics().stream()
            .map(entry -> new SensorContribution(
                prediction.getTimestamp(),
                entry.getSensorQualifiedName(),
                entry.getComponent(),
                entry.getTag(),
                entry.getContributionFraction())))
        .collect(Collectors.toList());
  }

  private static class Fetched {
    final List<PredictionRecord> predictions;
    final IngestFailure failure;

    private Fetched(List<PredictionRecord> predictions, IngestFailure failure) {
      this.predictions = predictions;
      this.failure = failure;
    }

    static Fetched success(List<PredictionRecord> predictions) {
      return new Fetched(predictions, null);
    }

    static Fetched failure(ExecutionRecord execution, String message) {
      return new Fetched(List.of(), new IngestFailure(
          execution.getSchedulerName(), execution.getDataStartTime(), message));
    }
  }

  private static class Batch {
    final Map<Instant, PredictionRecord> byTimestamp = new LinkedHashMap<>();
    final List<IngestFailure> failures = new ArrayList<>();

    void add(Fetched fetched) {
      fetched.predictions.forEach(prediction ->
          byTimestamp.putIfAbsent(prediction.getTimestamp(), prediction));
      if (fetched.failure != null) {
        failures.add(fetched.failure);
      }
    }

    IngestResult toResult() {
      final List<PredictionRecord> sorted = byTimestamp.values().stream()
          .sorted(Comparator.comparing(PredictionRecord::getTimestamp))
          .collect(Collectors.toList());
      return new IngestResult(sorted, List.copyOf(failures));
    }
  }
}
