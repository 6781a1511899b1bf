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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rackspace.argus.app.bucket.TimeBucketClock;
import com.rackspace.argus.app.model.ComponentAggregate;
import com.rackspace.argus.app.model.ComponentAggregation;
import com.rackspace.argus.app.model.ComponentDelimiter;
import com.rackspace.argus.app.model.ExecutionFilter;
import com.rackspace.argus.app.model.ExecutionRecord;
import com.rackspace.argus.app.model.ExecutionStatus;
import com.rackspace.argus.app.model.IngestResult;
import com.rackspace.argus.app.model.SchedulerConfig;
import com.rackspace.argus.app.model.SchedulerConfigs;
import com.rackspace.argus.app.model.StorageLocation;
import com.rackspace.argus.app.model.TimeBucket;
import com.rackspace.argus.app.model.TimestampFormat;
import com.rackspace.argus.app.naming.InputFileMatcher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;

/**
 * Runs a scheduler against ten buckets of uploaded data and reads its results back.
 */
class InferenceSchedulingScenarioTest {

  static final Instant FIRST_TICK = Instant.parse("2021-04-07T20:00:00Z");
  static final int UPLOADED_BUCKETS = 10;

  @TempDir
  Path resultRoot;

  final TimeBucketClock clock = new TimeBucketClock();
  final InputFileMatcher matcher = new InputFileMatcher(new SimpleMeterRegistry());
  final FakeInferenceScheduler scheduler = new FakeInferenceScheduler();

  final SchedulerConfig config = SchedulerConfigs.builder()
      .schedulerName("pump-station-scheduler")
      .timezoneOffset(ZoneOffset.of("+05:30"))
      .timestampFormat(TimestampFormat.DASHED)
      .componentDelimiter(ComponentDelimiter.HYPHEN)
      .outputLocation(StorageLocation.parse("s3://plant-data/inference/output/"))
      .build();

  SchedulerLifecycleService lifecycleService;
  ExecutionPoller poller;
  ResultAggregator aggregator;

  @BeforeEach
  void setUp() {
    final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    lifecycleService = new SchedulerLifecycleService(scheduler, meterRegistry);
    poller = new ExecutionPoller(scheduler, meterRegistry);
    aggregator = new ResultAggregator(new FileSystemResultStore(resultRoot),
        new ResultPayloadParser(new ObjectMapper()), meterRegistry);
  }

  @Test
  void tenUploadedBucketsThenOneMissing() throws IOException {
    for (TimeBucket bucket : buckets(UPLOADED_BUCKETS)) {
      scheduler.upload(matcher.expectedFilename("pump", bucket, config));
    }

    StepVerifier.create(lifecycleService.createAndStart(config))
        .expectNext(config.getSchedulerName())
        .verifyComplete();

    StepVerifier.create(poller.poll(config.getSchedulerName()))
        .expectNext(List.of())
        .verifyComplete();

    for (TimeBucket bucket : buckets(UPLOADED_BUCKETS)) {
      for (ExecutionRecord record : scheduler.fire(bucket.getWindowStart())) {
        writeResult(record);
      }
    }

    StepVerifier.create(poller.poll(config.getSchedulerName()))
        .assertNext(records -> {
          assertThat(records).hasSize(UPLOADED_BUCKETS);
          assertThat(records).allMatch(record -> record.getStatus() == ExecutionStatus.SUCCESS);
          assertThat(records.get(0).getResultLocation().toString())
              .isEqualTo("s3://plant-data/inference/output/2021-04-07-20-00-00/results.jsonl");
        })
        .verifyComplete();

    // nothing was uploaded for the eleventh bucket
    final TimeBucket eleventh = buckets(UPLOADED_BUCKETS + 1).get(UPLOADED_BUCKETS);
    scheduler.fire(eleventh.getWindowStart());

    final List<ExecutionRecord> records = poller.poll(config.getSchedulerName()).block();
    assertThat(records).hasSize(UPLOADED_BUCKETS + 1);
    assertThat(records.get(UPLOADED_BUCKETS).getStatus()).isEqualTo(ExecutionStatus.FAILED);
    assertThat(records.get(UPLOADED_BUCKETS).getFailureReason())
        .isEqualTo(ExecutionRecord.NO_MATCHING_DATA_ROW);

    final IngestResult ingested = aggregator.ingest(records).block();
    assertThat(ingested.getPredictions()).hasSize(UPLOADED_BUCKETS);
    assertThat(ingested.getFailures()).isEmpty();

    final ComponentAggregation aggregation = aggregator.aggregateByComponent(
        ingested.getPredictions(), Map.of("S0", "pump", "S1", "pump"));
    assertThat(aggregation.getAggregates()).hasSize(UPLOADED_BUCKETS);
    for (ComponentAggregate aggregate : aggregation.getAggregates()) {
      assertThat(aggregate.getComponent()).isEqualTo("pump");
      assertThat(aggregate.getAggregatedContribution()).isCloseTo(1.0, within(1e-9));
    }
  }

  @Test
  void awaitingFirstExecutionOfFiringScheduler() {
    scheduler.upload(matcher.expectedFilename("pump", buckets(1).get(0), config));
    lifecycleService.createAndStart(config).block();
    scheduler.fire(FIRST_TICK);

    StepVerifier.create(poller.awaitFirstExecution(config.getSchedulerName(),
        ExecutionFilter.builder().status(ExecutionStatus.SUCCESS).build(),
        Duration.ofSeconds(1), null))
        .assertNext(records -> assertThat(records).hasSize(1))
        .verifyComplete();
  }

  private List<TimeBucket> buckets(int count) {
    return clock.bucketsOverRange(FIRST_TICK,
        FIRST_TICK.plus(config.getUploadFrequency().getDuration().multipliedBy(count)), config);
  }

  private void writeResult(ExecutionRecord record) throws IOException {
    if (record.getResultLocation() == null) {
      return;
    }
    final StorageLocation location = record.getResultLocation();
    final Path file = resultRoot.resolve(location.getBucket()).resolve(location.getPrefix());
    Files.createDirectories(file.getParent());
    Files.writeString(file, String.format(
        "{\"timestamp\":\"%s\",\"prediction\":1,"
            + "\"diagnostics\":[{\"name\":\"pump\\\\S0\",\"value\":0.6},{\"name\":\"pump\\\\S1\",\"value\":0.4}]}\n",
        record.getDataStartTime()), StandardCharsets.UTF_8);
  }
}
