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

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.rackspace.argus.app.bucket.TimeBucketClock;
import com.rackspace.argus.app.config.AppProperties;
import com.rackspace.argus.app.exceptions.PollTimeoutException;
import com.rackspace.argus.app.exceptions.SchedulerServiceException;
import com.rackspace.argus.app.model.ComponentAggregate;
import com.rackspace.argus.app.model.ComponentAggregation;
import com.rackspace.argus.app.model.ComponentDelimiter;
import com.rackspace.argus.app.model.ExecutionRecord;
import com.rackspace.argus.app.model.ExecutionStatus;
import com.rackspace.argus.app.model.IngestResult;
import com.rackspace.argus.app.model.PredictionRecord;
import com.rackspace.argus.app.model.SchedulerConfig;
import com.rackspace.argus.app.model.SchedulerConfigs;
import com.rackspace.argus.app.model.StorageLocation;
import com.rackspace.argus.app.model.TimestampFormat;
import com.rackspace.argus.app.services.AnomalyEventExtractor;
import com.rackspace.argus.app.services.DiagnosticsSession;
import com.rackspace.argus.app.services.DiagnosticsSessionFactory;
import com.rackspace.argus.app.services.ExecutionPoller;
import com.rackspace.argus.app.services.ResultAggregator;
import com.rackspace.argus.app.services.SensorCatalog;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

@ActiveProfiles("test")
@WebFluxTest(controllers = SchedulerController.class)
@Import({TimeBucketClock.class, AnomalyEventExtractor.class})
class SchedulerControllerTest {

  static final String SCHEDULER = "pump-station-scheduler";

  @TestConfiguration
  static class SchedulerConfigTestConfig {
    @Bean
    SchedulerConfig schedulerConfig() {
      return SchedulerConfigs.builder()
          .schedulerName(SCHEDULER)
          .timezoneOffset(ZoneOffset.of("+05:30"))
          .timestampFormat(TimestampFormat.DASHED)
          .componentDelimiter(ComponentDelimiter.HYPHEN)
          .build();
    }

    @Bean
    AppProperties appProperties() {
      final AppProperties appProperties = new AppProperties();
      appProperties.getPoll()
          .setInterval(Duration.ofSeconds(1))
          .setMaxWait(Duration.ofSeconds(10));
      return appProperties;
    }
  }

  @MockBean
  ExecutionPoller poller;

  @MockBean
  DiagnosticsSessionFactory sessionFactory;

  @MockBean
  ResultAggregator aggregator;

  @MockBean
  SensorCatalog sensorCatalog;

  @Autowired
  WebTestClient webTestClient;

  @Test
  void bucket() {
    webTestClient.get().uri("/api/bucket?at=2021-04-05T13:02:00Z")
        .exchange()
        .expectStatus().isOk()
        .expectBody()
        .jsonPath("$.windowStart").isEqualTo("2021-04-05T13:00:00Z")
        .jsonPath("$.windowEnd").isEqualTo("2021-04-05T13:05:00Z")
        .jsonPath("$.expectedFilenameTimestamp").isEqualTo("2021-04-05-18-30-00");
  }

  @Test
  void bucketWithInvalidTime() {
    webTestClient.get().uri("/api/bucket?at=tomorrow")
        .exchange()
        .expectStatus().isBadRequest()
        .expectBody()
        .jsonPath("$.status").isEqualTo(400)
        .jsonPath("$.message").isEqualTo("Invalid relative time format");
  }

  @Test
  void executions() {
    final ExecutionRecord record = new ExecutionRecord()
        .setSchedulerName(SCHEDULER)
        .setDataStartTime(Instant.parse("2021-04-05T13:00:00Z"))
        .setDataEndTime(Instant.parse("2021-04-05T13:05:00Z"))
        .setStatus(ExecutionStatus.SUCCESS)
        .setResultLocation(StorageLocation.parse("s3://out/2021-04-05-13-00-00/results.jsonl"));
    when(poller.poll(eq(SCHEDULER), any())).thenReturn(Mono.just(List.of(record)));

    webTestClient.get().uri("/api/executions?status=SUCCESS&start=2021-04-05T13:00:00Z")
        .exchange()
        .expectStatus().isOk()
        .expectBody()
        .jsonPath("$[0].status").isEqualTo("SUCCESS")
        .jsonPath("$[0].resultLocation").isEqualTo("s3://out/2021-04-05-13-00-00/results.jsonl");

    verify(poller).poll(eq(SCHEDULER), argThat(filter ->
        filter.getStatus() == ExecutionStatus.SUCCESS
            && Instant.parse("2021-04-05T13:00:00Z").equals(filter.getStartTime())
            && filter.getEndTime() == null));
  }

  @Test
  void executionsWhenServiceFails() {
    when(poller.poll(eq(SCHEDULER), any())).thenReturn(Mono.error(
        new SchedulerServiceException(HttpStatus.SERVICE_UNAVAILABLE, "maintenance")));

    webTestClient.get().uri("/api/executions")
        .exchange()
        .expectStatus().isEqualTo(HttpStatus.BAD_GATEWAY)
        .expectBody()
        .jsonPath("$.error").isEqualTo("Bad Gateway");
  }

  @Test
  void awaitExecutions() {
    final ExecutionRecord record = new ExecutionRecord()
        .setSchedulerName(SCHEDULER)
        .setDataStartTime(Instant.parse("2021-04-05T13:00:00Z"))
        .setStatus(ExecutionStatus.IN_PROGRESS);
    when(poller.awaitFirstExecution(eq(SCHEDULER), any(), eq(Duration.ofSeconds(1)),
        eq(Duration.ofSeconds(10))))
        .thenReturn(Mono.just(List.of(record)));

    webTestClient.get().uri("/api/executions/await")
        .exchange()
        .expectStatus().isOk()
        .expectBody()
        .jsonPath("$.length()").isEqualTo(1)
        .jsonPath("$[0].status").isEqualTo("IN_PROGRESS");
  }

  @Test
  void awaitExecutionsTimesOut() {
    when(poller.awaitFirstExecution(eq(SCHEDULER), any(), any(), any()))
        .thenReturn(Mono.error(new PollTimeoutException(SCHEDULER, Duration.ofSeconds(10))));

    webTestClient.get().uri("/api/executions/await?status=SUCCESS")
        .exchange()
        .expectStatus().isEqualTo(HttpStatus.GATEWAY_TIMEOUT)
        .expectBody()
        .jsonPath("$.status").isEqualTo(504);

    verify(poller).awaitFirstExecution(eq(SCHEDULER),
        argThat(filter -> filter.getStatus() == ExecutionStatus.SUCCESS),
        eq(Duration.ofSeconds(1)), eq(Duration.ofSeconds(10)));
  }

  @Test
  void componentDiagnostics() {
    final IngestResult ingested = givenIngested(List.of());
    when(sensorCatalog.getTagToComponent()).thenReturn(Map.of("S0", "pump"));
    when(aggregator.aggregateByComponent(ingested.getPredictions(), Map.of("S0", "pump")))
        .thenReturn(new ComponentAggregation(List.of(new ComponentAggregate(
            Instant.parse("2021-04-07T20:00:00Z"), "pump", 1.0)), 0, Set.of()));

    webTestClient.get().uri("/api/diagnostics/components")
        .exchange()
        .expectStatus().isOk()
        .expectBody()
        .jsonPath("$.aggregates[0].component").isEqualTo("pump")
        .jsonPath("$.aggregates[0].aggregatedContribution").isEqualTo(1.0)
        .jsonPath("$.unmappedCount").isEqualTo(0);
  }

  @Test
  void topSensors() {
    final IngestResult ingested = givenIngested(List.of());
    when(aggregator.topContributors(ingested.getPredictions(), 2))
        .thenReturn(List.of("pump\\S0", "motor\\S2"));

    webTestClient.get().uri("/api/diagnostics/top-sensors?k=2")
        .exchange()
        .expectStatus().isOk()
        .expectBody(List.class)
        .isEqualTo(List.of("pump\\S0", "motor\\S2"));
  }

  @Test
  void topSensorsWithNegativeK() {
    webTestClient.get().uri("/api/diagnostics/top-sensors?k=-1")
        .exchange()
        .expectStatus().isBadRequest();

    verifyNoInteractions(sessionFactory);
  }

  @Test
  void eventsDefaultToUploadFrequencyGap() {
    givenIngested(List.of(
        new PredictionRecord(Instant.parse("2021-04-07T20:00:00Z"), true, List.of()),
        new PredictionRecord(Instant.parse("2021-04-07T20:05:00Z"), true, List.of()),
        new PredictionRecord(Instant.parse("2021-04-07T20:11:00Z"), true, List.of())
    ));

    webTestClient.get().uri("/api/diagnostics/events")
        .exchange()
        .expectStatus().isOk()
        .expectBody()
        .jsonPath("$.length()").isEqualTo(2)
        .jsonPath("$[0].predictionCount").isEqualTo(2)
        .jsonPath("$[1].start").isEqualTo("2021-04-07T20:11:00Z");
  }

  @Test
  void eventsWithGap() {
    givenIngested(List.of(
        new PredictionRecord(Instant.parse("2021-04-07T20:00:00Z"), true, List.of()),
        new PredictionRecord(Instant.parse("2021-04-07T20:11:00Z"), true, List.of())
    ));

    webTestClient.get().uri("/api/diagnostics/events?maxGap=" + Duration.ofMinutes(15))
        .exchange()
        .expectStatus().isOk()
        .expectBody()
        .jsonPath("$.length()").isEqualTo(1)
        .jsonPath("$[0].end").isEqualTo("2021-04-07T20:11:00Z");
  }

  private IngestResult givenIngested(List<PredictionRecord> predictions) {
    final IngestResult ingested = new IngestResult(predictions, List.of());
    final DiagnosticsSession session = mock(DiagnosticsSession.class);
    when(sessionFactory.open(SCHEDULER)).thenReturn(session);
    when(session.refreshAndIngest(any())).thenReturn(Mono.just(ingested));
    return ingested;
  }
}
