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

import com.rackspace.argus.app.bucket.TimeBucketClock;
import com.rackspace.argus.app.model.ExecutionFilter;
import com.rackspace.argus.app.model.ExecutionRecord;
import com.rackspace.argus.app.model.SchedulerConfig;
import com.rackspace.argus.app.model.StorageLocation;
import com.rackspace.argus.app.model.TimeBucket;
import com.rackspace.argus.app.naming.FileNamingCodec;
import com.rackspace.argus.app.naming.InputFileMatcher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * In-memory scheduling service. Schedulers are identified by their name and only run when
 * {@link #fire(Instant)} is called.
 */
public class FakeInferenceScheduler implements InferenceSchedulerClient {

  private final TimeBucketClock clock = new TimeBucketClock();
  private final InputFileMatcher matcher = new InputFileMatcher(new SimpleMeterRegistry());

  private final Map<String, SchedulerConfig> schedulers = new HashMap<>();
  private final Set<String> running = new TreeSet<>();
  private final Map<String, List<ExecutionRecord>> executions = new HashMap<>();
  private final Set<String> uploads = new TreeSet<>();

  public void upload(String filename) {
    uploads.add(filename);
  }

  /**
   * Runs every started scheduler for the bucket of the given tick.
   */
  public List<ExecutionRecord> fire(Instant tick) {
    final List<ExecutionRecord> fired = new ArrayList<>();
    for (String name : running) {
      final SchedulerConfig config = schedulers.get(name);
      final TimeBucket bucket = clock.computeBucket(tick, config);
      final List<String> inputs = matcher.matchingFiles(uploads, bucket, config);

      final ExecutionRecord record;
      if (inputs.isEmpty()) {
        record = ExecutionRecord.failed(name, bucket, ExecutionRecord.NO_MATCHING_DATA_ROW);
      } else {
        record = ExecutionRecord.succeeded(name, bucket, resultLocation(config, bucket));
      }
      executions.computeIfAbsent(name, ignored -> new ArrayList<>()).add(record);
      fired.add(record);
    }
    return fired;
  }

  public static StorageLocation resultLocation(SchedulerConfig config, TimeBucket bucket) {
    return config.getOutputLocation()
        .resolve(FileNamingCodec.outputFolderName(bucket.getWindowStart(),
            config.getTimestampFormat()))
        .resolve(FileNamingCodec.RESULT_FILENAME);
  }

  @Override
  public Mono<String> create(SchedulerConfig config) {
    return Mono.fromCallable(() -> {
      if (schedulers.putIfAbsent(config.getSchedulerName(), config) != null) {
        throw new IllegalStateException("Scheduler exists: " + config.getSchedulerName());
      }
      return config.getSchedulerName();
    });
  }

  @Override
  public Mono<Void> start(String schedulerId) {
    return Mono.fromRunnable(() -> running.add(requireKnown(schedulerId)));
  }

  @Override
  public Mono<Void> stop(String schedulerId) {
    return Mono.fromRunnable(() -> running.remove(requireKnown(schedulerId)));
  }

  @Override
  public Mono<Void> delete(String schedulerId) {
    return Mono.fromRunnable(() -> {
      if (running.contains(requireKnown(schedulerId))) {
        throw new IllegalStateException("Scheduler is running: " + schedulerId);
      }
      schedulers.remove(schedulerId);
      executions.remove(schedulerId);
    });
  }

  @Override
  public Flux<ExecutionRecord> listExecutions(String schedulerId, ExecutionFilter filter) {
    return Flux.defer(() -> Flux.fromIterable(
        List.copyOf(executions.getOrDefault(schedulerId, List.of()))));
  }

  private String requireKnown(String schedulerId) {
    if (!schedulers.containsKey(schedulerId)) {
      throw new IllegalStateException("Unknown scheduler: " + schedulerId);
    }
    return schedulerId;
  }
}
