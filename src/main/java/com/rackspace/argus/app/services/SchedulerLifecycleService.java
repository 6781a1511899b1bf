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

import com.rackspace.argus.app.model.SchedulerConfig;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Creates, starts, stops and deletes schedulers. Configurations are immutable, so changing
 * one goes through {@link #recreate(String, SchedulerConfig)}.
 */
@Service
@Slf4j
public class SchedulerLifecycleService {

  private final InferenceSchedulerClient schedulerClient;
  private final MeterRegistry meterRegistry;

  @Autowired
  public SchedulerLifecycleService(InferenceSchedulerClient schedulerClient,
                                   MeterRegistry meterRegistry) {
    this.schedulerClient = schedulerClient;
    this.meterRegistry = meterRegistry;
  }

  public Mono<String> create(SchedulerConfig config) {
    return schedulerClient.create(config)
        .doOnNext(id -> {
          log.info("Created scheduler {} as {} for model {} every {}",
              config.getSchedulerName(), id, config.getModelName(), config.getUploadFrequency());
          count("create");
        });
  }

  public Mono<Void> start(String schedulerId) {
    return schedulerClient.start(schedulerId)
        .doOnSuccess(ignored -> {
          log.info("Started scheduler {}", schedulerId);
          count("start");
        });
  }

  public Mono<Void> stop(String schedulerId) {
    return schedulerClient.stop(schedulerId)
        .doOnSuccess(ignored -> {
          log.info("Stopped scheduler {}", schedulerId);
          count("stop");
        });
  }

  public Mono<Void> delete(String schedulerId) {
    return schedulerClient.delete(schedulerId)
        .doOnSuccess(ignored -> {
          log.info("Deleted scheduler {}", schedulerId);
          count("delete");
        });
  }

  public Mono<String> createAndStart(SchedulerConfig config) {
    return create(config)
        .flatMap(id -> start(id).thenReturn(id));
  }

  /**
   * Stops and deletes the existing scheduler, then creates and starts one with the new
   * configuration.
   *
   * @return the identifier of the new scheduler
   */
  public Mono<String> recreate(String schedulerId, SchedulerConfig config) {
    return stop(schedulerId)
        .then(Mono.defer(() -> delete(schedulerId)))
        .then(Mono.defer(() -> createAndStart(config)));
  }

  private void count(String operation) {
    meterRegistry.counter("argus.scheduler.lifecycle", "operation", operation).increment();
  }
}
