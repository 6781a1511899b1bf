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
import com.rackspace.argus.app.model.SchedulerConfig;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Operations of the remote scheduling service. Transport failures are signalled as errors
 * and are not interpreted here.
 */
public interface InferenceSchedulerClient {

  /**
   * @return the identifier of the new scheduler
   */
  Mono<String> create(SchedulerConfig config);

  Mono<Void> start(String schedulerId);

  Mono<Void> stop(String schedulerId);

  Mono<Void> delete(String schedulerId);

  /**
   * The service keeps an append-only log of executions per scheduler, so consecutive
   * listings never shrink but may stay empty for a while after the scheduler starts.
   */
  Flux<ExecutionRecord> listExecutions(String schedulerId, ExecutionFilter filter);
}
