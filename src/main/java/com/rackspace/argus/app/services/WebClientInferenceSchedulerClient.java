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

import com.rackspace.argus.app.exceptions.SchedulerServiceException;
import com.rackspace.argus.app.model.CreateSchedulerRequest;
import com.rackspace.argus.app.model.CreateSchedulerResponse;
import com.rackspace.argus.app.model.ExecutionFilter;
import com.rackspace.argus.app.model.ExecutionRecord;
import com.rackspace.argus.app.model.SchedulerConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Talks JSON over HTTP to the scheduling service's gateway.
 */
@Component
@Slf4j
public class WebClientInferenceSchedulerClient implements InferenceSchedulerClient {

  private final WebClient webClient;

  @Autowired
  public WebClientInferenceSchedulerClient(@Qualifier("schedulerWebClient") WebClient webClient) {
    this.webClient = webClient;
  }

  @Override
  public Mono<String> create(SchedulerConfig config) {
    return webClient.post()
        .uri("/schedulers")
        .accept(MediaType.APPLICATION_JSON)
        .contentType(MediaType.APPLICATION_JSON)
        .body(BodyInserters.fromValue(CreateSchedulerRequest.from(config)))
        .retrieve()
        .onStatus(HttpStatus::isError, WebClientInferenceSchedulerClient::toException)
        .bodyToMono(CreateSchedulerResponse.class)
        .map(CreateSchedulerResponse::getSchedulerId);
  }

  @Override
  public Mono<Void> start(String schedulerId) {
    return post("/schedulers/{id}/start", schedulerId);
  }

  @Override
  public Mono<Void> stop(String schedulerId) {
    return post("/schedulers/{id}/stop", schedulerId);
  }

  @Override
  public Mono<Void> delete(String schedulerId) {
    return webClient.delete()
        .uri("/schedulers/{id}", schedulerId)
        .retrieve()
        .onStatus(HttpStatus::isError, WebClientInferenceSchedulerClient::toException)
        .bodyToMono(Void.class);
  }

  @Override
  public Flux<ExecutionRecord> listExecutions(String schedulerId, ExecutionFilter filter) {
    return webClient.get()
        .uri(uriBuilder -> {
          uriBuilder.path("/schedulers/{id}/executions");
          if (filter.getStartTime() != null) {
            uriBuilder.queryParam("start", filter.getStartTime().toString());
          }
          if (filter.getEndTime() != null) {
            uriBuilder.queryParam("end", filter.getEndTime().toString());
          }
          if (filter.getStatus() != null) {
            uriBuilder.queryParam("status", filter.getStatus().name());
          }
          return uriBuilder.build(schedulerId);
        })
        .accept(MediaType.APPLICATION_JSON)
        .retrieve()
        .onStatus(HttpStatus::isError, WebClientInferenceSchedulerClient::toException)
        .bodyToFlux(ExecutionRecord.class);
  }

  private Mono<Void> post(String path, String schedulerId) {
    return webClient.post()
        .uri(path, schedulerId)
        .retrieve()
        .onStatus(HttpStatus::isError, WebClientInferenceSchedulerClient::toException)
        .bodyToMono(Void.class);
  }

  private static Mono<? extends Throwable> toException(ClientResponse response) {
    return response.bodyToMono(String.class)
        .defaultIfEmpty("")
        .map(body -> {
          log.debug("Scheduling service error {}: {}", response.statusCode(), body);
          return new SchedulerServiceException(response.statusCode(), body);
        });
  }
}
