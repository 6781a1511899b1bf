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

import com.rackspace.argus.app.config.AppProperties;
import com.rackspace.argus.app.model.StorageLocation;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Serves storage locations from a directory tree where each bucket is a top level directory,
 * such as a synced copy of the output bucket.
 */
@Component
@Slf4j
public class FileSystemResultStore implements ResultStore {

  private final Path rootDirectory;

  @Autowired
  public FileSystemResultStore(AppProperties appProperties) {
    this(appProperties.getResults().getRootDirectory());
  }

  public FileSystemResultStore(Path rootDirectory) {
    this.rootDirectory = rootDirectory.toAbsolutePath().normalize();
  }

  @Override
  public Mono<String> fetch(StorageLocation location) {
    return Mono.fromCallable(() -> {
      final Path path = resolve(location);
      log.trace("Reading {} from {}", location, path);
      return Files.readString(path, StandardCharsets.UTF_8);
    })
        .subscribeOn(Schedulers.boundedElastic());
  }

  Path resolve(StorageLocation location) {
    final Path path = rootDirectory.resolve(location.getBucket())
        .resolve(location.getPrefix())
        .normalize();
    if (!path.startsWith(rootDirectory)) {
      throw new IllegalArgumentException("Location escapes the result directory: " + location);
    }
    return path;
  }
}
