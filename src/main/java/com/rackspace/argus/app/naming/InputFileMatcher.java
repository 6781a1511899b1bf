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

package com.rackspace.argus.app.naming;

import com.rackspace.argus.app.exceptions.MalformedFilenameException;
import com.rackspace.argus.app.model.ParsedFilename;
import com.rackspace.argus.app.model.SchedulerConfig;
import com.rackspace.argus.app.model.TimeBucket;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Exact-bucket matching of input files. A file named for any other bucket than the one
 * firing is never picked up, not even retroactively.
 */
@Component
@Slf4j
public class InputFileMatcher {

  private final Counter malformedCounter;

  @Autowired
  public InputFileMatcher(MeterRegistry meterRegistry) {
    malformedCounter = meterRegistry.counter("argus.input.malformed");
  }

  public boolean matches(String filename, TimeBucket bucket, SchedulerConfig config) {
    final ParsedFilename parsed;
    try {
      parsed = FileNamingCodec.decode(filename, config.getTimestampFormat(),
          config.getComponentDelimiter());
    } catch (MalformedFilenameException e) {
      log.debug("Ignoring input file: {}", e.getMessage());
      malformedCounter.increment();
      return false;
    }
    return parsed.getTimestamp().equals(bucket.getFilenameTime());
  }

  public List<String> matchingFiles(Collection<String> filenames, TimeBucket bucket,
                                    SchedulerConfig config) {
    return filenames.stream()
        .filter(filename -> matches(filename, bucket, config))
        .sorted()
        .collect(Collectors.toList());
  }

  public String expectedFilename(String componentName, TimeBucket bucket, SchedulerConfig config) {
    return FileNamingCodec.encode(componentName, bucket.getFilenameTime(),
        config.getTimestampFormat(), config.getComponentDelimiter());
  }
}
