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
import com.rackspace.argus.app.model.ComponentDelimiter;
import com.rackspace.argus.app.model.ParsedFilename;
import com.rackspace.argus.app.model.TimestampFormat;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Input files are named <code>&lt;component&gt;&lt;delimiter&gt;&lt;timestamp&gt;.csv</code>.
 * The component name can't contain the delimiter, which makes the split unambiguous for every
 * combination of delimiter and timestamp format.
 */
public final class FileNamingCodec {

  public static final String EXTENSION = ".csv";
  public static final String RESULT_FILENAME = "results.jsonl";

  private static final LocalDateTime EPOCH_START = LocalDateTime.of(1970, 1, 1, 0, 0);

  private FileNamingCodec() {
  }

  /**
   * @throws MalformedFilenameException when the result could not be decoded again, such as an
   * {@link TimestampFormat#EPOCH} timestamp before 1970
   */
  public static String encode(String componentName, LocalDateTime timestamp,
                              TimestampFormat format, ComponentDelimiter delimiter) {
    if (componentName == null || componentName.isEmpty()) {
      throw new MalformedFilenameException(String.valueOf(componentName), "component name is empty");
    }
    if (delimiter.occurrencesIn(componentName) > 0) {
      throw new MalformedFilenameException(componentName,
          String.format("component name contains the delimiter '%s'", delimiter.getSymbol()));
    }
    if (format == TimestampFormat.EPOCH && timestamp.isBefore(EPOCH_START)) {
      throw new MalformedFilenameException(componentName,
          String.format("epoch timestamps can't precede 1970, got %s", timestamp));
    }
    return componentName + delimiter.getSymbol() + format.format(timestamp) + EXTENSION;
  }

  public static ParsedFilename decode(String filename, TimestampFormat format,
                                      ComponentDelimiter delimiter) {
    if (filename == null || !filename.endsWith(EXTENSION)) {
      throw new MalformedFilenameException(String.valueOf(filename),
          "expected the " + EXTENSION + " extension");
    }
    final String stem = filename.substring(0, filename.length() - EXTENSION.length());

    final int expected = expectedDelimiterCount(format, delimiter);
    final int actual = delimiter.occurrencesIn(stem);
    if (actual != expected) {
      throw new MalformedFilenameException(filename,
          String.format("expected %d occurrence(s) of '%s' but found %d",
              expected, delimiter.getSymbol(), actual));
    }

    final int split = stem.indexOf(delimiter.getSymbol());
    final String componentName = stem.substring(0, split);
    if (componentName.isEmpty()) {
      throw new MalformedFilenameException(filename, "component name is empty");
    }
    final String timestamp = stem.substring(split + 1);
    try {
      return new ParsedFilename(componentName, format.parse(timestamp));
    } catch (DateTimeParseException e) {
      throw new MalformedFilenameException(filename,
          String.format("timestamp '%s' does not match %s", timestamp, format.getPattern()), e);
    }
  }

  /**
   * Name of the subfolder the scheduling service writes an execution's results into,
   * derived from the UTC start of the execution's data.
   */
  public static String outputFolderName(Instant executionStart, TimestampFormat format) {
    return format.format(LocalDateTime.ofInstant(executionStart, ZoneOffset.UTC));
  }

  public static Instant parseOutputFolderName(String folderName, TimestampFormat format) {
    try {
      return format.parse(folderName).toInstant(ZoneOffset.UTC);
    } catch (DateTimeParseException e) {
      throw new MalformedFilenameException(folderName,
          "output folder does not match " + format.getPattern(), e);
    }
  }

  /**
   * The delimiter separating the component plus any the timestamp itself carries, such as
   * the dashes in <code>yyyy-MM-dd-HH-mm-ss</code>.
   */
  static int expectedDelimiterCount(TimestampFormat format, ComponentDelimiter delimiter) {
    return 1 + delimiter.occurrencesIn(format.format(LocalDateTime.of(2000, 1, 1, 0, 0)));
  }
}
