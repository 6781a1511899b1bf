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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.rackspace.argus.app.exceptions.CorruptResultPayloadException;
import com.rackspace.argus.app.model.DiagnosticEntry;
import com.rackspace.argus.app.model.PredictionRecord;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Parses result payloads: one JSON object per line with <code>timestamp</code>,
 * <code>prediction</code> and <code>diagnostics</code>. Anything that doesn't have exactly
 * that shape is rejected.
 */
@Component
public class ResultPayloadParser {

  private final ObjectReader reader;

  @Autowired
  public ResultPayloadParser(ObjectMapper objectMapper) {
    this.reader = objectMapper.reader()
        .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
  }

  /**
   * @param execution identifies the payload's execution in error messages
   * @throws CorruptResultPayloadException on the first line that isn't a valid record
   */
  public List<PredictionRecord> parse(String payload, String execution) {
    final List<PredictionRecord> records = new ArrayList<>();
    final String[] lines = payload.split("\\r?\\n");
    for (int i = 0; i < lines.length; i++) {
      if (!lines[i].isBlank()) {
        records.add(parseLine(lines[i], execution, i + 1));
      }
    }
    return records;
  }

  PredictionRecord parseLine(String line, String execution, int lineNumber) {
    final JsonNode node;
    try {
      node = reader.readTree(line);
    } catch (JsonProcessingException e) {
      throw new CorruptResultPayloadException(execution, lineNumber, e.getOriginalMessage(), e);
    }
    if (node == null || !node.isObject()) {
      throw new CorruptResultPayloadException(execution, lineNumber, "not a JSON object");
    }

    final Instant timestamp = parseTimestamp(node.get("timestamp"), execution, lineNumber);

    final JsonNode prediction = node.get("prediction");
    if (prediction == null || !prediction.isIntegralNumber()
        || (prediction.asInt() != 0 && prediction.asInt() != 1)) {
      throw new CorruptResultPayloadException(execution, lineNumber, "prediction must be 0 or 1");
    }

    final JsonNode diagnostics = node.get("diagnostics");
    if (diagnostics == null || !diagnostics.isArray()) {
      throw new CorruptResultPayloadException(execution, lineNumber, "diagnostics must be an array");
    }
    final List<DiagnosticEntry> entries = new ArrayList<>(diagnostics.size());
    for (JsonNode diagnostic : diagnostics) {
      entries.add(parseDiagnostic(diagnostic, execution, lineNumber));
    }

    return new PredictionRecord(timestamp, prediction.asInt() == 1, entries);
  }

  private static DiagnosticEntry parseDiagnostic(JsonNode diagnostic, String execution,
                                                 int lineNumber) {
    final JsonNode name = diagnostic.get("name");
    final JsonNode value = diagnostic.get("value");
    if (name == null || !name.isTextual() || name.asText().isEmpty()) {
      throw new CorruptResultPayloadException(execution, lineNumber, "diagnostic without a name");
    }
    if (value == null || !value.isNumber()) {
      throw new CorruptResultPayloadException(execution, lineNumber,
          "diagnostic " + name.asText() + " has no numeric value");
    }
    final double fraction = value.asDouble();
    if (!(fraction >= 0.0 && fraction <= 1.0)) {
      throw new CorruptResultPayloadException(execution, lineNumber,
          "diagnostic " + name.asText() + " is outside of [0,1]: " + fraction);
    }
    return new DiagnosticEntry(name.asText(), fraction);
  }

  /**
   * Timestamps without an offset, which is how the service writes them, are UTC.
   */
  private static Instant parseTimestamp(JsonNode timestamp, String execution, int lineNumber) {
    if (timestamp == null || !timestamp.isTextual()) {
      throw new CorruptResultPayloadException(execution, lineNumber, "timestamp is missing");
    }
    try {
      final TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parse(timestamp.asText());
      if (parsed.isSupported(ChronoField.OFFSET_SECONDS)) {
        return OffsetDateTime.from(parsed).toInstant();
      }
      return LocalDateTime.from(parsed).toInstant(ZoneOffset.UTC);
    } catch (DateTimeException e) {
      throw new CorruptResultPayloadException(execution, lineNumber,
          "invalid timestamp " + timestamp.asText(), e);
    }
  }
}
