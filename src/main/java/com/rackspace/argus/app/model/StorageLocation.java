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

package com.rackspace.argus.app.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.rackspace.argus.app.exceptions.InvalidConfigException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * An object storage address such as <code>s3://bucket/prefix/</code>.
 */
@Getter
@EqualsAndHashCode
public class StorageLocation {

  private static final Pattern ADDRESS =
      Pattern.compile("(?:(?<scheme>[a-z][a-z0-9+.-]*)://)?(?<bucket>[^/\\s]+)(?:/(?<prefix>.*))?");
  private static final String DEFAULT_SCHEME = "s3";

  private final String scheme;
  private final String bucket;
  private final String prefix;

  public StorageLocation(String scheme, String bucket, String prefix) {
    this.scheme = scheme;
    this.bucket = bucket;
    this.prefix = prefix == null ? "" : prefix;
  }

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static StorageLocation parse(String address) {
    if (address == null || address.isBlank()) {
      throw new InvalidConfigException("Storage location is required");
    }
    final Matcher m = ADDRESS.matcher(address.trim());
    if (!m.matches()) {
      throw new InvalidConfigException("Invalid storage location: " + address);
    }
    final String prefix = m.group("prefix");
    if (prefix != null && prefix.startsWith("/")) {
      throw new InvalidConfigException("Storage location prefix must not start with '/': " + address);
    }
    return new StorageLocation(
        m.group("scheme") == null ? DEFAULT_SCHEME : m.group("scheme"),
        m.group("bucket"),
        prefix
    );
  }

  public StorageLocation resolve(String child) {
    if (prefix.isEmpty()) {
      return new StorageLocation(scheme, bucket, child);
    }
    return new StorageLocation(scheme, bucket,
        prefix.endsWith("/") ? prefix + child : prefix + "/" + child);
  }

  @JsonValue
  @Override
  public String toString() {
    return String.format("%s://%s/%s", scheme, bucket, prefix);
  }
}
