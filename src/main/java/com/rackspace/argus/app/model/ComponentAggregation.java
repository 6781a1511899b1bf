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

import java.util.List;
import java.util.Set;
import lombok.Value;

/**
 * Per-component roll-up along with the diagnostics that could not be attributed because
 * their tag is missing from the catalog.
 */
@Value
public class ComponentAggregation {
  List<ComponentAggregate> aggregates;

  /**
   * Number of diagnostic entries left out of the roll-up.
   */
  int unmappedCount;

  Set<String> unmappedTags;
}
