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

package com.rackspace.argus.app.config;

import com.rackspace.argus.app.model.TimestampFormat;
import org.springframework.boot.context.properties.ConfigurationPropertiesBinding;
import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;

/**
 * Lets the timestamp format be configured by its pattern, as in
 * <code>timestamp-format: yyyy-MM-dd-HH-mm-ss</code>.
 */
@Component
@ConfigurationPropertiesBinding
public class StringToTimestampFormatConverter implements Converter<String, TimestampFormat> {

  @Override
  public TimestampFormat convert(String input) {
    return TimestampFormat.fromPattern(input);
  }
}
