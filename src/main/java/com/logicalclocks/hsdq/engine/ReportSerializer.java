/*
 * Copyright (c) 2024 Hopsworks AB
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *
 * See the License for the specific language governing permissions and limitations under the License.
 */

package com.logicalclocks.hsdq.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.logicalclocks.hsdq.DataQualityException;
import com.logicalclocks.hsdq.metadata.ModelValidationReport;

import java.util.Map;

/**
 * JSON form of reports with snake_case keys and lowercase status values.
 */
public class ReportSerializer {

  private final ObjectMapper objectMapper = new ObjectMapper()
      .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
      .enable(SerializationFeature.INDENT_OUTPUT);

  public String toJson(Object report) throws DataQualityException {
    try {
      return objectMapper.writeValueAsString(report);
    } catch (JsonProcessingException e) {
      throw new DataQualityException("Could not serialize " + report.getClass().getSimpleName(), e);
    }
  }

  public Map<String, Object> toMap(Object report) {
    return objectMapper.convertValue(report, new TypeReference<Map<String, Object>>() {});
  }

  public ModelValidationReport readModelValidationReport(String json) throws DataQualityException {
    try {
      return objectMapper.readValue(json, ModelValidationReport.class);
    } catch (JsonProcessingException e) {
      throw new DataQualityException("Could not parse model validation report", e);
    }
  }
}
