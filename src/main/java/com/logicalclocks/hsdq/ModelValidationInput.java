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

package com.logicalclocks.hsdq;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;

import java.util.List;
import java.util.Map;

/**
 * Everything a model serving collaborator hands over for one validation run. Protected attributes, output
 * type and clinical context are optional.
 */
@Builder
public class ModelValidationInput {

  @Getter
  @NonNull
  private final double[] predictions;
  @Getter
  @NonNull
  private final double[] actual;
  @Getter
  @Singular
  private final Map<String, List<?>> protectedAttributes;
  // model output kind, e.g. charges or bmi
  @Getter
  private final String outputType;
  @Getter
  private final ClinicalContext clinicalContext;
}
