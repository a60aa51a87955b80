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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class Records {

  private Records() {
  }

  public static Map<String, Object> record(Object... keyValues) {
    Map<String, Object> record = new LinkedHashMap<>();
    for (int i = 0; i < keyValues.length; i += 2) {
      record.put((String) keyValues[i], keyValues[i + 1]);
    }
    return record;
  }

  /**
   * Single column dataset, one record per value.
   */
  public static Dataset column(String column, Object... values) throws DataLoadException {
    List<Map<String, Object>> records = new ArrayList<>();
    for (Object value : values) {
      records.add(record(column, value));
    }
    return Dataset.of(records);
  }

  public static Dataset insurance() throws DataLoadException {
    List<Map<String, Object>> records = new ArrayList<>();
    records.add(record("age", 19, "sex", "female", "bmi", 27.9, "children", 0, "smoker", "yes",
        "region", "southwest", "charges", 16884.92));
    records.add(record("age", 18, "sex", "male", "bmi", 33.77, "children", 1, "smoker", "no",
        "region", "southeast", "charges", 1725.55));
    records.add(record("age", 28, "sex", "male", "bmi", 33.0, "children", 3, "smoker", "no",
        "region", "southeast", "charges", 4449.46));
    records.add(record("age", 33, "sex", "male", "bmi", 22.7, "children", 0, "smoker", "no",
        "region", "northwest", "charges", 21984.47));
    return Dataset.of(records);
  }
}
