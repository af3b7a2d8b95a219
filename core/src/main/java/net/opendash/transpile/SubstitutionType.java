// This file is part of OpenDash.
// Copyright (C) 2026  The OpenDash Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.opendash.transpile;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The kind of placeholder a substitution replaced.
 *
 * @since 1.0
 */
public enum SubstitutionType {
  /** Computed from the range and panel width, e.g. __interval. */
  FIXED("fixed"),

  /** A dependent dashboard variable. */
  VARIABLE("variable"),

  /** A global ad hoc filter injected into the query. */
  DYNAMIC_VARIABLE("dynamicVariable");

  private final String name;

  private SubstitutionType(final String name) {
    this.name = name;
  }

  @JsonValue
  public String getName() {
    return name;
  }

  @JsonCreator
  public static SubstitutionType fromName(final String name) {
    for (final SubstitutionType type : values()) {
      if (type.name.equals(name)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown substitution type: " + name);
  }
}
