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
package net.opendash.loader;

/**
 * Where a panel's current load cycle is.
 *
 * @since 1.0
 */
public enum LoaderState {
  /** Nothing was triggered yet. */
  IDLE,

  /** Waiting out the debounce interval. */
  DEBOUNCING,

  /** Waiting for the panel to scroll into view. */
  AWAITING_VISIBILITY,

  /** Waiting for the variables the panel uses to resolve. */
  AWAITING_VARIABLES,

  /** Restoring from cache or running queries. */
  EXECUTING,

  /** The cycle finished, possibly with partial data. */
  COMPLETED,

  /** The cycle was superseded, cancelled by the user or torn down. */
  CANCELLED,

  /** At least one query failed. */
  FAILED;

  /** @return Whether or not a cycle in this state is finished. */
  public boolean isTerminal() {
    return this == COMPLETED || this == CANCELLED || this == FAILED;
  }
}
