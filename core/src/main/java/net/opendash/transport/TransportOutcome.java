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
package net.opendash.transport;

/**
 * How a transport's run over one query slot ended.
 *
 * @since 1.0
 */
public enum TransportOutcome {
  /** Every result was received. */
  COMPLETED,
  /** The run stopped early but what arrived is usable, e.g. a range cap. */
  PARTIAL,
  /** The run failed and the error was recorded in the state. */
  FAILED,
  /** The cycle was cancelled. */
  CANCELLED;
}
