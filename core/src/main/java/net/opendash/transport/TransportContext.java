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

import net.opendash.panel.PanelIdentity;
import net.opendash.state.LoadState;
import net.opendash.state.ResultAccumulator;

/**
 * What a transport needs from the panel loader that invoked it.
 *
 * @since 1.0
 */
public interface TransportContext {

  /** @return The panel's state. */
  public LoadState state();

  /** @return The accumulator over the panel's state. */
  public ResultAccumulator accumulator();

  /** Persists the current state to the panel cache in the background. */
  public void saveToCache();

  /** Restarts the panel's load from scratch. */
  public void reload();

  /** @return The organization searches run under. */
  public String orgId();

  /** @return The panel's identity. */
  public PanelIdentity identity();
}
