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
package net.opendash.variables;

import java.util.List;

/**
 * The variable resolution subsystem. Reports the current list of
 * variables with their values and loading flags and notifies listeners
 * whenever any of them change.
 *
 * @since 1.0
 */
public interface VariableSource {

  /** @return The current variables, never null. */
  public List<Variable> getVariables();

  /**
   * Adds a listener called with the full list on every change.
   * @param listener A non-null listener.
   */
  public void subscribe(final VariableListener listener);

  /**
   * Removes the listener if it was present.
   * @param listener A non-null listener.
   */
  public void unsubscribe(final VariableListener listener);

  /** Notified when the variable list changes. */
  public interface VariableListener {
    public void onVariablesChanged(final List<Variable> variables);
  }
}
