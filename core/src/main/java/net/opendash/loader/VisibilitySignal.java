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
 * Reports whether the panel's viewport element is on screen.
 *
 * @since 1.0
 */
public interface VisibilitySignal {

  /** @return Whether or not the panel is currently visible. */
  public boolean isVisible();

  /**
   * Adds a listener notified on every intersection change.
   * @param listener A non-null listener.
   */
  public void subscribe(final VisibilityListener listener);

  /**
   * Removes the listener and, once none remain, stops observing.
   * @param listener A non-null listener.
   */
  public void unsubscribe(final VisibilityListener listener);

  /** Notified when the panel enters or leaves the viewport. */
  public interface VisibilityListener {
    public void onVisibilityChanged(final boolean visible);
  }
}
