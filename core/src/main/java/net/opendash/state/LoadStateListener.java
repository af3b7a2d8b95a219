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
package net.opendash.state;

/**
 * Notified after a batch of mutations to a panel's {@link LoadState}.
 *
 * @since 1.0
 */
public interface LoadStateListener {

  /**
   * Called with an immutable copy of the state. Implementations must not
   * block as they run on the thread that mutated the state.
   * @param snapshot A non-null snapshot.
   */
  public void onStateChanged(final LoadStateSnapshot snapshot);
}
