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

import java.util.Collection;

import com.stumbleupon.async.Deferred;

import net.opendash.core.LoadCycle;

/**
 * Runs one logical SQL query against the back end and feeds the results
 * into the panel state through the context's accumulator. Implementations
 * must observe the cycle's cancellation at every network call and write
 * nothing once it's cancelled.
 *
 * @since 1.0
 */
public interface TransportStrategy {

  /** @return A short name for logging. */
  public String name();

  /**
   * Runs the query.
   * @param request The query and its destination slot.
   * @param cycle The cycle it runs in.
   * @param context The loader's context.
   * @return A deferred resolving to the outcome. Failures are recorded in
   * the state and resolve to {@link TransportOutcome#FAILED} rather than
   * an exception.
   */
  public Deferred<TransportOutcome> execute(final TransportRequest request,
                                            final LoadCycle cycle,
                                            final TransportContext context);

  /**
   * Asks the back end to stop in-flight searches.
   * @param trace_ids The trace ids of the searches.
   * @param org_id The organization.
   */
  public void cancelTraceIds(final Collection<String> trace_ids,
                             final String org_id);
}
