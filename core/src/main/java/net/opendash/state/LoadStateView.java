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

import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.databind.node.ArrayNode;

/**
 * The read-only face of a panel's load state handed to consumers such as
 * renderers. Collections returned are copies.
 *
 * @since 1.0
 */
public interface LoadStateView {

  /** @return A deep copy of the per slot result rows. */
  public List<ArrayNode> getData();

  /** @return Copies of the per slot response envelopes. */
  public List<ResultMetaData> getResultMetaData();

  /** @return The per slot query provenance. */
  public List<QueryMetadata> getQueries();

  /** @return The annotations for the current range. */
  public List<Annotation> getAnnotations();

  public boolean isLoading();

  public int getLoadingTotal();

  public int getLoadingCompleted();

  public int getLoadingProgressPercentage();

  /** @return True if the rows may not cover the full requested range. */
  public boolean isPartialData();

  /** @return True while a user cancel is being processed. */
  public boolean isOperationCancelled();

  /** @return The last error, {@link ErrorDetail#EMPTY} if none. */
  public ErrorDetail getErrorDetail();

  /** @return The trace ids of in-flight backend requests. */
  public Set<String> getSearchRequestTraceIds();

  /** @return True if restored rows were cached for a range of another
   * duration. */
  public boolean isCachedDataDifferWithCurrentTimeRange();

  /** @return The epoch millis of the last executed cycle, null if none. */
  public Long getLastTriggeredAt();

  /** @return An immutable copy of the whole state. */
  public LoadStateSnapshot snapshot();

  /**
   * Registers a listener called after each published mutation batch.
   * @param listener A non-null listener.
   */
  public void subscribe(final LoadStateListener listener);

  /**
   * Removes the listener.
   * @param listener The listener to remove.
   */
  public void unsubscribe(final LoadStateListener listener);
}
