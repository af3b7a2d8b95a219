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
package net.opendash.search;

import java.util.List;

import com.stumbleupon.async.Deferred;

import net.opendash.panel.PanelIdentity;
import net.opendash.panel.TimeRange;
import net.opendash.state.Annotation;

/**
 * Fetches the annotations to draw over a panel.
 *
 * @since 1.0
 */
public interface AnnotationService {

  /**
   * @param org_id The organization.
   * @param identity The panel.
   * @param range The range to fetch for.
   * @return A deferred resolving to the annotations, possibly empty.
   */
  public Deferred<List<Annotation>> fetch(final String org_id,
                                          final PanelIdentity identity,
                                          final TimeRange range);
}
