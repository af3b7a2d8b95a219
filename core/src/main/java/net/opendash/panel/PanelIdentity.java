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
package net.opendash.panel;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.Objects;
import com.google.common.base.Strings;

/**
 * Where a panel lives: the panel, its dashboard and the dashboard's
 * folder. Used as the cache key and sent along with search requests.
 *
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = PanelIdentity.Builder.class)
public class PanelIdentity {
  private final String panel_id;
  private final String dashboard_id;
  private final String folder_id;

  protected PanelIdentity(final Builder builder) {
    if (Strings.isNullOrEmpty(builder.panelId)) {
      throw new IllegalArgumentException("Panel ID cannot be null or empty.");
    }
    panel_id = builder.panelId;
    dashboard_id = builder.dashboardId;
    folder_id = builder.folderId;
  }

  public String getPanelId() {
    return panel_id;
  }

  /** @return The dashboard ID, may be null for ad hoc panels. */
  public String getDashboardId() {
    return dashboard_id;
  }

  /** @return The folder ID, may be null. */
  public String getFolderId() {
    return folder_id;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final PanelIdentity other = (PanelIdentity) o;
    return Objects.equal(panel_id, other.panel_id)
        && Objects.equal(dashboard_id, other.dashboard_id)
        && Objects.equal(folder_id, other.folder_id);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(panel_id, dashboard_id, folder_id);
  }

  @Override
  public String toString() {
    return folder_id + "/" + dashboard_id + "/" + panel_id;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static final class Builder {
    @JsonProperty
    private String panelId;
    @JsonProperty
    private String dashboardId;
    @JsonProperty
    private String folderId;

    public Builder setPanelId(final String panel_id) {
      panelId = panel_id;
      return this;
    }

    public Builder setDashboardId(final String dashboard_id) {
      dashboardId = dashboard_id;
      return this;
    }

    public Builder setFolderId(final String folder_id) {
      folderId = folder_id;
      return this;
    }

    public PanelIdentity build() {
      return new PanelIdentity(this);
    }
  }
}
