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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

import net.opendash.core.Const;

/**
 * The declarative definition of a panel: its queries, query language and
 * display config. Display-only fields ({@link #COSMETIC_FIELDS}) are
 * carried for serialization but never influence a load.
 *
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = PanelSchema.Builder.class)
public class PanelSchema {
  /** JSON fields that don't change what gets loaded. */
  public static final ImmutableSet<String> COSMETIC_FIELDS = ImmutableSet.of(
      "version", "layout", "htmlContent", "markdownContent");

  private final String id;
  private final Integer version;
  private final String type;
  private final String title;
  private final String query_type;
  private final List<PanelQuery> queries;
  private final String step_value;
  private final JsonNode layout;
  private final String html_content;
  private final String markdown_content;

  protected PanelSchema(final Builder builder) {
    id = builder.id;
    version = builder.version;
    type = builder.type;
    title = builder.title;
    query_type = Strings.isNullOrEmpty(builder.queryType) ?
        Const.SQL : builder.queryType;
    queries = builder.queries == null ?
        Collections.<PanelQuery>emptyList() :
          ImmutableList.copyOf(builder.queries);
    step_value = builder.stepValue;
    layout = builder.layout;
    html_content = builder.htmlContent;
    markdown_content = builder.markdownContent;
  }

  public String getId() {
    return id;
  }

  public Integer getVersion() {
    return version;
  }

  /** @return The chart type, e.g. "line" or "table". */
  public String getType() {
    return type;
  }

  public String getTitle() {
    return title;
  }

  /** @return The query language, "sql" when not set. */
  public String getQueryType() {
    return query_type;
  }

  /** @return The queries, never null. */
  public List<PanelQuery> getQueries() {
    return queries;
  }

  /** @return The PromQL step, may be null. */
  public String getStepValue() {
    return step_value;
  }

  public JsonNode getLayout() {
    return layout;
  }

  public String getHtmlContent() {
    return html_content;
  }

  public String getMarkdownContent() {
    return markdown_content;
  }

  /** @return True if at least one query has non-blank text. */
  @JsonIgnore
  public boolean hasExecutableQuery() {
    for (final PanelQuery query : queries) {
      if (query.isExecutable()) {
        return true;
      }
    }
    return false;
  }

  /** @return True if the queries are PromQL. */
  @JsonIgnore
  public boolean isPromql() {
    return Const.PROMQL.equals(query_type);
  }

  /** @return True if the chart type renders annotations. */
  @JsonIgnore
  public boolean requiresAnnotations() {
    return type != null && Const.ANNOTATION_PANEL_TYPES.contains(type);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final PanelSchema other = (PanelSchema) o;
    return Objects.equal(id, other.id)
        && Objects.equal(version, other.version)
        && Objects.equal(type, other.type)
        && Objects.equal(title, other.title)
        && Objects.equal(query_type, other.query_type)
        && Objects.equal(queries, other.queries)
        && Objects.equal(step_value, other.step_value)
        && Objects.equal(layout, other.layout)
        && Objects.equal(html_content, other.html_content)
        && Objects.equal(markdown_content, other.markdown_content);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(id, version, type, title, query_type, queries,
        step_value);
  }

  @Override
  public String toString() {
    return "id=" + id + ", type=" + type + ", queryType=" + query_type
        + ", queries=" + queries;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Clones a schema into a new builder.
   * @param schema A non-null schema to pull values from.
   * @return A new builder populated with values from the given schema.
   */
  public static Builder newBuilder(final PanelSchema schema) {
    return new Builder()
        .setId(schema.id)
        .setVersion(schema.version)
        .setType(schema.type)
        .setTitle(schema.title)
        .setQueryType(schema.query_type)
        .setQueries(schema.queries)
        .setStepValue(schema.step_value)
        .setLayout(schema.layout)
        .setHtmlContent(schema.html_content)
        .setMarkdownContent(schema.markdown_content);
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static final class Builder {
    @JsonProperty
    private String id;
    @JsonProperty
    private Integer version;
    @JsonProperty
    private String type;
    @JsonProperty
    private String title;
    @JsonProperty
    private String queryType;
    @JsonProperty
    private List<PanelQuery> queries;
    @JsonProperty
    private String stepValue;
    @JsonProperty
    private JsonNode layout;
    @JsonProperty
    private String htmlContent;
    @JsonProperty
    private String markdownContent;

    public Builder setId(final String id) {
      this.id = id;
      return this;
    }

    public Builder setVersion(final Integer version) {
      this.version = version;
      return this;
    }

    public Builder setType(final String type) {
      this.type = type;
      return this;
    }

    public Builder setTitle(final String title) {
      this.title = title;
      return this;
    }

    public Builder setQueryType(final String query_type) {
      queryType = query_type;
      return this;
    }

    public Builder setQueries(final List<PanelQuery> queries) {
      this.queries = queries;
      return this;
    }

    @JsonIgnore
    public Builder addQuery(final PanelQuery query) {
      if (queries == null) {
        queries = Lists.newArrayList();
      } else if (!(queries instanceof ArrayList)) {
        queries = Lists.newArrayList(queries);
      }
      queries.add(query);
      return this;
    }

    public Builder setStepValue(final String step_value) {
      stepValue = step_value;
      return this;
    }

    public Builder setLayout(final JsonNode layout) {
      this.layout = layout;
      return this;
    }

    public Builder setHtmlContent(final String html_content) {
      htmlContent = html_content;
      return this;
    }

    public Builder setMarkdownContent(final String markdown_content) {
      markdownContent = markdown_content;
      return this;
    }

    public PanelSchema build() {
      return new PanelSchema(this);
    }
  }
}
