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
package net.opendash.cache;

import java.util.Iterator;
import java.util.Map;
import java.util.Map.Entry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.common.collect.Maps;
import com.google.common.hash.HashCode;

import net.opendash.core.Const;
import net.opendash.panel.PanelIdentity;
import net.opendash.panel.PanelSchema;
import net.opendash.utils.JSON;
import net.opendash.variables.DynamicFilter;
import net.opendash.variables.Variable;
import net.opendash.variables.VariableSnapshot;

/**
 * The identity a cached panel state is valid for: the panel definition
 * without its cosmetic fields, the resolved dependent and dynamic
 * variables, the force reload flag and the dashboard and folder ids. Two
 * fingerprints are equal when their canonical JSON trees are equal, the
 * hash is only a short form for logging and keys.
 *
 * @since 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = CacheFingerprint.Builder.class)
public class CacheFingerprint {
  private final JsonNode canonical;
  private final String hash;

  protected CacheFingerprint(final Builder builder) {
    if (builder.canonical == null) {
      throw new IllegalArgumentException("Canonical key cannot be null.");
    }
    canonical = canonicalize(builder.canonical);
    hash = Strings.isNullOrEmpty(builder.hash) ?
        buildHashCode(canonical).toString() : builder.hash;
  }

  /**
   * Computes the fingerprint of a load request.
   * @param panel The non-null panel.
   * @param variables The resolved variables.
   * @param force_reload Whether the load was forced.
   * @param identity The panel's identity.
   * @return A non-null fingerprint.
   */
  public static CacheFingerprint of(final PanelSchema panel,
                                    final VariableSnapshot variables,
                                    final boolean force_reload,
                                    final PanelIdentity identity) {
    final ObjectNode key = JsonNodeFactory.instance.objectNode();
    final JsonNode panel_node = JSON.toNode(panel);
    if (panel_node.isObject()) {
      ((ObjectNode) panel_node).remove(PanelSchema.COSMETIC_FIELDS);
    }
    key.set("panelSchema", panel_node);

    final ArrayNode vars = key.putArray("variablesData");
    if (variables != null) {
      for (final Variable variable : variables.getDependent()) {
        vars.add(JSON.toNode(variable));
      }
      for (final DynamicFilter filter : variables.getDynamic()) {
        vars.add(JSON.toNode(filter));
      }
    }
    key.put("forceLoad", force_reload);
    key.put("dashboardId", identity == null ? null : identity.getDashboardId());
    key.put("folderId", identity == null ? null : identity.getFolderId());
    return newBuilder().setCanonical(key).build();
  }

  /** @return The canonical tree, fields sorted. */
  public JsonNode getCanonical() {
    return canonical;
  }

  /** @return A hex murmur3 hash of the canonical tree. */
  public String getHash() {
    return hash;
  }

  /**
   * Hashes the canonical JSON text.
   * @param canonical The sorted tree.
   * @return The hash code.
   */
  static HashCode buildHashCode(final JsonNode canonical) {
    return Const.HASH_FUNCTION().newHasher()
        .putString(canonical.toString(), Const.UTF8_CHARSET)
        .hash();
  }

  /**
   * Rebuilds objects with their fields in key order so equal trees print
   * and hash the same.
   * @param node The node to sort.
   * @return A sorted deep copy.
   */
  static JsonNode canonicalize(final JsonNode node) {
    if (node.isObject()) {
      final Map<String, JsonNode> sorted = Maps.newTreeMap();
      final Iterator<Entry<String, JsonNode>> it = node.fields();
      while (it.hasNext()) {
        final Entry<String, JsonNode> field = it.next();
        sorted.put(field.getKey(), canonicalize(field.getValue()));
      }
      final ObjectNode copy = JsonNodeFactory.instance.objectNode();
      copy.setAll(sorted);
      return copy;
    }
    if (node.isArray()) {
      final ArrayNode copy = JsonNodeFactory.instance.arrayNode();
      for (final JsonNode child : node) {
        copy.add(canonicalize(child));
      }
      return copy;
    }
    return node.deepCopy();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return Objects.equal(canonical, ((CacheFingerprint) o).canonical);
  }

  @Override
  public int hashCode() {
    return canonical.hashCode();
  }

  @Override
  public String toString() {
    return hash;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static final class Builder {
    @JsonProperty
    private JsonNode canonical;
    @JsonProperty
    private String hash;

    public Builder setCanonical(final JsonNode canonical) {
      this.canonical = canonical;
      return this;
    }

    public Builder setHash(final String hash) {
      this.hash = hash;
      return this;
    }

    public CacheFingerprint build() {
      return new CacheFingerprint(this);
    }
  }
}
