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

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;

import org.apache.http.HttpResponse;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpRequestBase;
import org.apache.http.client.utils.URIBuilder;
import org.apache.http.concurrent.FutureCallback;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.nio.client.CloseableHttpAsyncClient;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Strings;
import com.stumbleupon.async.Callback;
import com.stumbleupon.async.Deferred;

import net.opendash.configuration.Configuration;
import net.opendash.exceptions.QueryExecutionCanceled;
import net.opendash.exceptions.RemoteQueryExecutionException;
import net.opendash.utils.DateTime;
import net.opendash.utils.JSON;

/**
 * A {@link SearchService} over HTTP using the Apache async client. Every
 * request carries a {@code traceparent} header built from its trace id
 * so the back end can cancel it by id. Non 2xx responses resolve to a
 * {@link RemoteQueryExecutionException} with the parsed body.
 *
 * @since 1.0
 */
public class HttpSearchService implements SearchService {
  private static final Logger LOG = LoggerFactory.getLogger(
      HttpSearchService.class);

  public static final String ENDPOINT_KEY = "dashboard.search.endpoint";
  public static final String TIMEOUT_KEY = "dashboard.search.timeout.ms";

  private final Configuration config;
  private final CloseableHttpAsyncClient client;

  /**
   * Default ctor.
   * @param config A non-null config.
   * @param client A non-null, started client. Not closed by this class.
   */
  public HttpSearchService(final Configuration config,
                           final CloseableHttpAsyncClient client) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    if (client == null) {
      throw new IllegalArgumentException("Client cannot be null.");
    }
    this.config = config;
    this.client = client;
    if (!config.hasProperty(ENDPOINT_KEY)) {
      config.register(ENDPOINT_KEY, (String) null, true,
          "The base URL of the search back end, e.g. http://localhost:5080");
    }
    if (!config.hasProperty(TIMEOUT_KEY)) {
      config.register(TIMEOUT_KEY, 300000L, true,
          "How long, in milliseconds, to wait on a search response.");
    }
  }

  @Override
  public Deferred<PartitionResponse> partition(final SearchRequest request) {
    final HttpPost post;
    try {
      post = new HttpPost(uri(request, "_search_partition", false));
      post.setEntity(new StringEntity(JSON.serializeToString(request),
          ContentType.APPLICATION_JSON));
    } catch (RuntimeException e) {
      return Deferred.fromError(e);
    }

    class PartitionCB implements Callback<PartitionResponse, JsonNode> {
      @Override
      public PartitionResponse call(final JsonNode response) throws Exception {
        return JSON.getMapper().treeToValue(response, PartitionResponse.class);
      }
    }

    return execute(post, request.getTraceId()).addCallback(new PartitionCB());
  }

  @Override
  public Deferred<SearchResponse> search(final SearchRequest request) {
    final HttpPost post;
    try {
      post = new HttpPost(uri(request, "_search", true));
      final ObjectNode body = JSON.getMapper().createObjectNode();
      body.set("query", JSON.toNode(request));
      post.setEntity(new StringEntity(body.toString(),
          ContentType.APPLICATION_JSON));
    } catch (RuntimeException e) {
      return Deferred.fromError(e);
    }

    class SearchCB implements Callback<SearchResponse, JsonNode> {
      @Override
      public SearchResponse call(final JsonNode response) throws Exception {
        return SearchResponse.fromNode(response);
      }
    }

    return execute(post, request.getTraceId()).addCallback(new SearchCB());
  }

  @Override
  public Deferred<JsonNode> metricsQueryRange(
      final MetricsQueryRequest request) {
    final HttpGet get;
    try {
      get = new HttpGet(new URIBuilder(endpoint() + "/api/"
          + request.getOrgId() + "/prometheus/api/v1/query_range")
          .addParameter("query", request.getQuery())
          .addParameter("start", Long.toString(request.getStartTime()))
          .addParameter("end", Long.toString(request.getEndTime()))
          .addParameter("step", request.getStep())
          .build());
    } catch (URISyntaxException e) {
      return Deferred.fromError(new IllegalArgumentException(
          "Failed to build the query range URI", e));
    } catch (RuntimeException e) {
      return Deferred.fromError(e);
    }

    class DataCB implements Callback<JsonNode, JsonNode> {
      @Override
      public JsonNode call(final JsonNode response) throws Exception {
        return response.path("data");
      }
    }

    return execute(get, request.getTraceId()).addCallback(new DataCB());
  }

  /**
   * Sends the request and parses the body.
   * @param request The request.
   * @param trace_id The trace id, may be null.
   * @return A deferred resolving to the parsed body or an exception.
   */
  Deferred<JsonNode> execute(final HttpRequestBase request,
                             final String trace_id) {
    final long start = DateTime.nanoTime();
    final int timeout = (int) Math.min(Integer.MAX_VALUE,
        config.getLong(TIMEOUT_KEY));
    request.setConfig(RequestConfig.custom()
        .setSocketTimeout(timeout)
        .setConnectTimeout(timeout)
        .build());
    request.addHeader("Accept", "application/json");
    if (!Strings.isNullOrEmpty(trace_id)) {
      request.addHeader("traceparent", TraceIds.traceparent(trace_id));
    }
    final String endpoint = request.getURI().toString();
    final Deferred<JsonNode> deferred = new Deferred<JsonNode>();

    class ResponseCallback implements FutureCallback<HttpResponse> {

      @Override
      public void completed(final HttpResponse response) {
        final int status = response.getStatusLine().getStatusCode();
        final String text;
        try {
          text = response.getEntity() == null ?
              null : EntityUtils.toString(response.getEntity());
        } catch (IOException e) {
          deferred.callback(new RemoteQueryExecutionException(
              "Failed to read the response", endpoint, status, e));
          return;
        }

        JsonNode body = null;
        if (!Strings.isNullOrEmpty(text)) {
          try {
            body = JSON.parseToNode(text);
          } catch (IllegalArgumentException e) {
            if (status >= 200 && status < 300) {
              deferred.callback(new RemoteQueryExecutionException(
                  "Unparseable response body", endpoint, status, e));
              return;
            }
            LOG.debug("Non JSON error body from " + endpoint, e);
          }
        }

        if (status < 200 || status >= 300) {
          String message = body == null ? null : body.path("message")
              .asText(null);
          if (Strings.isNullOrEmpty(message)) {
            message = body == null ? null : body.path("error").asText(null);
          }
          if (Strings.isNullOrEmpty(message)) {
            message = Strings.isNullOrEmpty(text) ?
                response.getStatusLine().getReasonPhrase() : text;
          }
          deferred.callback(new RemoteQueryExecutionException(message,
              endpoint, status, body));
          return;
        }

        if (LOG.isDebugEnabled()) {
          LOG.debug("Successful response from [" + endpoint + "] after "
              + DateTime.msFromNanoDiff(DateTime.nanoTime(), start) + "ms");
        }
        deferred.callback(body == null ?
            JSON.getMapper().createObjectNode() : body);
      }

      @Override
      public void failed(final Exception ex) {
        deferred.callback(new RemoteQueryExecutionException(
            ex.getMessage() == null ? "Request failed" : ex.getMessage(),
            endpoint, 0, ex));
      }

      @Override
      public void cancelled() {
        if (LOG.isDebugEnabled()) {
          LOG.debug("Http query was canceled: " + endpoint);
        }
        deferred.callback(new QueryExecutionCanceled(
            "Query was canceled: " + endpoint));
      }
    }

    client.execute(request, new ResponseCallback());
    return deferred;
  }

  private URI uri(final SearchRequest request,
                  final String path,
                  final boolean search) {
    try {
      final URIBuilder builder = new URIBuilder(endpoint() + "/api/"
          + request.getOrgId() + "/" + path);
      if (!Strings.isNullOrEmpty(request.getStreamType())) {
        builder.addParameter("type", request.getStreamType());
      }
      if (search) {
        builder.addParameter("search_type", request.getSearchType());
        if (!Strings.isNullOrEmpty(request.getDashboardId())) {
          builder.addParameter("dashboard_id", request.getDashboardId());
        }
        if (!Strings.isNullOrEmpty(request.getFolderId())) {
          builder.addParameter("folder_id", request.getFolderId());
        }
      }
      return builder.build();
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("Failed to build the search URI", e);
    }
  }

  private String endpoint() {
    final String endpoint = config.getString(ENDPOINT_KEY);
    if (Strings.isNullOrEmpty(endpoint)) {
      throw new IllegalStateException("No search endpoint configured under "
          + ENDPOINT_KEY);
    }
    return endpoint.endsWith("/") ?
        endpoint.substring(0, endpoint.length() - 1) : endpoint;
  }
}
