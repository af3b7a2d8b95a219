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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import com.google.common.base.Strings;

import net.opendash.exceptions.QueryExecutionException;
import net.opendash.exceptions.RemoteQueryExecutionException;
import net.opendash.utils.JSON;

public class TestErrorDetail {

  @Test
  public void of() throws Exception {
    ErrorDetail error = ErrorDetail.of("Boo!", "500");
    assertEquals("Boo!", error.getMessage());
    assertEquals("500", error.getCode());
    assertFalse(error.isEmpty());

    error = ErrorDetail.of(null, null);
    assertEquals("", error.getMessage());
    assertEquals("", error.getCode());
    assertTrue(error.isEmpty());
    assertEquals(ErrorDetail.EMPTY, error);
  }

  @Test
  public void truncate() throws Exception {
    final String exact = Strings.repeat("x", ErrorDetail.MAX_MESSAGE_LENGTH);
    assertEquals(exact, ErrorDetail.of(exact, "").getMessage());

    final String message = ErrorDetail.of(exact + "yz", "").getMessage();
    assertEquals(exact + " ...", message);
    assertEquals(ErrorDetail.MAX_MESSAGE_LENGTH + 4, message.length());
  }

  @Test
  public void fromSqlBodyPrecedence() throws Exception {
    RemoteQueryExecutionException e = new RemoteQueryExecutionException(
        "Bad Request", "http://localhost/_search", 400,
        JSON.parseToNode("{\"error_detail\":\"detail\",\"message\":\"msg\","
            + "\"code\":20001}"));
    ErrorDetail error = ErrorDetail.fromSql(e, false);
    assertEquals("detail", error.getMessage());
    assertEquals("400", error.getCode());

    e = new RemoteQueryExecutionException("Bad Request",
        "http://localhost/_search", 400,
        JSON.parseToNode("{\"message\":\"msg\",\"code\":20001}"));
    error = ErrorDetail.fromSql(e, false);
    assertEquals("msg", error.getMessage());

    e = new RemoteQueryExecutionException("Bad Request",
        "http://localhost/_search", 400,
        JSON.parseToNode("{\"code\":20001}"));
    error = ErrorDetail.fromSql(e, false);
    assertEquals("Bad Request", error.getMessage());
  }

  @Test
  public void fromSqlStreamingCode() throws Exception {
    final RemoteQueryExecutionException e = new RemoteQueryExecutionException(
        "Bad Request", "ws", 400,
        JSON.parseToNode("{\"message\":\"msg\",\"code\":20001}"));
    assertEquals("20001", ErrorDetail.fromSql(e, true).getCode());
    assertEquals("400", ErrorDetail.fromSql(e, false).getCode());
  }

  @Test
  public void fromSqlNoStatus() throws Exception {
    final ErrorDetail error = ErrorDetail.fromSql(
        new IllegalStateException("Boo!"), false);
    assertEquals("Boo!", error.getMessage());
    assertEquals("", error.getCode());
  }

  @Test
  public void fromPromql() throws Exception {
    RemoteQueryExecutionException e = new RemoteQueryExecutionException(
        "Unprocessable", "http://localhost/query_range", 422,
        JSON.parseToNode("{\"status\":\"error\",\"error\":\"parse error\"}"));
    ErrorDetail error = ErrorDetail.fromPromql(e);
    assertEquals("parse error", error.getMessage());
    assertEquals("422", error.getCode());

    error = ErrorDetail.fromPromql(new QueryExecutionException("Boo!", 0));
    assertEquals("Boo!", error.getMessage());
    assertEquals("", error.getCode());
  }

  @Test
  public void fromStreamError() throws Exception {
    ErrorDetail error = ErrorDetail.fromStreamError(JSON.parseToNode(
        "{\"message\":\"msg\",\"error\":\"err\",\"code\":500}"));
    assertEquals("msg", error.getMessage());
    assertEquals("500", error.getCode());

    error = ErrorDetail.fromStreamError(JSON.parseToNode(
        "{\"error_detail\":\"detail\",\"status\":503}"));
    assertEquals("detail", error.getMessage());
    assertEquals("503", error.getCode());

    error = ErrorDetail.fromStreamError(null);
    assertTrue(error.isEmpty());
  }

  @Test
  public void serdes() throws Exception {
    final ErrorDetail error = ErrorDetail.of("Boo!", "500");
    final String json = JSON.serializeToString(error);
    assertTrue(json.contains("\"message\":\"Boo!\""));
    assertFalse(json.contains("empty"));
    assertEquals(error, JSON.parseToObject(json, ErrorDetail.class));
  }
}
