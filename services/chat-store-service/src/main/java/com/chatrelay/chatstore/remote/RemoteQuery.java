package com.chatrelay.chatstore.remote;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.springframework.web.util.UriUtils;

/** Relative endpoint with PostgREST-style equality filters, e.g. {@code conversations?id=eq.42}. */
public final class RemoteQuery {

  private final String resource;
  private final List<String> params = new ArrayList<>();

  private RemoteQuery(String resource) {
    this.resource = resource;
  }

  public static RemoteQuery from(String resource) {
    return new RemoteQuery(resource);
  }

  // Full encoding: the store decodes a bare '+' in the query string as a space.
  public RemoteQuery eq(String column, String value) {
    params.add(column + "=eq." + UriUtils.encode(value, StandardCharsets.UTF_8));
    return this;
  }

  public RemoteQuery select(String columns) {
    params.add("select=" + columns);
    return this;
  }

  public String toEndpoint() {
    return params.isEmpty() ? resource : resource + "?" + String.join("&", params);
  }

  @Override
  public String toString() {
    return toEndpoint();
  }
}
