package com.chatrelay.chatstore.remote;

import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;

import com.chatrelay.chatstore.config.ChatStoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpRequest;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.mock.http.client.MockClientHttpRequest;
import org.springframework.mock.http.client.MockClientHttpResponse;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.test.web.client.ResponseCreator;
import org.springframework.web.client.RestClient;

/**
 * In-memory stand-in for the remote REST store: equality-filtered GET, POST returning the created
 * row, PATCH returning the updated rows. Every request is recorded.
 */
class FakeRemoteStore implements ResponseCreator {

  static final String BASE_URL = "https://store.example.test";

  private final ObjectMapper mapper = new ObjectMapper();
  private final Map<String, List<ObjectNode>> tables = new LinkedHashMap<>();
  private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();
  private final List<FailureRule> failures = new CopyOnWriteArrayList<>();
  private int nextId = 1;

  private volatile long lookupDelayMs;
  private volatile boolean emptyCreateResponse;
  private volatile boolean conflictOnNextConversationCreate;

  record RecordedRequest(HttpMethod method, String resource, String query, String body) {}

  private record FailureRule(Predicate<RecordedRequest> when, HttpStatus status) {}

  /** Client wired to this fake through a mock request factory. */
  RemoteStoreClient client() {
    RestClient.Builder builder = RestClient.builder();
    MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    server.expect(ExpectedCount.manyTimes(), requestTo(startsWith(BASE_URL))).andRespond(this);
    return new RemoteStoreClient(
        builder, new ChatStoreProperties.Remote(BASE_URL, "test-key", null, null, null, 0), mapper);
  }

  void failWhen(Predicate<RecordedRequest> when, HttpStatus status) {
    failures.add(new FailureRule(when, status));
  }

  void failWhen(HttpMethod method, String resource, HttpStatus status) {
    failWhen(r -> r.method().equals(method) && r.resource().equals(resource), status);
  }

  void setLookupDelayMs(long lookupDelayMs) {
    this.lookupDelayMs = lookupDelayMs;
  }

  void returnNoRowOnCreate() {
    this.emptyCreateResponse = true;
  }

  /** The next conversation create behaves as if another process inserted the row first. */
  void conflictOnNextConversationCreate() {
    this.conflictOnNextConversationCreate = true;
  }

  synchronized void seedConversationWithoutId(String contactIdentifier) {
    ObjectNode row = mapper.createObjectNode();
    row.put("channel", "whatsapp");
    row.put("contact_identifier", contactIdentifier);
    tables.computeIfAbsent("conversations", k -> new ArrayList<>()).add(row);
  }

  synchronized String seedConversation(String contactIdentifier, String contactName) {
    ObjectNode row = mapper.createObjectNode();
    row.put("channel", "whatsapp");
    row.put("contact_identifier", contactIdentifier);
    if (contactName != null) {
      row.put("contact_name", contactName);
    }
    row.put("status", "active");
    return insert("conversations", row).get("id").asText();
  }

  synchronized List<ObjectNode> rows(String resource) {
    return new ArrayList<>(tables.getOrDefault(resource, List.of()));
  }

  List<RecordedRequest> requests() {
    return List.copyOf(requests);
  }

  long count(HttpMethod method, String resource) {
    return requests.stream()
        .filter(r -> r.method().equals(method) && r.resource().equals(resource))
        .count();
  }

  @Override
  public ClientHttpResponse createResponse(ClientHttpRequest request) throws IOException {
    URI uri = request.getURI();
    String path = uri.getPath();
    String resource = path.substring(path.lastIndexOf('/') + 1);
    String query = uri.getRawQuery() == null ? "" : uri.getRawQuery();
    String body = ((MockClientHttpRequest) request).getBodyAsString();
    RecordedRequest recorded = new RecordedRequest(request.getMethod(), resource, query, body);
    requests.add(recorded);

    for (FailureRule rule : failures) {
      if (rule.when().test(recorded)) {
        return json("{\"message\":\"injected failure\"}", rule.status());
      }
    }

    HttpMethod method = request.getMethod();
    if (HttpMethod.GET.equals(method)) {
      sleep(lookupDelayMs);
      return json(select(resource, query), HttpStatus.OK);
    }
    if (HttpMethod.POST.equals(method)) {
      return create(resource, body);
    }
    if (HttpMethod.PATCH.equals(method)) {
      return json(update(resource, query, body), HttpStatus.OK);
    }
    return json("{\"message\":\"unsupported\"}", HttpStatus.METHOD_NOT_ALLOWED);
  }

  private synchronized String select(String resource, String query) throws IOException {
    Map<String, String> filters = filters(query);
    String select = decode(param(query, "select"));
    ArrayNode out = mapper.createArrayNode();
    for (ObjectNode row : tables.getOrDefault(resource, List.of())) {
      if (!matches(row, filters)) continue;
      if (select == null || select.equals("*")) {
        out.add(row.deepCopy());
      } else {
        ObjectNode projected = mapper.createObjectNode();
        for (String col : select.split(",")) {
          if (row.has(col)) projected.set(col, row.get(col));
        }
        out.add(projected);
      }
    }
    return mapper.writeValueAsString(out);
  }

  private synchronized ClientHttpResponse create(String resource, String body) throws IOException {
    ObjectNode row = (ObjectNode) mapper.readTree(body);
    if ("conversations".equals(resource) && conflictOnNextConversationCreate) {
      conflictOnNextConversationCreate = false;
      insert(resource, row.deepCopy());
      return json(
          "{\"code\":\"23505\",\"message\":\"duplicate key value violates unique constraint\"}",
          HttpStatus.CONFLICT);
    }
    ObjectNode created = insert(resource, row);
    if (emptyCreateResponse) {
      return json("[]", HttpStatus.CREATED);
    }
    return json(
        mapper.writeValueAsString(mapper.createArrayNode().add(created)), HttpStatus.CREATED);
  }

  private synchronized String update(String resource, String query, String body)
      throws IOException {
    JsonNode patch = mapper.readTree(body);
    Map<String, String> filters = filters(query);
    ArrayNode out = mapper.createArrayNode();
    for (ObjectNode row : tables.getOrDefault(resource, List.of())) {
      if (!matches(row, filters)) continue;
      patch.fields().forEachRemaining(e -> row.set(e.getKey(), e.getValue()));
      out.add(row.deepCopy());
    }
    return mapper.writeValueAsString(out);
  }

  private ObjectNode insert(String resource, ObjectNode row) {
    String prefix = "conversations".equals(resource) ? "conv-" : "msg-";
    row.put("id", prefix + nextId++);
    tables.computeIfAbsent(resource, k -> new ArrayList<>()).add(row);
    return row;
  }

  private static boolean matches(ObjectNode row, Map<String, String> filters) {
    for (Map.Entry<String, String> f : filters.entrySet()) {
      JsonNode value = row.get(f.getKey());
      if (value == null || value.isNull() || !value.asText().equals(f.getValue())) {
        return false;
      }
    }
    return true;
  }

  private static Map<String, String> filters(String query) {
    Map<String, String> filters = new LinkedHashMap<>();
    if (query.isEmpty()) return filters;
    for (String part : query.split("&")) {
      int eq = part.indexOf('=');
      if (eq < 0) continue;
      String key = part.substring(0, eq);
      String value = part.substring(eq + 1);
      if (value.startsWith("eq.")) {
        filters.put(key, decode(value.substring(3)));
      }
    }
    return filters;
  }

  private static String param(String query, String name) {
    for (String part : query.split("&")) {
      if (part.startsWith(name + "=")) {
        return part.substring(name.length() + 1);
      }
    }
    return null;
  }

  private static String decode(String s) {
    return s == null ? null : URLDecoder.decode(s, StandardCharsets.UTF_8);
  }

  private static void sleep(long ms) {
    if (ms <= 0) return;
    try {
      Thread.sleep(ms);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private static ClientHttpResponse json(String body, HttpStatus status) {
    MockClientHttpResponse response =
        new MockClientHttpResponse(body.getBytes(StandardCharsets.UTF_8), status);
    response.getHeaders().set(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
    return response;
  }
}
