package com.chatrelay.chatstore.remote;

import com.chatrelay.chatstore.config.ChatStoreProperties;
import com.chatrelay.chatstore.store.StoreConfigurationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Authenticated request executor for the remote relational REST API.
 *
 * <p>Every request carries the access key twice (api key and bearer token) and asks for the
 * created or updated rows back, so generated ids are available without a follow-up read. No retry:
 * a failed call surfaces immediately.
 */
@Slf4j
public class RemoteStoreClient {

  static final String PREFER_REPRESENTATION = "return=representation";

  private final RestClient rest;
  private final ObjectMapper mapper;
  private final String restBase;

  public RemoteStoreClient(
      RestClient.Builder builder, ChatStoreProperties.Remote properties, ObjectMapper mapper) {
    if (properties == null || isBlank(properties.baseUrl()) || isBlank(properties.accessKey())) {
      throw new StoreConfigurationException(
          "chat-store.remote.base-url and chat-store.remote.access-key are required"
              + " (SUPABASE_URL / SUPABASE_KEY)");
    }
    String key = properties.accessKey().trim();
    this.restBase =
        trimTrailingSlash(properties.baseUrl().trim()) + normalizePath(properties.restPath());
    this.mapper = mapper;
    this.rest =
        builder
            .defaultHeader("apikey", key)
            .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + key)
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .defaultHeader("Prefer", PREFER_REPRESENTATION)
            .build();
  }

  /**
   * Executes one request.
   *
   * @param endpoint resource path relative to the REST base, optionally with a query string
   * @param body JSON-serializable body, {@code null} for none
   * @return raw response bytes, empty when the store sent no body
   */
  public byte[] execute(HttpMethod method, String endpoint, Object body) {
    byte[] payload = body == null ? null : serialize(body);

    URI uri;
    try {
      uri = URI.create(restBase + "/" + endpoint);
    } catch (IllegalArgumentException e) {
      throw new RemoteTransportException("failed to create request: " + method + " " + endpoint, e);
    }

    log.debug("Remote store request {} {}", method, endpoint);
    try {
      RestClient.RequestBodySpec request = rest.method(method).uri(uri);
      if (payload != null) {
        request.body(payload);
      }
      return request.exchange(
          (req, response) -> {
            byte[] bytes = StreamUtils.copyToByteArray(response.getBody());
            int status = response.getStatusCode().value();
            if (status >= 400) {
              throw new RemoteApiException(status, new String(bytes, StandardCharsets.UTF_8));
            }
            return bytes;
          });
    } catch (RestClientException e) {
      throw new RemoteTransportException(
          "request failed: " + method + " " + endpoint + ": " + e.getMessage(), e);
    }
  }

  /** Decodes a JSON array response into rows. */
  public <T> List<T> readRows(byte[] response, Class<T> rowType, String what) {
    JavaType type = mapper.getTypeFactory().constructCollectionType(List.class, rowType);
    try {
      List<T> rows = mapper.readValue(response, type);
      return rows == null ? List.of() : rows;
    } catch (IOException e) {
      throw new RemoteParseException("failed to parse " + what + " response", e);
    }
  }

  private byte[] serialize(Object body) {
    try {
      return mapper.writeValueAsBytes(body);
    } catch (JsonProcessingException e) {
      throw new RemoteSerializationException("failed to marshal body: " + e.getMessage(), e);
    }
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }

  private static String trimTrailingSlash(String s) {
    return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
  }

  private static String normalizePath(String path) {
    if (path == null || path.isBlank()) return "";
    String p = path.startsWith("/") ? path : "/" + path;
    return trimTrailingSlash(p);
  }
}
