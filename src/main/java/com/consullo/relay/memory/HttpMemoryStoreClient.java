package com.consullo.relay.memory;

import com.consullo.relay.turn.CaptureRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MemoryStoreClient} speaking the memory worker's REST API.
 *
 * <p>Endpoints:
 * <ul>
 * <li>POST /api/sessions/messages - store one exchange</li>
 * <li>GET /api/context/inject?project=..&amp;query=.. - context for a query, returned as text</li>
 * </ul>
 *
 * <p>Any non-2xx answer or transport failure surfaces as {@link MemoryStoreException}; deciding
 * whether to retry is left to the caller.
 */
public final class HttpMemoryStoreClient implements MemoryStoreClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpMemoryStoreClient.class);

  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final MemoryStoreConfig config;
  private final HttpUrl baseUrl;
  private final OkHttpClient httpClient;
  private final ObjectMapper objectMapper;

  public HttpMemoryStoreClient(MemoryStoreConfig config, OkHttpClient baseHttpClient, ObjectMapper objectMapper) {
    Validate.notNull(config, "config must not be null");
    Validate.notNull(baseHttpClient, "baseHttpClient must not be null");
    Validate.notNull(objectMapper, "objectMapper must not be null");
    this.config = config;
    this.baseUrl = HttpUrl.get(config.baseUrl());
    this.objectMapper = objectMapper;
    this.httpClient = baseHttpClient.newBuilder()
        .callTimeout(config.timeoutMillis(), TimeUnit.MILLISECONDS)
        .readTimeout(config.timeoutMillis(), TimeUnit.MILLISECONDS)
        .build();
  }

  public HttpMemoryStoreClient(MemoryStoreConfig config) {
    this(config, new OkHttpClient(), new ObjectMapper());
  }

  @Override
  public void forward(CaptureRecord record) throws MemoryStoreException {
    final HttpUrl url = baseUrl.newBuilder().addPathSegments("api/sessions/messages").build();
    final String body;
    try {
      body = objectMapper.writeValueAsString(payload(record));
    } catch (JsonProcessingException e) {
      throw new MemoryStoreException("Cannot encode turn " + record.turnId(), e);
    }
    final Request request = new Request.Builder().url(url).post(RequestBody.create(body, JSON)).build();
    try (Response response = httpClient.newCall(request).execute()) {
      if (!response.isSuccessful()) {
        throw new MemoryStoreException("Memory store rejected turn " + record.turnId() + ": HTTP " + response.code());
      }
      LOGGER.debug("Forwarded turn {} to memory store", record.turnId());
    } catch (IOException e) {
      throw new MemoryStoreException("Cannot reach memory store: " + e.getMessage(), e);
    }
  }

  @Override
  public String fetchContext(String query) throws MemoryStoreException {
    final HttpUrl url = baseUrl.newBuilder()
        .addPathSegments("api/context/inject")
        .addQueryParameter("project", config.project())
        .addQueryParameter("query", query == null ? "" : query)
        .build();
    final Request request = new Request.Builder().url(url).get().build();
    try (Response response = httpClient.newCall(request).execute()) {
      final ResponseBody responseBody = response.body();
      if (!response.isSuccessful() || responseBody == null) {
        throw new MemoryStoreException("Context query failed: HTTP " + response.code());
      }
      return parseContext(responseBody.string());
    } catch (IOException e) {
      throw new MemoryStoreException("Cannot reach memory store: " + e.getMessage(), e);
    }
  }

  @Override
  public boolean isEnabled() {
    return config.enabled();
  }

  Map<String, Object> payload(CaptureRecord record) {
    final Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("turnId", record.turnId());
    metadata.put("kind", record.kind().name());
    metadata.put("destination", record.destination());
    metadata.put("leakDetected", record.leakDetected());
    metadata.put("startedAt", record.startedAt().toString());
    metadata.put("endedAt", record.endedAt().toString());

    final Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("contentSessionId", record.contextId());
    payload.put("source", config.source());
    payload.put("channel", record.destination());
    payload.put("userMessage", record.requestText());
    payload.put("assistantResponse", record.sanitizedText() == null ? "" : record.sanitizedText());
    payload.put("metadata", metadata);
    return payload;
  }

  private String parseContext(String body) {
    final String trimmed = body.trim();
    if (!trimmed.startsWith("{")) {
      return trimmed;
    }
    try {
      final JsonNode node = objectMapper.readTree(trimmed);
      if (node.has("context")) {
        return node.get("context").asText("").trim();
      }
      return trimmed;
    } catch (JsonProcessingException e) {
      LOGGER.debug("Context response is not JSON, using raw text");
      return trimmed;
    }
  }
}
