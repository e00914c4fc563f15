package pgsync.typesense;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.buffer.ByteBufAllocator;
import io.netty.channel.ChannelOption;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import pgsync.document.Document;
import pgsync.mapping.TableMapping;
import pgsync.spi.CollectionInfo;
import pgsync.spi.DeleteOutcome;
import pgsync.spi.ImportResult;
import pgsync.spi.IndexClient;
import pgsync.spi.IndexClientException;
import reactor.core.publisher.Mono;
import reactor.netty.ByteBufFlux;
import reactor.netty.http.client.HttpClient;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link IndexClient} speaking the Typesense REST API over a blocking reactor-netty client.
 *
 * <p>Bulk upserts use the JSONL import endpoint with {@code action=upsert}. Document ids
 * are always sent as strings. A 404 on document delete is reported as
 * {@link DeleteOutcome#NOT_FOUND}; every other non-2xx response becomes an
 * {@link IndexClientException} carrying the status code.
 */
public final class TypesenseIndexClient implements IndexClient {
  private static final Logger logger = Logger.getLogger(TypesenseIndexClient.class.getName());

  static final String API_KEY_HEADER = "X-TYPESENSE-API-KEY";
  private static final String JSON_CONTENT_TYPE = "application/json";
  private static final String JSONL_CONTENT_TYPE = "text/plain";

  private final HttpClient client;
  private final ObjectMapper mapper;
  private final Duration timeout;

  public TypesenseIndexClient(TypesenseConfig config) {
    this(config, HttpClient.create(), new ObjectMapper());
  }

  TypesenseIndexClient(TypesenseConfig config, HttpClient httpClient, ObjectMapper mapper) {
    Objects.requireNonNull(config, "config");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.timeout = config.connectionTimeout();
    this.client = httpClient
        .baseUrl(config.baseUrl())
        .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeout.toMillis())
        .responseTimeout(timeout)
        .headers(h -> h.set(API_KEY_HEADER, config.apiKey()))
        .keepAlive(true);
  }

  @Override
  public List<ImportResult> upsert(String collection, List<Document> documents) {
    if (documents.isEmpty()) {
      return List.of();
    }
    StringBuilder body = new StringBuilder();
    for (Document document : documents) {
      body.append(toJson(wireDocument(document))).append('\n');
    }
    Response response = request(HttpMethod.POST,
        "/collections/" + encode(collection) + "/documents/import?action=upsert", body.toString(), JSONL_CONTENT_TYPE);
    response.requireSuccess("import into '" + collection + "'");

    List<ImportResult> results = new ArrayList<>(documents.size());
    int index = 0;
    for (String line : response.body().split("\n")) {
      if (line.isBlank()) {
        continue;
      }
      String documentId = index < documents.size() ? documents.get(index).id() : null;
      JsonNode node = readTree(line);
      if (node.path("success").asBoolean(false)) {
        results.add(ImportResult.ok(documentId));
      } else {
        results.add(ImportResult.failed(documentId, node.path("error").asText("unknown error")));
      }
      index++;
    }
    return results;
  }

  @Override
  public DeleteOutcome delete(String collection, String documentId) {
    Response response = request(HttpMethod.DELETE,
        "/collections/" + encode(collection) + "/documents/" + encode(documentId), null, null);
    if (response.status() == 404) {
      return DeleteOutcome.NOT_FOUND;
    }
    response.requireSuccess("delete document " + documentId + " from '" + collection + "'");
    return DeleteOutcome.DELETED;
  }

  @Override
  public Map<String, CollectionInfo> collections() {
    Response response = request(HttpMethod.GET, "/collections", null, null);
    response.requireSuccess("list collections");
    Map<String, CollectionInfo> out = new LinkedHashMap<>();
    for (JsonNode node : readTree(response.body())) {
      Map<String, String> fieldTypes = new LinkedHashMap<>();
      for (JsonNode field : node.path("fields")) {
        fieldTypes.put(field.path("name").asText(), field.path("type").asText());
      }
      String name = node.path("name").asText();
      out.put(name, new CollectionInfo(name, node.path("num_documents").asLong(0), fieldTypes));
    }
    return out;
  }

  @Override
  public void createCollection(TableMapping table) {
    Map<String, Object> schema = CollectionSchemas.schemaOf(table);
    logger.log(Level.FINE, "Creating collection with schema {0}", schema);
    Response response = request(HttpMethod.POST, "/collections", toJson(schema), JSON_CONTENT_TYPE);
    response.requireSuccess("create collection '" + table.collection() + "'");
  }

  @Override
  public void deleteCollection(String collection) {
    Response response = request(HttpMethod.DELETE, "/collections/" + encode(collection), null, null);
    response.requireSuccess("delete collection '" + collection + "'");
  }

  static Map<String, Object> wireDocument(Document document) {
    Map<String, Object> json = new LinkedHashMap<>(document.toJava());
    Object id = json.get("id");
    if (id != null && !(id instanceof String)) {
      json.put("id", String.valueOf(id));
    }
    return json;
  }

  private Response request(HttpMethod method, String path, String body, String contentType) {
    try {
      HttpClient.RequestSender sender = client
          .headers(h -> {
            if (contentType != null) {
              h.set(HttpHeaderNames.CONTENT_TYPE, contentType);
            }
          })
          .request(method)
          .uri(path);
      HttpClient.ResponseReceiver<?> receiver = body == null
          ? sender
          : sender.send(ByteBufFlux.fromString(Mono.just(body), StandardCharsets.UTF_8, ByteBufAllocator.DEFAULT));
      Response response = receiver
          .responseSingle((res, bytes) -> bytes.asString(StandardCharsets.UTF_8)
              .defaultIfEmpty("")
              .map(text -> new Response(res.status().code(), text)))
          .block(timeout.multipliedBy(2));
      if (response == null) {
        throw new IndexClientException(method + " " + path + " returned no response", -1);
      }
      return response;
    } catch (IndexClientException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new IndexClientException(method + " " + path + " failed: " + e.getMessage(), e);
    }
  }

  private String toJson(Object value) {
    try {
      return mapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IndexClientException("Failed to serialize request body", e);
    }
  }

  private JsonNode readTree(String json) {
    try {
      return mapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new IndexClientException("Unexpected response from Typesense: " + json, e);
    }
  }

  private static String encode(String segment) {
    return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
  }

  private final class Response {
    private final int status;
    private final String body;

    Response(int status, String body) {
      this.status = status;
      this.body = body;
    }

    int status() {
      return status;
    }

    String body() {
      return body;
    }

    void requireSuccess(String action) {
      if (status >= 200 && status < 300) {
        return;
      }
      String message = body;
      try {
        JsonNode node = mapper.readTree(body);
        if (node.hasNonNull("message")) {
          message = node.get("message").asText();
        }
      } catch (JsonProcessingException e) {
        logger.log(Level.FINE, "Error response is not JSON", e);
      }
      throw new IndexClientException("Failed to " + action + ": HTTP " + status + " " + message, status);
    }
  }
}
