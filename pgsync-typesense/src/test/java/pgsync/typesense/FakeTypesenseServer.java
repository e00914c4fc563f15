package pgsync.typesense;

import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Local HTTP server answering scripted Typesense responses and recording requests.
 */
class FakeTypesenseServer implements AutoCloseable {
  static final String API_KEY = "test-key";

  record Recorded(String method, String uri, String apiKey, String contentType, String body) {
  }

  record Reply(int status, Function<String, String> body) {
    static Reply json(int status, String body) {
      return new Reply(status, request -> body);
    }
  }

  final List<Recorded> requests = new CopyOnWriteArrayList<>();
  private final Map<String, Reply> replies = new ConcurrentHashMap<>();
  private final DisposableServer server;

  FakeTypesenseServer() {
    server = HttpServer.create()
        .host("localhost")
        .port(0)
        .handle((req, res) -> req.receive().aggregate().asString(StandardCharsets.UTF_8)
            .defaultIfEmpty("")
            .flatMap(body -> {
              String key = req.method().name() + " " + req.uri();
              requests.add(new Recorded(req.method().name(), req.uri(),
                  req.requestHeaders().get(TypesenseIndexClient.API_KEY_HEADER),
                  req.requestHeaders().get("Content-Type"), body));
              Reply reply = replies.getOrDefault(key, Reply.json(404, "{\"message\": \"Not Found\"}"));
              return res.status(reply.status())
                  .header("Content-Type", "application/json")
                  .sendString(Mono.just(reply.body().apply(body)))
                  .then();
            }))
        .bindNow();
  }

  FakeTypesenseServer on(String method, String uri, Reply reply) {
    replies.put(method + " " + uri, reply);
    return this;
  }

  TypesenseConfig config() {
    return new TypesenseConfig("localhost", server.port(), "http", API_KEY, null);
  }

  Recorded last() {
    return requests.get(requests.size() - 1);
  }

  @Override
  public void close() {
    server.disposeNow();
  }
}
