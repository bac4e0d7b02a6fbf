package arango.mcp.transport;

import arango.mcp.base.McpProtocolHandler;
import arango.mcp.services.ArangoConnectionManager;
import arango.mcp.services.LogUtil;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;
import io.vertx.ext.web.handler.CorsHandler;

import java.util.HashSet;
import java.util.Set;

/**
 * JSON-RPC over HTTP for local testing: <code>POST /mcp</code> takes one message per request,
 * <code>GET /health</code> reports liveness and the database connection state.
 */
public class HttpServerTransport extends AbstractVerticle {

    public static final String READY_ADDRESS = "mcp.http.ready";
    private static final String COMPONENT = "HttpServerTransport";

    private final McpProtocolHandler protocol;
    private final ArangoConnectionManager connections;
    private final int port;
    private HttpServer httpServer;

    public HttpServerTransport(McpProtocolHandler protocol, ArangoConnectionManager connections, int port) {
        this.protocol = protocol;
        this.connections = connections;
        this.port = port;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        Router router = Router.router(vertx);

        Set<String> allowedHeaders = new HashSet<>();
        allowedHeaders.add("content-type");
        allowedHeaders.add("authorization");
        Set<HttpMethod> allowedMethods = new HashSet<>();
        allowedMethods.add(HttpMethod.GET);
        allowedMethods.add(HttpMethod.POST);
        allowedMethods.add(HttpMethod.OPTIONS);

        router.route().handler(CorsHandler.create()
            .addOrigin("*")
            .allowedHeaders(allowedHeaders)
            .allowedMethods(allowedMethods));
        router.route().handler(BodyHandler.create().setBodyLimit(10 * 1024 * 1024));

        router.get("/health").handler(ctx -> ctx.response()
            .putHeader("content-type", "application/json")
            .end(new JsonObject()
                .put("status", "healthy")
                .put("database", connections.getState().name())
                .put("timestamp", System.currentTimeMillis())
                .encode()));

        router.post("/mcp").handler(this::handleMessage);

        router.route("/mcp").failureHandler(ctx -> {
            Throwable failure = ctx.failure();
            int statusCode = ctx.statusCode() == -1 ? 500 : ctx.statusCode();
            LogUtil.logError(vertx, "HTTP request failed with " + statusCode, COMPONENT, "Request", "HTTP", false);
            ctx.response()
                .setStatusCode(statusCode)
                .putHeader("content-type", "application/json")
                .end(new JsonObject()
                    .put("jsonrpc", "2.0")
                    .putNull("id")
                    .put("error", new JsonObject()
                        .put("code", -32603)
                        .put("message", failure != null ? failure.getMessage() : "Unknown error"))
                    .encode());
        });

        HttpServerOptions options = new HttpServerOptions()
            .setPort(port)
            .setCompressionSupported(true);

        httpServer = vertx.createHttpServer(options);
        httpServer.requestHandler(router).listen(result -> {
            if (result.succeeded()) {
                LogUtil.logInfo(vertx, "HTTP transport listening on port " + result.result().actualPort(),
                    COMPONENT, "Start", "HTTP", true);
                vertx.eventBus().publish(READY_ADDRESS, new JsonObject()
                    .put("port", result.result().actualPort())
                    .put("timestamp", System.currentTimeMillis()));
                startPromise.complete();
            } else {
                LogUtil.logError(vertx, "Failed to start HTTP transport", result.cause(), COMPONENT, "Start", "HTTP", true);
                startPromise.fail(result.cause());
            }
        });
    }

    private void handleMessage(RoutingContext ctx) {
        String body = ctx.body().asString();
        protocol.handleText(body == null ? "" : body).onComplete(ar -> {
            if (ar.failed()) {
                ctx.fail(ar.cause());
                return;
            }
            JsonObject response = ar.result();
            if (response == null) {
                ctx.response().setStatusCode(202).end();
            } else {
                ctx.response()
                    .putHeader("content-type", "application/json")
                    .end(response.encode());
            }
        });
    }

    /** Bound port, useful when started on port 0. */
    public int actualPort() {
        return httpServer == null ? -1 : httpServer.actualPort();
    }

    @Override
    public void stop(Promise<Void> stopPromise) {
        if (httpServer == null) {
            stopPromise.complete();
            return;
        }
        httpServer.close(result -> {
            if (result.succeeded()) {
                LogUtil.logDetail(vertx, "HTTP transport stopped", COMPONENT, "Stop", "HTTP");
                stopPromise.complete();
            } else {
                stopPromise.fail(result.cause());
            }
        });
    }
}
