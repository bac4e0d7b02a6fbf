package arango.mcp;

import arango.mcp.base.McpProtocolHandler;
import arango.mcp.base.ToolDispatcher;
import arango.mcp.base.ToolRegistry;
import arango.mcp.config.ServerConfig;
import arango.mcp.db.ArangoDriverHandle;
import arango.mcp.services.ArangoConnectionManager;
import arango.mcp.services.Logger;
import arango.mcp.tools.ArangoTools;
import arango.mcp.transport.HttpServerTransport;
import arango.mcp.transport.StdioServerTransport;
import io.github.cdimascio.dotenv.Dotenv;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;

import java.util.Collections;
import java.util.LinkedList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public class Driver {
  public static int logLevel = 1; // 0=errors, 1=info, 2=detail, 3=debug, 4=data
  public static Vertx vertx;

  // Emergency log buffer - captures logs before Logger is ready
  private static final int EMERGENCY_BUFFER_SIZE = 500;
  private static final List<String> emergencyLogBuffer = Collections.synchronizedList(new LinkedList<>());
  private static volatile boolean loggerReady = false;

  private final ServerConfig config;
  private ArangoConnectionManager connections;

  private Driver(ServerConfig config) {
    this.config = config;
  }

  /**
   * Captures log messages to the emergency buffer, or publishes directly once the logger is ready.
   * Keeps the last EMERGENCY_BUFFER_SIZE entries.
   */
  public static void captureOrPublishLog(String message) {
    if (loggerReady && vertx != null) {
      vertx.eventBus().publish("log", message);
      return;
    }
    synchronized (emergencyLogBuffer) {
      if (emergencyLogBuffer.size() >= EMERGENCY_BUFFER_SIZE) {
        emergencyLogBuffer.remove(0);
      }
      emergencyLogBuffer.add(message);
    }
  }

  private static void flushEmergencyBuffer() {
    synchronized (emergencyLogBuffer) {
      for (String entry : emergencyLogBuffer) {
        vertx.eventBus().publish("log", entry);
      }
      emergencyLogBuffer.clear();
    }
  }

  public static void main(String[] args) {
    captureOrPublishLog("=== ArangoDB MCP Server Starting ===,1,Driver,System,System");
    captureOrPublishLog("Java version: " + System.getProperty("java.version") + ",2,Driver,System,System");
    captureOrPublishLog("Working directory: " + System.getProperty("user.dir") + ",2,Driver,System,System");

    Dotenv.configure()
        .filename(".env.local")
        .systemProperties()  // readable through System.getProperty()
        .ignoreIfMissing()
        .load();

    ServerConfig config;
    try {
      config = ServerConfig.load();
    } catch (IllegalArgumentException e) {
      System.err.println("FATAL: Invalid configuration: " + e.getMessage());
      System.exit(1);
      return;
    }
    logLevel = config.getLogLevel();
    captureOrPublishLog("Configuration loaded: " + config.getConnection() + ",2,Driver,StartUp,Config");

    vertx = Vertx.vertx(new VertxOptions()
        .setWorkerPoolSize(8)
        .setEventLoopPoolSize(1)
    );

    // Deploy Logger FIRST before anything else
    vertx.deployVerticle(new Logger(config.getLogDirectory()), res -> {
      if (res.succeeded()) {
        loggerReady = true;
        flushEmergencyBuffer();
        captureOrPublishLog("Logger ready - emergency buffer flushed,2,Logger,System,System");
        new Driver(config).doIt();
      } else {
        System.err.println("FATAL: Logger deployment failed: " + res.cause().getMessage());
        System.err.println("Cannot continue without logging capability");
        System.exit(1);
      }
    });
  }

  private void doIt() {
    ToolRegistry registry;
    try {
      registry = ArangoTools.buildRegistry();
    } catch (IllegalStateException e) {
      captureOrPublishLog("Tool registration failed: " + e.getMessage() + ",0,Driver,StartUp,MCP");
      System.err.println("FATAL: Tool registration failed: " + e.getMessage());
      shutdownAndExit(1);
      return;
    }
    if (logLevel >= 1) captureOrPublishLog("Registered " + registry.size() + " tools,1,Driver,StartUp,MCP");

    connections = new ArangoConnectionManager(vertx, config.getConnection(), ArangoDriverHandle::connect);
    Runtime.getRuntime().addShutdownHook(new Thread(this::onTermination, "mcp-shutdown"));

    // A failed startup connection is not fatal; tool calls retry lazily
    connections.connectWithRetry(config.getConnectRetries(), config.getConnectDelayMillis())
        .onComplete(ar -> {
          if (ar.succeeded() && ar.result().isPresent()) {
            if (logLevel >= 1) captureOrPublishLog("Connected to database " + config.getConnection().getDatabase() + ",1,Driver,StartUp,Database");
          } else {
            captureOrPublishLog("Starting without a database connection,0,Driver,StartUp,Database");
          }
          startTransport(registry);
        });
  }

  private void startTransport(ToolRegistry registry) {
    ToolDispatcher dispatcher = new ToolDispatcher(vertx, registry, connections);
    McpProtocolHandler protocol = new McpProtocolHandler(vertx, dispatcher,
        config.getToolListingMode(), config.getBaselineToolCount());

    if (config.getTransport() == ServerConfig.TransportType.HTTP) {
      vertx.deployVerticle(new HttpServerTransport(protocol, connections, config.getHttpPort()), res -> {
        if (res.succeeded()) {
          if (logLevel >= 1) captureOrPublishLog("HTTP transport deployed,1,Driver,StartUp,MCP");
        } else {
          captureOrPublishLog("HTTP transport deployment failed: " + res.cause().getMessage() + ",0,Driver,StartUp,MCP");
          System.err.println("FATAL: HTTP transport deployment failed: " + res.cause().getMessage());
          shutdownAndExit(1);
        }
      });
    } else {
      new StdioServerTransport(vertx, protocol, System.in, System.out)
          .start(() -> shutdownAndExit(0));
      if (logLevel >= 1) captureOrPublishLog("Serving MCP over stdio,1,Driver,StartUp,MCP");
    }
  }

  private static void shutdownAndExit(int status) {
    // System.exit runs the shutdown hook, which closes the connection and flushes logs
    new Thread(() -> System.exit(status), "mcp-exit").start();
  }

  /**
   * Close the database handle and flush buffered logs. Bounded so a hung server cannot
   * block process exit.
   */
  private void onTermination() {
    captureOrPublishLog("=== ArangoDB MCP Server Stopping ===,1,Driver,System,System");
    CountDownLatch done = new CountDownLatch(1);
    connections.shutdown()
        .compose(v -> vertx.eventBus().request(Logger.FLUSH_ADDRESS, "flush"))
        .onComplete(ar -> done.countDown());
    try {
      if (!done.await(5, TimeUnit.SECONDS)) {
        System.err.println("Shutdown did not complete within 5 seconds");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    vertx.close();
  }
}
