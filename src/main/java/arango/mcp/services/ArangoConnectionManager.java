package arango.mcp.services;

import arango.mcp.config.ConnectionConfig;
import arango.mcp.db.ArangoHandle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the single process-wide ArangoDB handle.
 *
 * <ul>
 *   <li>Startup: {@link #connectWithRetry(int, long)} tries a bounded number of times, waiting on
 *       a Vert.x timer between attempts. Exhaustion leaves the manager disconnected but usable.</li>
 *   <li>Dispatch: {@link #lazyReconnect()} makes one attempt when no handle is cached.</li>
 *   <li>Shutdown: {@link #shutdown()} closes the handle; close errors are only logged.</li>
 * </ul>
 *
 * <p>The handle is swapped with compare-and-set and no lock is held while a connect is in
 * flight. When two reconnects race, the handle that loses is closed.</p>
 */
public class ArangoConnectionManager {

    public enum State {
        UNINITIALIZED,
        CONNECTING,
        CONNECTED,
        DISCONNECTED,
        CLOSED
    }

    private static final String COMPONENT = "ArangoConnectionManager";

    private final Vertx vertx;
    private final ConnectionConfig config;
    private final ArangoConnector connector;

    private final AtomicReference<ArangoHandle> handle = new AtomicReference<>();
    private final AtomicReference<State> state = new AtomicReference<>(State.UNINITIALIZED);
    private final AtomicInteger connectCalls = new AtomicInteger();
    private volatile String lastConnectionError;

    public ArangoConnectionManager(Vertx vertx, ConnectionConfig config, ArangoConnector connector) {
        this.vertx = vertx;
        this.config = config;
        this.connector = connector;
    }

    /**
     * Try to connect up to <code>maxAttempts</code> times (at least once).
     *
     * @return a future that always succeeds, with the handle or empty when every attempt failed
     */
    public Future<Optional<ArangoHandle>> connectWithRetry(int maxAttempts, long delayMillis) {
        int attempts = Math.max(1, maxAttempts);
        Promise<Optional<ArangoHandle>> promise = Promise.promise();
        LogUtil.logInfo(vertx, "Connecting to " + config.getUrl() + " db=" + config.getDatabase()
            + " (max " + attempts + " attempts)", COMPONENT, "Connect", "Database", false);
        attempt(1, attempts, delayMillis, promise);
        return promise.future();
    }

    private void attempt(int attempt, int maxAttempts, long delayMillis, Promise<Optional<ArangoHandle>> promise) {
        if (state.get() == State.CLOSED) {
            promise.complete(Optional.empty());
            return;
        }
        state.set(State.CONNECTING);
        openHandle().onComplete(ar -> {
            if (ar.succeeded()) {
                Optional<ArangoHandle> installed = install(ar.result());
                LogUtil.logInfo(vertx, "Connected to ArangoDB at " + config.getUrl() + " db=" + config.getDatabase()
                    + " (attempt " + attempt + ")", COMPONENT, "Connect", "Database", true);
                promise.complete(installed);
                return;
            }

            LogUtil.logError(vertx, "ArangoDB connection attempt " + attempt + " failed", ar.cause(),
                COMPONENT, "Connect", "Database", false);
            if (attempt < maxAttempts) {
                if (delayMillis > 0) {
                    vertx.setTimer(delayMillis, id -> attempt(attempt + 1, maxAttempts, delayMillis, promise));
                } else {
                    attempt(attempt + 1, maxAttempts, delayMillis, promise);
                }
            } else {
                state.compareAndSet(State.CONNECTING, State.DISCONNECTED);
                LogUtil.logError(vertx, "Failed to connect to ArangoDB after " + maxAttempts
                    + " attempts; starting server without DB", COMPONENT, "Connect", "Database", true);
                promise.complete(Optional.empty());
            }
        });
    }

    /**
     * The cached handle, if any. Never connects.
     */
    public Optional<ArangoHandle> current() {
        return Optional.ofNullable(handle.get());
    }

    /**
     * One connection attempt, used when a dispatch finds no cached handle.
     *
     * @return a future that always succeeds, with the handle or empty
     */
    public Future<Optional<ArangoHandle>> lazyReconnect() {
        ArangoHandle existing = handle.get();
        if (existing != null) {
            return Future.succeededFuture(Optional.of(existing));
        }
        if (state.get() == State.CLOSED) {
            return Future.succeededFuture(Optional.empty());
        }
        state.set(State.CONNECTING);
        return openHandle()
            .map(opened -> {
                Optional<ArangoHandle> installed = install(opened);
                LogUtil.logInfo(vertx, "Lazy DB connect succeeded during tool call: db=" + config.getDatabase(),
                    COMPONENT, "LazyConnect", "Database", false);
                return installed;
            })
            .otherwise(err -> {
                state.compareAndSet(State.CONNECTING, State.DISCONNECTED);
                LogUtil.logError(vertx, "Lazy DB connect failed", err, COMPONENT, "LazyConnect", "Database", false);
                return Optional.empty();
            });
    }

    /**
     * Close the cached handle. The returned future always succeeds.
     */
    public Future<Void> shutdown() {
        state.set(State.CLOSED);
        ArangoHandle closing = handle.getAndSet(null);
        if (closing == null) {
            return Future.succeededFuture();
        }
        return vertx.<Void>executeBlocking(() -> {
                closing.close();
                return null;
            }, false)
            .onSuccess(v -> LogUtil.logInfo(vertx, "ArangoDB connection closed", COMPONENT, "Shutdown", "Database", false))
            .otherwise(err -> {
                LogUtil.logError(vertx, "Error closing ArangoDB connection", err, COMPONENT, "Shutdown", "Database", false);
                return null;
            });
    }

    public State getState() {
        return state.get();
    }

    /** Number of times the connector has been invoked. */
    public int getConnectCalls() {
        return connectCalls.get();
    }

    public String getLastConnectionError() {
        return lastConnectionError;
    }

    public ConnectionConfig getConfig() {
        return config;
    }

    private Future<ArangoHandle> openHandle() {
        connectCalls.incrementAndGet();
        return vertx.<ArangoHandle>executeBlocking(() -> connector.connect(config), false)
            .onFailure(err -> lastConnectionError = err.getMessage());
    }

    /**
     * Publish a freshly opened handle unless another one got there first or the manager
     * was shut down meanwhile. A handle that is not published gets closed.
     */
    private Optional<ArangoHandle> install(ArangoHandle opened) {
        if (state.get() == State.CLOSED) {
            closeQuietly(opened);
            return Optional.empty();
        }
        if (handle.compareAndSet(null, opened)) {
            state.set(State.CONNECTED);
            return Optional.of(opened);
        }
        LogUtil.logDetail(vertx, "Concurrent reconnect lost the race; closing extra handle", COMPONENT, "Connect", "Database");
        closeQuietly(opened);
        state.set(State.CONNECTED);
        return Optional.ofNullable(handle.get());
    }

    private void closeQuietly(ArangoHandle extra) {
        try {
            extra.close();
        } catch (RuntimeException e) {
            LogUtil.logError(vertx, "Error closing surplus ArangoDB handle", e, COMPONENT, "Connect", "Database", false);
        }
    }
}
