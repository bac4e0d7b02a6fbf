package arango.mcp.services;

import io.vertx.core.AbstractVerticle;
import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.file.AsyncFile;
import io.vertx.core.file.OpenOptions;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Event-bus log sink for the server.
 *
 * <ul>
 *   <li>Consumes CSV records published on <code>log</code> and buffers them.</li>
 *   <li>Appends the buffer to <code>&lt;dir&gt;/current.csv</code> every <b>20&nbsp;seconds</b>.</li>
 *   <li>Rotates <code>current.csv</code> to a timestamped file once a day and keeps the
 *       latest <b>12</b> rotated files.</li>
 *   <li>Flushes immediately on <code>saveAllDataToFiles_OnTermination</code> and replies
 *       when the write is done.</li>
 * </ul>
 */
public class Logger extends AbstractVerticle {

  public static final String FLUSH_ADDRESS = "saveAllDataToFiles_OnTermination";
  public static final String READY_ADDRESS = "logger.ready";

  /* ---------- configuration ---------- */

  private static final long DEFAULT_FLUSH_INTERVAL_MS = 20_000;
  private static final long ROTATE_INTERVAL_MS = 86_400_000L;  // 24 hour
  private static final int  MAX_HISTORIC_FILES = 12;
  private static final String HEADER = "Message,Level,Class,Operation,Category,SequenceReceived,EpochTimeMillis\n";
  private static final DateTimeFormatter FILE_STAMP =
          DateTimeFormatter.ofPattern("yyyyMMdd_HHmm").withZone(ZoneId.of("UTC"));

  /* ---------- state ---------- */

  private final LinkedList<String> buffer = new LinkedList<>();
  private final String logsDir;
  private final String currentFile;
  private final long flushIntervalMs;
  private int sequenceCounter = 0;
  private long currentBlockStart;

  public Logger(String logsDir) {
    this(logsDir, DEFAULT_FLUSH_INTERVAL_MS);
  }

  public Logger(String logsDir, long flushIntervalMs) {
    this.logsDir = logsDir;
    this.currentFile = logsDir + "/current.csv";
    this.flushIntervalMs = flushIntervalMs;
  }

  @Override
  public void start(Promise<Void> startPromise) {
    vertx.fileSystem().mkdirs(logsDir)
        .compose(v -> vertx.fileSystem().exists(currentFile))
        .compose(exists -> exists
            ? Future.<Void>succeededFuture()
            : vertx.fileSystem().writeFile(currentFile, Buffer.buffer(HEADER)))
        .onSuccess(v -> {
          currentBlockStart = System.currentTimeMillis();
          setupConsumers();
          scheduleFlush();
          vertx.eventBus().publish(READY_ADDRESS, "true");
          startPromise.complete();
        })
        .onFailure(err -> {
          // Without a writable directory there is nowhere to log to
          System.err.println("Logger could not initialise " + logsDir + ": " + err.getMessage());
          startPromise.fail(err);
        });
  }

  public String getCurrentFile() {
    return currentFile;
  }

  /* ---------- initialisation ---------- */

  private void setupConsumers() {
    vertx.eventBus().<String>consumer(LogUtil.LOG_ADDRESS, msg -> {
      sequenceCounter++;
      buffer.add(msg.body() + "," + sequenceCounter + "," + System.currentTimeMillis() + "\n");
    });

    vertx.eventBus().consumer(FLUSH_ADDRESS, m -> flushBuffer(ar -> m.reply(ar.succeeded())));
  }

  /* ---------- periodic tasks ---------- */

  private void scheduleFlush() {
    vertx.setPeriodic(flushIntervalMs, id -> {
      long now = System.currentTimeMillis();
      if (now - currentBlockStart >= ROTATE_INTERVAL_MS) {
        rotate(now, r -> flushBuffer(null));
      } else {
        flushBuffer(null);
      }
    });
  }

  /* ---------- flush / rotate ---------- */

  private void flushBuffer(Handler<AsyncResult<Void>> handler) {
    if (buffer.isEmpty()) {
      if (handler != null) handler.handle(Future.succeededFuture());
      return;
    }

    StringBuilder sb = new StringBuilder();
    buffer.forEach(sb::append);
    buffer.clear();

    vertx.fileSystem().open(currentFile, new OpenOptions().setAppend(true).setCreate(true), openRes -> {
      if (openRes.succeeded()) {
        AsyncFile file = openRes.result();
        file.write(Buffer.buffer(sb.toString())).onComplete(wr -> {
          file.close();
          if (handler != null) handler.handle(wr.mapEmpty());
        });
      } else {
        System.err.println("Logger could not open " + currentFile + ": " + openRes.cause().getMessage());
        if (handler != null) handler.handle(openRes.mapEmpty());
      }
    });
  }

  private void rotate(long now, Handler<AsyncResult<Void>> after) {
    String rotatedPath = logsDir + "/" + FILE_STAMP.format(Instant.ofEpochMilli(currentBlockStart)) + ".csv";

    flushBuffer(flush -> {
      if (flush.failed()) {
        after.handle(flush);
        return;
      }
      vertx.fileSystem().move(currentFile, rotatedPath, mv -> {
        if (mv.failed()) {
          after.handle(mv.mapEmpty());
          return;
        }
        currentBlockStart = now;
        vertx.fileSystem().writeFile(currentFile, Buffer.buffer(HEADER), hdr -> {
          if (hdr.succeeded()) {
            cleanupOld();
          }
          after.handle(hdr.mapEmpty());
        });
      });
    });
  }

  private void cleanupOld() {
    vertx.fileSystem().readDir(logsDir, ".*\\.csv", dir -> {
      if (dir.failed()) return;

      List<String> history = dir.result().stream()
              .filter(p -> !p.endsWith("current.csv"))
              .sorted()
              .collect(Collectors.toList());

      int excess = history.size() - MAX_HISTORIC_FILES;
      if (excess > 0) {
        history.subList(0, excess).forEach(p -> vertx.fileSystem().delete(p, d -> {}));
      }
    });
  }
}
