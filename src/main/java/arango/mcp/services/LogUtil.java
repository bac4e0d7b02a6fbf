package arango.mcp.services;

import arango.mcp.Driver;
import io.vertx.core.Vertx;

/**
 * Structured logging helpers on top of the <code>log</code> event-bus address.
 *
 * <p>Console output goes to stderr only. Stdout belongs to the stdio transport.</p>
 */
public class LogUtil {

    // Log levels matching Driver.logLevel
    public static final int ERROR = 0;
    public static final int INFO = 1;
    public static final int DETAIL = 2;
    public static final int DEBUG = 3;
    public static final int DATA = 4;

    public static final String LOG_ADDRESS = "log";

    /**
     * Log an error that should appear in logs and optionally on the console
     */
    public static void logError(Vertx vertx, String message, String component, String operation, String category, boolean showInConsole) {
        if (showInConsole) {
            System.err.println("[ERROR] " + component + ": " + message);
        }
        publish(vertx, formatLogMessage(message, ERROR, component, operation, category));
    }

    /**
     * Log an error with exception details. The stack trace is only recorded at debug level.
     */
    public static void logError(Vertx vertx, String message, Throwable throwable, String component, String operation, String category, boolean showInConsole) {
        String fullMessage = message + ": " + throwable.getClass().getSimpleName() + ": " + throwable.getMessage();

        if (showInConsole) {
            System.err.println("[ERROR] " + component + ": " + fullMessage);
        }
        publish(vertx, formatLogMessage(fullMessage, ERROR, component, operation, category));

        if (Driver.logLevel >= DEBUG) {
            StringBuilder stackTrace = new StringBuilder();
            for (StackTraceElement element : throwable.getStackTrace()) {
                stackTrace.append("  at ").append(element.toString()).append(" ");
            }
            publish(vertx, formatLogMessage("Stack trace: " + stackTrace, DEBUG, component, operation, category));
        }
    }

    /**
     * Log an info message (startup, status, etc)
     */
    public static void logInfo(Vertx vertx, String message, String component, String operation, String category, boolean showInConsole) {
        if (Driver.logLevel < INFO) {
            return;
        }
        if (showInConsole) {
            System.err.println("[INFO] " + component + ": " + message);
        }
        publish(vertx, formatLogMessage(message, INFO, component, operation, category));
    }

    public static void logDetail(Vertx vertx, String message, String component, String operation, String category) {
        if (Driver.logLevel >= DETAIL) {
            publish(vertx, formatLogMessage(message, DETAIL, component, operation, category));
        }
    }

    public static void logDebug(Vertx vertx, String message, String component, String operation, String category) {
        if (Driver.logLevel >= DEBUG) {
            publish(vertx, formatLogMessage(message, DEBUG, component, operation, category));
        }
    }

    public static void logData(Vertx vertx, String message, String component, String operation, String category) {
        if (Driver.logLevel >= DATA) {
            publish(vertx, formatLogMessage(message, DATA, component, operation, category));
        }
    }

    private static void publish(Vertx vertx, String record) {
        if (vertx != null) {
            vertx.eventBus().publish(LOG_ADDRESS, record);
        } else {
            Driver.captureOrPublishLog(record);
        }
    }

    /**
     * Format log message for the event bus. Commas and newlines would break the CSV columns.
     */
    static String formatLogMessage(String message, int level, String component, String operation, String category) {
        String cleanMessage = String.valueOf(message).replace(",", ";").replace('\n', ' ').replace('\r', ' ');
        return cleanMessage + "," + level + "," + component + "," + operation + "," + category;
    }
}
