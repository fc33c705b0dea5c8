package com.e2eq.cnl.util;

import io.quarkus.logging.Log;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Consistent exception logging for the REST layer.
 */
public class ExceptionLoggingUtils {

    /**
     * Log exception with full stack trace at ERROR level
     *
     * @param exception the exception to log
     * @param message the message
     */
    public static void logError(Throwable exception, String message) {
        if (exception == null) {
            Log.error(message);
            return;
        }
        Log.errorf("%s: %s%n%s", message, describe(exception), getStackTrace(exception));
    }

    /**
     * Log a client mistake at WARN level, without stack trace.
     *
     * @param exception the exception to log
     * @param message the message
     */
    public static void logWarn(Throwable exception, String message) {
        if (exception == null) {
            Log.warn(message);
            return;
        }
        Log.warnf("%s: %s", message, describe(exception));
    }

    /**
     * Log exception with full stack trace at DEBUG level
     *
     * @param exception the exception to log
     * @param message the message
     */
    public static void logDebug(Throwable exception, String message) {
        if (!Log.isDebugEnabled()) {
            return;
        }
        if (exception == null) {
            Log.debug(message);
            return;
        }
        Log.debugf("%s: %s%n%s", message, describe(exception), getStackTrace(exception));
    }

    public static String getStackTrace(Throwable exception) {
        if (exception == null) {
            return "";
        }
        StringWriter sw = new StringWriter();
        PrintWriter pw = new PrintWriter(sw);
        exception.printStackTrace(pw);
        return sw.toString();
    }

    private static String describe(Throwable exception) {
        return exception.getMessage() != null ? exception.getMessage() : exception.getClass().getName();
    }
}
