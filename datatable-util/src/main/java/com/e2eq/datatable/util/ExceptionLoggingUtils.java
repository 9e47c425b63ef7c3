package com.e2eq.datatable.util;

import org.jboss.logging.Logger;

/**
 * Utility class for consistent exception logging across the table modules.
 * The caller passes its own logger so that the category stays the caller's class.
 */
public class ExceptionLoggingUtils {

    /**
     * Log exception with its stack trace at ERROR level
     *
     * @param log the logger of the calling class
     * @param exception the exception to log, may be null
     * @param message the message format string
     * @param args optional arguments for message formatting
     */
    public static void logError(Logger log, Throwable exception, String message, Object... args) {
        log(log, Logger.Level.ERROR, exception, message, args);
    }

    /**
     * Log exception with its stack trace at WARN level
     *
     * @param log the logger of the calling class
     * @param exception the exception to log, may be null
     * @param message the message format string
     * @param args optional arguments for message formatting
     */
    public static void logWarn(Logger log, Throwable exception, String message, Object... args) {
        log(log, Logger.Level.WARN, exception, message, args);
    }

    /**
     * Log an ignored exception at DEBUG level with context information
     *
     * @param log the logger of the calling class
     * @param exception the exception that was ignored
     * @param context the context where the exception was ignored (e.g., method name, operation)
     */
    public static void logIgnoredException(Logger log, Throwable exception, String context) {
        if (log.isDebugEnabled() && exception != null) {
            log.debugf(exception, "Exception ignored in %s: %s", context, describe(exception));
        }
    }

    /**
     * @param exception the exception
     * @return the exception message, or its class name when it carries no message
     */
    public static String describe(Throwable exception) {
        if (exception == null) {
            return "";
        }
        return exception.getMessage() != null ? exception.getMessage() : exception.getClass().getName();
    }

    private static void log(Logger log, Logger.Level level, Throwable exception, String message, Object... args) {
        if (!log.isEnabled(level)) {
            return;
        }
        String formattedMessage = args.length > 0 ? String.format(message, args) : message;
        if (exception == null) {
            log.log(level, formattedMessage);
        } else {
            log.logf(level, exception, "%s: %s", formattedMessage, describe(exception));
        }
    }
}
