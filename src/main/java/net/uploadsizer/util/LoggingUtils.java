package net.uploadsizer.util;

import java.nio.file.Path;
import java.util.Arrays;
import org.slf4j.Logger;

/**
 * Helpers for logging pipeline failures with their cause appended as the trailing throwable argument.
 */
public final class LoggingUtils {

    private LoggingUtils() {
    }

    public static void error(Logger logger, Throwable throwable, String message, Object... args) {
        log(logger, Level.ERROR, throwable, message, args);
    }

    public static void warn(Logger logger, Throwable throwable, String message, Object... args) {
        log(logger, Level.WARN, throwable, message, args);
    }

    /**
     * Logs a per-file problem at WARN without a stack trace, keeping the cause's message inline.
     */
    public static void warnBrief(Logger logger, Path path, String message, Throwable cause) {
        if (logger == null || !logger.isWarnEnabled()) {
            return;
        }
        logger.warn("{} [{}]: {}", message, path, describe(cause));
    }

    /**
     * Short human-readable description of a throwable: its message, or its simple class name when blank.
     */
    public static String describe(Throwable throwable) {
        if (throwable == null) {
            return "unknown error";
        }
        String message = throwable.getMessage();
        if (message == null || message.isBlank()) {
            return throwable.getClass().getSimpleName();
        }
        return message;
    }

    private static void log(Logger logger, Level level, Throwable throwable, String message, Object... args) {
        if (logger == null || message == null) {
            return;
        }

        Object[] finalArgs = args == null ? new Object[0] : args;
        if (throwable != null) {
            finalArgs = Arrays.copyOf(finalArgs, finalArgs.length + 1);
            finalArgs[finalArgs.length - 1] = throwable;
        }

        switch (level) {
            case ERROR -> logger.error(message, finalArgs);
            case WARN -> logger.warn(message, finalArgs);
        }
    }

    private enum Level {
        ERROR,
        WARN
    }
}
