package io.github.yok.marlea.util;

import io.github.yok.marlea.parser.NetworkParseException;
import io.github.yok.marlea.parser.ParseErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Utility class that logs a fatal error, echoes a concise message to {@code System.err} and tells
 * the caller which process exit code to use.
 *
 * <p>
 * It never terminates the JVM itself; the command-line entry point decides how to end the process.
 * </p>
 *
 * @author marlea-parser contributors
 */
@Slf4j
public final class ErrorHandler {

    public static final int EXIT_OK = 0;

    public static final int EXIT_FAILURE = 1;

    public static final int EXIT_PARSE_FAILED = 2;

    public static final int EXIT_UNSUPPORTED_EXT = 3;

    public static final int EXIT_INVALID_FILE = 4;

    private ErrorHandler() {
        // Utility class; do not instantiate.
    }

    /**
     * Returns the process exit code for a parse error kind.
     *
     * @param kind error kind
     * @return exit code
     */
    public static int exitCodeOf(ParseErrorKind kind) {
        switch (kind) {
            case PARSE_FAILED:
                return EXIT_PARSE_FAILED;
            case UNSUPPORTED_EXT:
                return EXIT_UNSUPPORTED_EXT;
            case INVALID_FILE:
                return EXIT_INVALID_FILE;
            default:
                return EXIT_FAILURE;
        }
    }

    /**
     * Logs the given message and root cause at error level and prints a concise message to
     * {@code System.err}.
     *
     * @param message message to log
     * @param cause root cause
     * @return exit code for the failure
     */
    public static int report(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        System.err.println("ERROR: " + message + "\n" + cause.getMessage());
        if (cause instanceof NetworkParseException) {
            return exitCodeOf(((NetworkParseException) cause).getKind());
        }
        return EXIT_FAILURE;
    }

    /**
     * Logs the given message at error level and prints it to {@code System.err}.
     *
     * @param message message to log
     * @return {@link #EXIT_FAILURE}
     */
    public static int report(String message) {
        log.error(message);
        System.err.println("ERROR: " + message);
        return EXIT_FAILURE;
    }
}
