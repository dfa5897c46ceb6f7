package io.github.yok.fixturelink.util;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Utility class that reports a fatal error of a FixtureLink run.
 *
 * <p>
 * <strong>Behavior:</strong>
 * </p>
 * <ul>
 * <li>Logs the error and its stack trace using SLF4J.</li>
 * <li>Writes a one-line diagnostic (message and root cause) to {@code System.err}.</li>
 * <li>Returns {@link #EXIT_FAILURE}; the caller hands it to Spring Boot as the process exit
 * status.</li>
 * <li>In tests, callers can switch behavior to throwing an exception via a thread-local flag.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ErrorHandler {

    /**
     * Exit status of a successful run.
     */
    public static final int EXIT_SUCCESS = 0;

    /**
     * Exit status of a failed run.
     */
    public static final int EXIT_FAILURE = 1;

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    /**
     * Switch to "throw exception instead of reporting an exit status" for the current thread
     * (useful for tests).
     */
    public static void disableExitForCurrentThread() {
        EXIT_DISABLED.set(Boolean.TRUE);
    }

    /**
     * Restore normal behavior for the current thread.
     */
    public static void restoreExitForCurrentThread() {
        EXIT_DISABLED.remove();
    }

    /**
     * Logs the message with its cause and prints a diagnostic naming the root cause to
     * {@code System.err}.
     *
     * @param message message to log
     * @param cause failure
     * @return {@link #EXIT_FAILURE}
     * @throws IllegalStateException if exit is disabled for the current thread
     */
    public static int errorAndExit(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        Throwable root = ExceptionUtils.getRootCause(cause);
        System.err.println("ERROR: " + message + "\n" + (root == null ? cause : root).getMessage());
        return EXIT_FAILURE;
    }

    /**
     * Logs the message and prints it to {@code System.err}.
     *
     * @param message message to log
     * @return {@link #EXIT_FAILURE}
     * @throws IllegalStateException if exit is disabled for the current thread
     */
    public static int errorAndExit(String message) {
        log.error(message);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
        return EXIT_FAILURE;
    }
}
