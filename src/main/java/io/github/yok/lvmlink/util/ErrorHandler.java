package io.github.yok.lvmlink.util;

import io.github.yok.lvmlink.parser.LvmFormatException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Utility class that logs a fatal error and echoes a concise message to {@code System.err}.
 *
 * <p>
 * Intended for the command-line entry point, where a malformed LVM file or an unreadable path
 * should end the run with a readable message instead of a bare stack trace.
 * </p>
 *
 * <ul>
 * <li>Logs the error using SLF4J.</li>
 * <li>Writes a concise message to {@code System.err}; for {@link LvmFormatException} the error
 * kind and offending field are included.</li>
 * <li>Does not terminate the JVM by itself.</li>
 * <li>In tests, callers can switch to throwing an exception via a thread-local flag.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ErrorHandler {

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    /**
     * Switch to "throw exception instead of ending the process" for the current thread (useful for
     * tests).
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
     * Logs the given message and root cause at error level and prints a concise message to
     * {@code System.err}.
     *
     * @param message message to log
     * @param cause root cause
     * @throws IllegalStateException if exit is disabled for the current thread
     */
    public static void errorAndExit(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + "\n" + describe(cause));
    }

    /**
     * Logs the given message at error level and prints it to {@code System.err}.
     *
     * @param message message to log
     * @throws IllegalStateException if exit is disabled for the current thread
     */
    public static void errorAndExit(String message) {
        log.error(message);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
    }

    /**
     * Renders a one-line description of a failure for the console.
     *
     * @param cause failure
     * @return description; includes kind and field for format errors
     */
    static String describe(Throwable cause) {
        LvmFormatException format = findFormatException(cause);
        if (format == null) {
            return String.valueOf(cause.getMessage());
        }
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(format.getKind()).append("] ").append(format.getMessage());
        if (format.getField() != null) {
            sb.append(" (field=").append(format.getField()).append(')');
        }
        return sb.toString();
    }

    private static LvmFormatException findFormatException(Throwable cause) {
        int index = ExceptionUtils.indexOfThrowable(cause, LvmFormatException.class);
        return index < 0 ? null
                : (LvmFormatException) ExceptionUtils.getThrowableList(cause).get(index);
    }
}
