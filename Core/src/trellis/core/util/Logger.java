package trellis.core.util;

import java.io.PrintStream;

/**
 * A simple logging utility that can be either enabled or disabled globally.
 *
 * Log lines go to standard error by default so that they never interleave with events a reporter writes to standard
 * output. The destination can be swapped globally, which the tests use to capture what was logged.
 */
public final class Logger {
    public static final String ENABLE_PROPERTY = "trellis.enable_logger";
    private static volatile boolean globalEnabled = Boolean.parseBoolean(System.getProperty(ENABLE_PROPERTY, "true"));
    private static volatile PrintStream destination = System.err;
    private final String className;
    private volatile boolean enabled = true;

    private Logger(String className) {
        ObjectChecker.assertNonNull(className, "className");
        this.className = className;
    }

    /**
     * Constructs and returns a new logger for the given class.
     *
     * @param logClass The logging class.
     * @return the new logger.
     */
    public static Logger forClass(Class<?> logClass) {
        ObjectChecker.assertNonNull(logClass, "logClass");
        return new Logger(logClass.getSimpleName());
    }

    /**
     * Globally disables all loggers.
     */
    public static void globalDisable() {
        globalEnabled = false;
    }

    /**
     * Globally enables all loggers.
     */
    public static void globalEnable() {
        globalEnabled = true;
    }

    /**
     * Redirects the output of every logger to the given stream.
     *
     * @param stream The new destination.
     */
    public static void redirectTo(PrintStream stream) {
        ObjectChecker.assertNonNull(stream, "stream");
        destination = stream;
    }

    /**
     * Disables this logger only.
     */
    public void disable() {
        this.enabled = false;
    }

    /**
     * Enables this logger only. It still logs nothing while the loggers are globally disabled.
     */
    public void enable() {
        this.enabled = true;
    }

    /**
     * Logs the specified message if logging is enabled, prefixed with the logging class and the current thread.
     *
     * @param message The message to log.
     */
    public void log(String message) {
        if (globalEnabled && this.enabled) {
            destination.println(this.className + " [" + Thread.currentThread().getName() + "]: " + message);
        }
    }

    /**
     * Logs the specified message followed by the type and message of the given error.
     *
     * @param message The message to log.
     * @param error The error that prompted the message.
     */
    public void log(String message, Throwable error) {
        log(message + " (" + error.getClass().getName() + ": " + error.getMessage() + ")");
    }

    @Override
    public String toString() {
        return this.getClass().getName() + " { class: " + this.className + ", enabled (global): " + globalEnabled + ", enabled (local): " + this.enabled + " }";
    }
}
