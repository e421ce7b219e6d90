package org.shellsafe.compiler.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimal compiler-internal logger with integer verbosity levels.
 * Levels: 0=ERROR, 1=WARN, 2=INFO, 3=DEBUG, 4=TRACE
 * Output goes through SLF4J so that the generated script on stdout stays clean.
 */
public final class CompilerLogger {

    /** Log level for errors. */
    public static final int ERROR = 0;
    /** Log level for warnings. */
    public static final int WARN  = 1;
    /** Log level for informational messages. */
    public static final int INFO  = 2;
    /** Log level for debug messages. */
    public static final int DEBUG = 3;
    /** Log level for trace messages. */
    public static final int TRACE = 4;
    private static volatile int level = INFO;

    private static final Logger logger = LoggerFactory.getLogger(CompilerLogger.class);

    private CompilerLogger() {}

    /**
     * Sets the logging verbosity level.
     * @param newLevel The new level to set.
     */
    public static void setLevel(int newLevel) { level = Math.max(ERROR, Math.min(TRACE, newLevel)); }

    /**
     * Logs a warning message.
     * @param msg The message to log.
     */
    public static void warn(String msg) {
        if (level >= WARN) logger.warn(msg);
    }

    /**
     * Logs a debug message.
     * @param msg The message to log.
     */
    public static void debug(String msg) {
        if (level >= DEBUG) logger.debug(msg);
    }

    /**
     * Logs a trace message.
     * @param msg The message to log.
     */
    public static void trace(String msg) {
        if (level >= TRACE) logger.trace(msg);
    }

    /**
     * Logs the end of a pipeline phase with its duration at DEBUG level.
     * @param phase The phase name, e.g. "lowering".
     * @param unit The compilation unit the phase ran on.
     * @param startNanos The {@link System#nanoTime()} value taken when the phase started.
     */
    public static void phase(String phase, String unit, long startNanos) {
        if (level >= DEBUG && logger.isDebugEnabled()) {
            long micros = (System.nanoTime() - startNanos) / 1_000L;
            logger.debug("{}: {} finished in {} us", unit, phase, micros);
        }
    }
}
