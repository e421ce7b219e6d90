package org.shellsafe.junit.extensions.logging;

/**
 * Log levels the {@link LogWatchExtension} distinguishes. DEBUG and TRACE never fail a test.
 */
public enum LogLevel {
    INFO, WARN, ERROR
}
