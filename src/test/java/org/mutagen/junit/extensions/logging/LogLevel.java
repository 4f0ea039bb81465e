package org.mutagen.junit.extensions.logging;

/**
 * Log levels that {@link LogWatchExtension} can watch.
 */
public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
