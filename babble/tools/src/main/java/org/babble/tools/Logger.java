package org.babble.tools;

import org.slf4j.LoggerFactory;

/**
 * Thin logging facade used across babble. Call sites keep the
 * {@code Logger.getLogger(X.class)} / {@code log.info("[tag] ...")} shape,
 * the actual output goes through SLF4J.
 */
public class Logger {

    private final org.slf4j.Logger delegate;

    private Logger(org.slf4j.Logger delegate) {
        this.delegate = delegate;
    }

    public static Logger getLogger(Class<?> clazz) {
        return new Logger(LoggerFactory.getLogger(clazz));
    }

    public void debug(String message) {
        delegate.debug(message);
    }

    public void info(String message) {
        delegate.info(message);
    }

    public void warn(String message) {
        delegate.warn(message);
    }

    public void warn(String message, Throwable t) {
        delegate.warn(message, t);
    }

    public void error(String message, Throwable t) {
        delegate.error(message, t);
    }

    public String getName() {
        return delegate.getName();
    }
}
