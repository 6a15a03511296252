/*
 * Copyright Node Specific Sizing authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.nodesizing.common;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.spi.AbstractLogger;
import org.apache.logging.log4j.spi.ExtendedLoggerWrapper;

/**
 * Logger wrapper with convenience methods for logging in the context of a single admission request ({@code *Pod}
 * methods, which prefix the message with the {@link AdmissionContext} and attach its marker) or outside any admission
 * request ({@code *Op} methods).
 * <p>Compatible with Log4j 2.6 or higher.</p>
 */
public class SizingLogger {
    private static final String FQCN = SizingLogger.class.getName();

    private final ExtendedLoggerWrapper logger;

    protected SizingLogger(final Logger logger) {
        this.logger = new ExtendedLoggerWrapper((AbstractLogger) logger, logger.getName(), logger.getMessageFactory());
    }

    /**
     * Returns a custom Logger using the fully qualified name of the Class as the Logger name.
     *
     * @param loggerName The Class whose name should be used as the Logger name.
     *
     * @return The custom Logger.
     */
    public static SizingLogger create(final Class<?> loggerName) {
        return new SizingLogger(LogManager.getLogger(loggerName));
    }

    /**
     * @return  True when the DEBUG level is enabled for this logger
     */
    public boolean isDebugEnabled() {
        return logger.isDebugEnabled();
    }

    /**
     * Logs a message with parameters at the {@code DEBUG} level in the context of an admission request.
     *
     * @param context   The admission context
     * @param message   The message to log; the format depends on the message factory.
     * @param params    Parameters to the message.
     */
    public void debugPod(final AdmissionContext context, final String message, final Object... params) {
        logger.logIfEnabled(FQCN, Level.DEBUG, context.getMarker(), context + ": " + message, params);
    }

    /**
     * Logs a message with parameters at the {@code INFO} level in the context of an admission request.
     *
     * @param context   The admission context
     * @param message   The message to log; the format depends on the message factory.
     * @param params    Parameters to the message.
     */
    public void infoPod(final AdmissionContext context, final String message, final Object... params) {
        logger.logIfEnabled(FQCN, Level.INFO, context.getMarker(), context + ": " + message, params);
    }

    /**
     * Logs a message with parameters at the {@code WARN} level in the context of an admission request.
     *
     * @param context   The admission context
     * @param message   The message to log; the format depends on the message factory.
     * @param params    Parameters to the message.
     */
    public void warnPod(final AdmissionContext context, final String message, final Object... params) {
        logger.logIfEnabled(FQCN, Level.WARN, context.getMarker(), context + ": " + message, params);
    }

    /**
     * Logs a message with parameters at the {@code ERROR} level in the context of an admission request.
     *
     * @param context   The admission context
     * @param message   The message to log; the format depends on the message factory.
     * @param params    Parameters to the message.
     */
    public void errorPod(final AdmissionContext context, final String message, final Object... params) {
        logger.logIfEnabled(FQCN, Level.ERROR, context.getMarker(), context + ": " + message, params);
    }

    /**
     * Logs a message with parameters at the {@code DEBUG} level.
     *
     * @param message   The message to log; the format depends on the message factory.
     * @param params    Parameters to the message.
     */
    public void debugOp(final String message, final Object... params) {
        logger.logIfEnabled(FQCN, Level.DEBUG, null, message, params);
    }

    /**
     * Logs a message with parameters at the {@code INFO} level.
     *
     * @param message   The message to log; the format depends on the message factory.
     * @param params    Parameters to the message.
     */
    public void infoOp(final String message, final Object... params) {
        logger.logIfEnabled(FQCN, Level.INFO, null, message, params);
    }

    /**
     * Logs a message with parameters at the {@code WARN} level.
     *
     * @param message   The message to log; the format depends on the message factory.
     * @param params    Parameters to the message.
     */
    public void warnOp(final String message, final Object... params) {
        logger.logIfEnabled(FQCN, Level.WARN, null, message, params);
    }

    /**
     * Logs a message at the {@code WARN} level including the stack trace of the {@link Throwable} {@code t} passed
     * as parameter.
     *
     * @param message   The message to log.
     * @param t         The exception to log, including its stack trace.
     */
    public void warnOp(final String message, final Throwable t) {
        logger.logIfEnabled(FQCN, Level.WARN, null, message, t);
    }

    /**
     * Logs a message at the {@code ERROR} level including the stack trace of the {@link Throwable} {@code t} passed
     * as parameter.
     *
     * @param message   The message to log.
     * @param t         The exception to log, including its stack trace.
     */
    public void errorOp(final String message, final Throwable t) {
        logger.logIfEnabled(FQCN, Level.ERROR, null, message, t);
    }
}
