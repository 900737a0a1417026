// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vslox.support;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Internal error thrown when the Lox implementation cannot be relied on
 * to work. A Lox run-time error (that the dispatch loop reports to the
 * program) is not then appropriate. An {@code InterpreterError} signals
 * a broken invariant: a bug in the compiler, in closure capture or in
 * the collector. It is never caught in the core.
 */
public class InterpreterError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /**
     * Logger for interpreter errors. It may seem odd to log the raising
     * of a low-level exception, but an invariant failure deep in a
     * dispatch loop is easily swallowed by a careless handler: this
     * gives us a second chance to notice.
     */
    static final Logger logger =
            LoggerFactory.getLogger(InterpreterError.class);

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public InterpreterError(String msg, Object... args) {
        super(String.format(msg, args));
        logger.atInfo().log(getMessage());
    }

    /**
     * Throw an {@code InterpreterError} unless a condition holds. This
     * is the fail-fast form of an assertion, active whether or not the
     * JVM runs with {@code -ea}.
     *
     * @param condition that must be {@code true}
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     * @throws InterpreterError if {@code condition} is {@code false}
     */
    public static void check(boolean condition, String msg,
            Object... args) throws InterpreterError {
        if (!condition) { throw new InterpreterError(msg, args); }
    }
}
