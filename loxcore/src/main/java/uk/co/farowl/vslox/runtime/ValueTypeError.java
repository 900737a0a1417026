// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vslox.runtime;

/**
 * A {@link Value} was not of the variant an operation required. This
 * is a recoverable condition: the dispatch loop reports it to the Lox
 * program as a run-time error. Compare {@link
 * uk.co.farowl.vslox.support.InterpreterError InterpreterError}, which
 * is never recoverable.
 */
public class ValueTypeError extends Exception {
    private static final long serialVersionUID = 1L;

    /** Variant that was expected. */
    private final String expected;

    /** The value actually found. */
    private final transient Value actual;

    /**
     * Create an exception naming the expected variant and the value
     * encountered.
     *
     * @param expected name of the expected variant
     * @param actual value encountered
     */
    public ValueTypeError(String expected, Value actual) {
        super(String.format("Expected %s, but found %s", expected,
                actual));
        this.expected = expected;
        this.actual = actual;
    }

    /** @return name of the variant that was expected */
    public String getExpected() { return expected; }

    /** @return the value actually found */
    public Value getActual() { return actual; }
}
