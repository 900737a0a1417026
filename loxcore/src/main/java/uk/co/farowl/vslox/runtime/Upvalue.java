// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vslox.runtime;

import uk.co.farowl.vslox.support.InterpreterError;

/**
 * Compile-time description of one variable captured by a closure. If
 * {@code isLocal}, {@code index} is a local slot of the immediately
 * enclosing frame; otherwise it is an index into the captured
 * variables of the enclosing closure. Consumed by {@link Closures}
 * when a closure is made.
 *
 * @param index slot or upvalue number (not negative)
 * @param isLocal whether {@code index} addresses the enclosing frame
 */
public record Upvalue(int index, boolean isLocal) {

    /**
     * Check the index.
     *
     * @param index slot or upvalue number (not negative)
     * @param isLocal whether {@code index} addresses the enclosing
     *     frame
     */
    public Upvalue {
        InterpreterError.check(index >= 0,
                "upvalue index must not be negative (was %d)", index);
    }

    /**
     * Describe a capture of a local of the enclosing frame.
     *
     * @param index of the local
     * @return the descriptor
     */
    public static Upvalue local(int index) {
        return new Upvalue(index, true);
    }

    /**
     * Describe a capture propagated from the enclosing closure.
     *
     * @param index in the enclosing closure's captured variables
     * @return the descriptor
     */
    public static Upvalue enclosing(int index) {
        return new Upvalue(index, false);
    }
}
