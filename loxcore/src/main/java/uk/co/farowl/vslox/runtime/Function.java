// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vslox.runtime;

import uk.co.farowl.vslox.support.InterpreterError;

/**
 * A compiled function or method, as produced once by the compiler for
 * each declaration. A {@code Function} is immutable. At run-time it is
 * referred to (weakly) by every {@link Value.Closure} made from it.
 */
public final class Function implements DeepEq<Function> {

    /** Name of the function. */
    private final InternedString name;

    /** Number of parameters. */
    private final int arity;

    /** Instructions and constants. */
    private final Chunk chunk;

    /**
     * Create a function descriptor.
     *
     * @param name of the function
     * @param arity number of parameters (not negative)
     * @param chunk compiled body
     */
    public Function(InternedString name, int arity, Chunk chunk) {
        InterpreterError.check(arity >= 0,
                "function arity must not be negative (was %d)", arity);
        this.name = name;
        this.arity = arity;
        this.chunk = chunk;
    }

    /** @return the name of the function */
    public InternedString name() { return name; }

    /** @return the number of parameters */
    public int arity() { return arity; }

    /** @return the compiled body */
    public Chunk chunk() { return chunk; }

    /**
     * The text by which a Lox program sees this function.
     *
     * @return {@code "<fn NAME>"}
     */
    public String stringify() { return "<fn " + name.text() + ">"; }

    @Override
    public boolean deepEquals(Function other) {
        return name.text().equals(other.name.text())
                && arity == other.arity
                && chunk.deepEquals(other.chunk);
    }

    @Override
    public String toString() { return stringify(); }
}
