// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vslox.runtime;

import uk.co.farowl.vslox.heap.Cell;
import uk.co.farowl.vslox.support.InterpreterError;

/**
 * The part of a call frame that closure capture reads: a window onto
 * the value stack holding the frame's local variables, and the closure
 * the frame is executing. The dispatch loop owns the stack array; the
 * frame only addresses it.
 */
public final class Frame {

    /** The executing closure, or {@code null} at top level. */
    private final Value.Closure closure;

    /** The value stack (shared with the dispatch loop). */
    private final Value[] stack;

    /** Index in {@link #stack} of local slot 0. */
    private final int base;

    /**
     * Create a frame over a stack.
     *
     * @param closure executing, or {@code null} for top-level code
     * @param stack the value stack
     * @param base index in {@code stack} of local slot 0
     */
    public Frame(Value.Closure closure, Value[] stack, int base) {
        InterpreterError.check(base >= 0 && base <= stack.length,
                "frame base %d outside stack of %d", base, stack.length);
        this.closure = closure;
        this.stack = stack;
        this.base = base;
    }

    /**
     * Create a top-level frame whose locals are the whole of a stack.
     *
     * @param stack the value stack
     */
    public Frame(Value[] stack) { this(null, stack, 0); }

    /** @return the executing closure or {@code null} at top level */
    public Value.Closure closure() { return closure; }

    /**
     * The current content of a local slot.
     *
     * @param index of the local
     * @return its value
     */
    public Value local(int index) { return stack[slot(index)]; }

    /**
     * Replace the content of a local slot.
     *
     * @param index of the local
     * @param v new value
     */
    public void setLocal(int index, Value v) { stack[slot(index)] = v; }

    /**
     * A local slot as a {@link Cell}, for operations that update a
     * value in place.
     *
     * @param index of the local
     * @return view of the slot
     */
    public Cell<Value> localCell(int index) {
        final int i = slot(index);
        return new Cell<>() {
            @Override
            public Value get() { return stack[i]; }

            @Override
            public void set(Value v) { stack[i] = v; }
        };
    }

    private int slot(int index) {
        int i = base + index;
        InterpreterError.check(index >= 0 && i < stack.length,
                "local %d outside frame (base %d, stack %d)", index, base,
                stack.length);
        return i;
    }
}
