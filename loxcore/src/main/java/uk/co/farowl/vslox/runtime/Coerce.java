// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vslox.runtime;

import uk.co.farowl.vslox.heap.Cell;
import uk.co.farowl.vslox.support.InterpreterError;

/**
 * Narrowing of a {@link Value} to the Java type an instruction handler
 * needs. Each method accepts exactly the variants listed and otherwise
 * throws a {@link ValueTypeError} naming what it expected and what it
 * found.
 * <p>
 * Only {@link #asNumber(Value)} looks through an
 * {@link Value.UpvaluePtr UpvaluePtr}, in the same way as
 * {@link Value#updateNumber(Cell, double)}. The boolean and string
 * conversions match the exact variant only, so that a {@code Bool}
 * behind an {@code UpvaluePtr} is not a {@code Bool}.
 */
public final class Coerce {

    // TODO: ask the language owners whether Bool and Str should also tunnel

    private Coerce() {} // no instances

    /**
     * The value as a Java {@code double}, if it is a {@code Number} or
     * an {@code UpvaluePtr} to one.
     *
     * @param v to convert
     * @return its numeric value
     * @throws ValueTypeError if {@code v} is not numeric
     * @throws InterpreterError if an upvalue referent was reclaimed
     */
    public static double asNumber(Value v)
            throws ValueTypeError, InterpreterError {
        if (v instanceof Value.Number n) {
            return n.value();
        } else if (v instanceof Value.UpvaluePtr p) {
            return asNumber(p.referent());
        } else {
            throw new ValueTypeError("Number", v);
        }
    }

    /**
     * The value as a Java {@code boolean}, if it is exactly a
     * {@code Bool}.
     *
     * @param v to convert
     * @return its boolean value
     * @throws ValueTypeError if {@code v} is not a {@code Bool}
     */
    public static boolean asBool(Value v) throws ValueTypeError {
        if (v instanceof Value.Bool b) {
            return b.value();
        } else {
            throw new ValueTypeError("Bool", v);
        }
    }

    /**
     * The interned string handle, if the value is exactly a
     * {@code Str}.
     *
     * @param v to convert
     * @return its string handle
     * @throws ValueTypeError if {@code v} is not a {@code Str}
     */
    public static InternedString asString(Value v) throws ValueTypeError {
        if (v instanceof Value.Str s) {
            return s.string();
        } else {
            throw new ValueTypeError("Str", v);
        }
    }

    /**
     * Overwrite a boolean in place, if the location holds exactly a
     * {@code Bool}. Nothing changes on failure.
     *
     * @param home location holding the value
     * @param b new boolean
     * @throws ValueTypeError if {@code home} does not hold a
     *     {@code Bool}
     */
    public static void setBool(Cell<Value> home, boolean b)
            throws ValueTypeError {
        Value v = home.get();
        if (v instanceof Value.Bool) {
            home.set(Value.bool(b));
        } else {
            throw new ValueTypeError("Bool", v);
        }
    }
}
