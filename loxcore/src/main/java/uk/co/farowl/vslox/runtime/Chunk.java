// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vslox.runtime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import uk.co.farowl.vslox.support.InterpreterError;

/**
 * The compiled body of a {@link Function}: instruction bytes, the
 * source line of each byte, and the constants the instructions refer
 * to. The core treats the instructions as opaque. A {@code Chunk} is
 * immutable once built; the compiler assembles it with a
 * {@link Builder}.
 */
public final class Chunk implements DeepEq<Chunk> {

    private final byte[] code;
    private final int[] lines;
    private final List<Value> constants;

    private Chunk(byte[] code, int[] lines, List<Value> constants) {
        this.code = code;
        this.lines = lines;
        this.constants = constants;
    }

    /** @return number of instruction bytes */
    public int size() { return code.length; }

    /**
     * The instruction byte at an offset.
     *
     * @param offset into the code
     * @return the byte there
     */
    public byte code(int offset) { return code[offset]; }

    /**
     * The source line of the instruction byte at an offset.
     *
     * @param offset into the code
     * @return its line number
     */
    public int line(int offset) { return lines[offset]; }

    /**
     * A constant from the pool.
     *
     * @param index of the constant
     * @return the constant
     */
    public Value constant(int index) { return constants.get(index); }

    /** @return the constant pool (unmodifiable) */
    public List<Value> constants() { return constants; }

    @Override
    public boolean deepEquals(Chunk other) {
        if (other == this) {
            return true;
        } else if (!Arrays.equals(code, other.code)
                || !Arrays.equals(lines, other.lines)
                || constants.size() != other.constants.size()) {
            return false;
        }
        for (int i = 0; i < constants.size(); i++) {
            if (!constantsMatch(constants.get(i),
                    other.constants.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Compare two constants for {@link #deepEquals(Chunk)}. Scalars
     * and strings compare by value, closures by the deep content of
     * their functions.
     */
    private static boolean constantsMatch(Value a, Value b) {
        if (a instanceof Value.Number x && b instanceof Value.Number y) {
            // Unlike the run-time operator, NaN matches NaN here.
            return Double.compare(x.value(), y.value()) == 0;
        } else if (a instanceof Value.Closure x
                && b instanceof Value.Closure y) {
            return x.upvalueCount() == y.upvalueCount()
                    && x.function().deepEquals(y.function());
        } else {
            return a.isEqual(b);
        }
    }

    @Override
    public String toString() {
        return String.format("Chunk(%d bytes, %d constants)", code.length,
                constants.size());
    }

    /** Assembles a {@link Chunk}. */
    public static final class Builder {

        private byte[] code = new byte[8];
        private int[] lines = new int[8];
        private int count;
        private final List<Value> constants = new ArrayList<>();

        /**
         * Append one instruction byte.
         *
         * @param b byte to append (only the low 8 bits are kept)
         * @param line source line it came from
         * @return this builder
         */
        public Builder write(int b, int line) {
            if (count == code.length) {
                code = Arrays.copyOf(code, 2 * count);
                lines = Arrays.copyOf(lines, 2 * count);
            }
            code[count] = (byte)b;
            lines[count] = line;
            count += 1;
            return this;
        }

        /**
         * Add a constant to the pool.
         *
         * @param value to add
         * @return its index in the pool
         */
        public int addConstant(Value value) {
            InterpreterError.check(value != null, "null constant");
            constants.add(value);
            return constants.size() - 1;
        }

        /** @return number of bytes written so far */
        public int size() { return count; }

        /** @return the finished chunk */
        public Chunk build() {
            return new Chunk(Arrays.copyOf(code, count),
                    Arrays.copyOf(lines, count),
                    Collections.unmodifiableList(
                            new ArrayList<>(constants)));
        }
    }
}
