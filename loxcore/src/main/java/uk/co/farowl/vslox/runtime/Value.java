// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vslox.runtime;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;

import uk.co.farowl.vslox.heap.Cell;
import uk.co.farowl.vslox.heap.GcWeak;
import uk.co.farowl.vslox.heap.GcWeakMut;
import uk.co.farowl.vslox.heap.Heap;
import uk.co.farowl.vslox.heap.SharedCell;
import uk.co.farowl.vslox.heap.Tracer;
import uk.co.farowl.vslox.support.InterpreterError;

/**
 * A Lox value as the virtual machine manipulates it. The variants are a
 * closed set: the scalars {@link Number}, {@link Bool} and {@link Nil},
 * interned strings {@link Str}, functions with their captured variables
 * {@link Closure}, and the two states of a captured variable's storage,
 * {@link OpenUpvalue} (still in its frame) and {@link UpvaluePtr}
 * (promoted to the heap).
 * <p>
 * A {@code Closure} or {@code UpvaluePtr} never owns what it refers to.
 * The only owning reference a value may hold is the {@link SharedCell}
 * of an {@code OpenUpvalue}, and a cell has no reference back to its
 * holders, so values cannot form strong cycles.
 * <p>
 * Every operation declared here is implemented separately by each
 * variant.
 */
public sealed interface Value {

    /** The one {@code nil}. */
    Nil NIL = new Nil();

    /**
     * Whether this value counts as false in a condition: exactly
     * {@code nil} and {@code false} do.
     *
     * @return {@code true} iff {@code nil} or {@code false}
     */
    boolean isFalsey();

    /**
     * Whether this value counts as true in a condition. Zero and the
     * empty string are true.
     *
     * @return {@code !isFalsey()}
     */
    default boolean isTruthy() { return !isFalsey(); }

    /** @return whether this is a {@link Str} */
    default boolean isString() { return this instanceof Str; }

    /** @return whether this is a {@link Closure} */
    default boolean isFunction() { return this instanceof Closure; }

    /** @return whether this is an {@link UpvaluePtr} */
    default boolean isUpvaluePtr() { return this instanceof UpvaluePtr; }

    /**
     * The text of this value as a Lox {@code print} shows it. Captured
     * variables show their current content.
     *
     * @return display text
     */
    String stringify();

    /**
     * The run-time equality operator. Only scalars and strings are ever
     * equal: any comparison involving a {@link Closure},
     * {@link UpvaluePtr} or {@link OpenUpvalue} is {@code false}, even
     * of a value with itself. (Java {@code equals} is not this
     * operator.)
     *
     * @param other right-hand side
     * @return whether equal in Lox
     */
    boolean isEqual(Value other);

    /**
     * Overwrite a number in place, tunnelling through any
     * {@link UpvaluePtr} to the storage it refers to. {@code home} is
     * the location holding this value. A {@link Number} is replaced in
     * {@code home}; an {@code UpvaluePtr} forwards the update to its
     * referent. Every other variant fails, and nothing changes. In
     * particular the update does not pass through an
     * {@link OpenUpvalue}: writes to an open variable go through its
     * cell.
     *
     * @param home location holding this value
     * @param n new number
     * @return {@code true} if the update succeeded
     * @throws InterpreterError if a referent has been reclaimed
     */
    boolean updateNumber(Cell<Value> home, double n)
            throws InterpreterError;

    /**
     * Present to a collector the references this value holds.
     *
     * @param tracer to receive the references
     */
    void trace(Tracer tracer);

    /**
     * Overwrite the number held in a cell, in the manner of
     * {@link #updateNumber(Cell, double)} applied to the cell's content
     * with the cell as its home.
     *
     * @param cell holding the value to update
     * @param n new number
     * @return {@code true} if the update succeeded
     * @throws InterpreterError if a referent has been reclaimed
     */
    static boolean updateNumberIn(Cell<Value> cell, double n)
            throws InterpreterError {
        return cell.get().updateNumber(cell, n);
    }

    // Factories ------------------------------------------------------

    /**
     * @param value of the number
     * @return a {@link Number}
     */
    static Number number(double value) { return new Number(value); }

    /**
     * @param value of the boolean
     * @return {@link Bool#TRUE} or {@link Bool#FALSE}
     */
    static Bool bool(boolean value) {
        return value ? Bool.TRUE : Bool.FALSE;
    }

    /**
     * @param string interned text
     * @return a {@link Str}
     */
    static Str string(InternedString string) { return new Str(string); }

    /**
     * Create a closed upvalue referring to the given storage. The
     * storage must not itself hold an {@code UpvaluePtr}: one upgrade
     * must always reach the variable.
     *
     * @param ref to the storage of the variable
     * @return an {@link UpvaluePtr}
     * @throws InterpreterError if the referent is an
     *     {@code UpvaluePtr} or has been reclaimed
     */
    static UpvaluePtr upvaluePtr(GcWeakMut<Value> ref)
            throws InterpreterError {
        Value referent = ref.upgrade().get();
        InterpreterError.check(!referent.isUpvaluePtr(),
                "UpvaluePtr %s would refer to UpvaluePtr %s", ref,
                referent);
        return new UpvaluePtr(ref);
    }

    // Variants -------------------------------------------------------

    /**
     * A Lox number.
     *
     * @param value as a Java {@code double}
     */
    record Number(double value) implements Value {

        @Override
        public boolean isFalsey() { return false; }

        @Override
        public String stringify() { return format(value); }

        @Override
        public boolean isEqual(Value other) {
            return other instanceof Number n && value == n.value;
        }

        @Override
        public boolean updateNumber(Cell<Value> home, double n) {
            home.set(new Number(n));
            return true;
        }

        @Override
        public void trace(Tracer tracer) {}

        @Override
        public String toString() { return "Number(" + value + ")"; }

        /**
         * Format a {@code double} as Lox prints it: the fewest
         * significant digits that read back as the same {@code double},
         * integral values without a fractional part, and no exponent.
         */
        static String format(double v) {
            if (Double.isNaN(v)) {
                return "NaN";
            } else if (Double.isInfinite(v)) {
                return v > 0 ? "inf" : "-inf";
            } else if (v == 0.0) {
                // Keep the sign of negative zero.
                return Double.doubleToRawLongBits(v) < 0 ? "-0" : "0";
            }
            BigDecimal exact = new BigDecimal(v);
            BigDecimal shortest = exact;
            // 17 significant digits always suffice for a double.
            for (int p = 1; p <= 17; p++) {
                BigDecimal d = exact.round(
                        new MathContext(p, RoundingMode.HALF_EVEN));
                if (d.doubleValue() == v) {
                    shortest = d;
                    break;
                }
            }
            return shortest.stripTrailingZeros().toPlainString();
        }
    }

    /**
     * A Lox boolean.
     *
     * @param value as a Java {@code boolean}
     */
    record Bool(boolean value) implements Value {

        /** Lox {@code true}. */
        public static final Bool TRUE = new Bool(true);
        /** Lox {@code false}. */
        public static final Bool FALSE = new Bool(false);

        @Override
        public boolean isFalsey() { return !value; }

        @Override
        public String stringify() { return value ? "true" : "false"; }

        @Override
        public boolean isEqual(Value other) {
            return other instanceof Bool b && value == b.value;
        }

        @Override
        public boolean updateNumber(Cell<Value> home, double n) {
            return false;
        }

        @Override
        public void trace(Tracer tracer) {}

        @Override
        public String toString() { return "Bool(" + value + ")"; }
    }

    /** Lox {@code nil}. Use {@link Value#NIL}. */
    record Nil() implements Value {

        @Override
        public boolean isFalsey() { return true; }

        @Override
        public String stringify() { return "nil"; }

        @Override
        public boolean isEqual(Value other) { return other instanceof Nil; }

        @Override
        public boolean updateNumber(Cell<Value> home, double n) {
            return false;
        }

        @Override
        public void trace(Tracer tracer) {}

        @Override
        public String toString() { return "Nil"; }
    }

    /**
     * A Lox string, as a handle into the intern table.
     *
     * @param string the interned text
     */
    record Str(InternedString string) implements Value {

        @Override
        public boolean isFalsey() { return false; }

        @Override
        public String stringify() { return string.text(); }

        @Override
        public boolean isEqual(Value other) {
            return other instanceof Str s && string.equals(s.string);
        }

        @Override
        public boolean updateNumber(Cell<Value> home, double n) {
            return false;
        }

        @Override
        public void trace(Tracer tracer) { tracer.weak(string.handle()); }

        @Override
        public String toString() { return "Str(\"" + string + "\")"; }
    }

    /**
     * A function together with the variables it captured when it was
     * created. The captured references are in the order of the
     * {@link Upvalue} descriptors from which they were resolved, and
     * the list does not change afterwards.
     */
    final class Closure implements Value {

        private final GcWeak<Function> function;
        private final List<GcWeakMut<Value>> upvalues;

        /**
         * Create a closure. {@link Closures} resolves the captured
         * variables from the descriptors.
         *
         * @param function the closure executes
         * @param upvalues captured variable storage in descriptor order
         */
        public Closure(GcWeak<Function> function,
                List<GcWeakMut<Value>> upvalues) {
            this.function = function;
            this.upvalues = List.copyOf(upvalues);
        }

        /**
         * The function this closure executes.
         *
         * @return the function
         * @throws InterpreterError if the function has been reclaimed
         */
        public Function function() throws InterpreterError {
            return function.upgrade();
        }

        /** @return the (weak) handle to the function */
        public GcWeak<Function> functionHandle() { return function; }

        /** @return the captured variables, unmodifiable */
        public List<GcWeakMut<Value>> upvalues() { return upvalues; }

        /** @return number of captured variables */
        public int upvalueCount() { return upvalues.size(); }

        /**
         * One captured variable.
         *
         * @param index in the captured variables
         * @return handle to its storage
         * @throws InterpreterError if {@code index} is out of range
         */
        public GcWeakMut<Value> upvalue(int index) throws InterpreterError {
            InterpreterError.check(index >= 0 && index < upvalues.size(),
                    "upvalue %d out of range in closure with %d", index,
                    upvalues.size());
            return upvalues.get(index);
        }

        @Override
        public boolean isFalsey() { return false; }

        @Override
        public String stringify() { return function().stringify(); }

        @Override
        public boolean isEqual(Value other) { return false; }

        @Override
        public boolean updateNumber(Cell<Value> home, double n) {
            return false;
        }

        @Override
        public void trace(Tracer tracer) {
            tracer.weak(function);
            for (GcWeakMut<Value> u : upvalues) { tracer.weak(u); }
        }

        @Override
        public String toString() {
            String f = function.isLive() ? function().stringify()
                    : function.toString();
            int n = upvalues.size();
            return String.format("Closure(%s, %d upvalue%s)", f, n,
                    n == 1 ? "" : "s");
        }
    }

    /**
     * A captured variable whose frame has ended, now referring to
     * storage the collector owns. Created only through
     * {@link Value#upvaluePtr(GcWeakMut)}.
     */
    final class UpvaluePtr implements Value {

        private final GcWeakMut<Value> ref;

        private UpvaluePtr(GcWeakMut<Value> ref) { this.ref = ref; }

        /** @return the handle to the variable's storage */
        public GcWeakMut<Value> ref() { return ref; }

        /**
         * The current value of the variable.
         *
         * @return the referent
         * @throws InterpreterError if it has been reclaimed
         */
        public Value referent() throws InterpreterError {
            return ref.upgrade().get();
        }

        @Override
        public boolean isFalsey() { return false; }

        @Override
        public String stringify() { return referent().stringify(); }

        @Override
        public boolean isEqual(Value other) { return false; }

        @Override
        public boolean updateNumber(Cell<Value> home, double n) {
            Cell<Value> target = ref.upgrade();
            return target.get().updateNumber(target, n);
        }

        @Override
        public void trace(Tracer tracer) { tracer.weak(ref); }

        @Override
        public String toString() { return "UpvaluePtr(" + ref + ")"; }
    }

    /**
     * A captured variable still reachable from the frame that declared
     * it. The frame slot and each capturing closure reach the same
     * {@link SharedCell}, so a write by any of them is seen by all.
     */
    final class OpenUpvalue implements Value {

        private final SharedCell<Value> cell;

        /**
         * Wrap a shared cell as an open upvalue.
         *
         * @param cell the storage of the variable
         */
        public OpenUpvalue(SharedCell<Value> cell) { this.cell = cell; }

        /** @return the storage of the variable */
        public SharedCell<Value> cell() { return cell; }

        /**
         * Promote the variable to storage owned by the collector, as the
         * frame that declared it ends. The frame's hold on the cell is
         * released. The value is preserved, and the storage is the same
         * slot, so every handle a closure already holds continues to
         * reach it.
         *
         * @param heap in which the cell was allocated
         * @return a closed upvalue for the same storage
         * @throws InterpreterError if the cell is not from {@code heap}
         *     or has been reclaimed
         */
        public UpvaluePtr close(Heap<Value> heap) throws InterpreterError {
            GcWeakMut<Value> ref = heap.adopt(cell);
            cell.release();
            return Value.upvaluePtr(ref);
        }

        @Override
        public boolean isFalsey() { return false; }

        @Override
        public String stringify() { return cell.get().stringify(); }

        @Override
        public boolean isEqual(Value other) { return false; }

        @Override
        public boolean updateNumber(Cell<Value> home, double n) {
            return false;
        }

        @Override
        public void trace(Tracer tracer) { tracer.owning(cell); }

        @Override
        public String toString() {
            return "OpenUpvalue(" + (cell.isLive() ? cell.get() : cell)
                    + ")";
        }
    }
}
