// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vslox.runtime;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import uk.co.farowl.vslox.heap.Cell;
import uk.co.farowl.vslox.heap.GcHandle;
import uk.co.farowl.vslox.heap.GcWeakMut;
import uk.co.farowl.vslox.heap.SharedCell;
import uk.co.farowl.vslox.heap.Tracer;
import uk.co.farowl.vslox.support.InterpreterError;

/**
 * Test the operations of {@link Value} on each variant.
 */
class ValueTest extends RuntimeTestSupport {

    /** One of every variant. */
    List<Value> everyVariant() {
        SharedCell<Value> cell = values.share(num(1));
        return List.of(num(0), Value.bool(true), Value.bool(false),
                Value.NIL, str(""), closure("f"),
                Value.upvaluePtr(stored(Value.bool(false))),
                new Value.OpenUpvalue(cell));
    }

    @Nested
    @DisplayName("Tag predicates")
    class Predicates {

        @Test
        void isString() {
            assertTrue(str("a").isString());
            assertFalse(num(1).isString());
            assertFalse(Value.upvaluePtr(stored(str("a"))).isString());
        }

        @Test
        void isFunction() {
            assertTrue(closure("f").isFunction());
            assertFalse(str("f").isFunction());
        }

        @Test
        void isUpvaluePtr() {
            assertTrue(Value.upvaluePtr(stored(num(1))).isUpvaluePtr());
            assertFalse(new Value.OpenUpvalue(values.share(num(1)))
                    .isUpvaluePtr());
        }
    }

    @Nested
    @DisplayName("Truthiness")
    class Truthiness {

        @Test
        @DisplayName("only nil and false are falsey")
        void onlyNilAndFalse() {
            for (Value v : everyVariant()) {
                boolean expected =
                        v == Value.NIL || v.isEqual(Value.Bool.FALSE);
                assertEquals(expected, v.isFalsey(), v::toString);
            }
        }

        @Test
        @DisplayName("isTruthy is the negation of isFalsey")
        void truthyIsNotFalsey() {
            for (Value v : everyVariant()) {
                assertEquals(!v.isFalsey(), v.isTruthy(), v::toString);
            }
        }

        @Test
        void zeroAndEmptyAreTrue() {
            assertTrue(num(0.0).isTruthy());
            assertTrue(str("").isTruthy());
        }

        @Test
        @DisplayName("an upvalue is truthy whatever it holds")
        void upvaluesAreTruthy() {
            assertTrue(Value.upvaluePtr(stored(Value.NIL)).isTruthy());
            assertTrue(new Value.OpenUpvalue(values.share(Value.NIL))
                    .isTruthy());
        }
    }

    @Nested
    @DisplayName("Stringify")
    class Stringify {

        @Test
        void numbers() {
            assertEquals("3", num(3.0).stringify());
            assertEquals("2.5", num(2.5).stringify());
            assertEquals("-7", num(-7).stringify());
            assertEquals("0.1", num(0.1).stringify());
            assertEquals("100", num(100).stringify());
            assertEquals("0", num(0.0).stringify());
            assertEquals("-0", num(-0.0).stringify());
            assertEquals("NaN", num(Double.NaN).stringify());
            assertEquals("inf", num(Double.POSITIVE_INFINITY).stringify());
            assertEquals("-inf",
                    num(Double.NEGATIVE_INFINITY).stringify());
            assertEquals("1000000000000000000000", num(1e21).stringify());
        }

        @Test
        @DisplayName("numbers use the shortest digits that read back")
        void shortestDigits() {
            assertEquals("100000000000000000000000", num(1e23).stringify());
            assertEquals("200000000000000000000000", num(2e23).stringify());
            assertEquals("0.30000000000000004",
                    num(0.1 + 0.2).stringify());
            assertEquals("0." + "0".repeat(323) + "5",
                    num(Double.MIN_VALUE).stringify());
        }

        @Test
        void scalars() {
            assertEquals("true", Value.bool(true).stringify());
            assertEquals("false", Value.bool(false).stringify());
            assertEquals("nil", Value.NIL.stringify());
        }

        @Test
        void strings() {
            assertEquals("hello", str("hello").stringify());
        }

        @Test
        void closures() {
            assertEquals("<fn counter>", closure("counter").stringify());
        }

        @Test
        @DisplayName("upvalues show what they hold")
        void upvalues() {
            assertEquals("42",
                    Value.upvaluePtr(stored(num(42))).stringify());
            SharedCell<Value> cell = values.share(str("open"));
            Value open = new Value.OpenUpvalue(cell);
            assertEquals("open", open.stringify());
            cell.set(Value.bool(true));
            assertEquals("true", open.stringify());
        }

        @Test
        @DisplayName("UpvaluePtr to an OpenUpvalue takes two hops")
        void ptrToOpen() {
            Value open = new Value.OpenUpvalue(values.share(num(5)));
            assertEquals("5", Value.upvaluePtr(stored(open)).stringify());
        }
    }

    @Nested
    @DisplayName("Run-time equality")
    class Equality {

        @Test
        void scalarsByValue() {
            assertTrue(num(1.5).isEqual(num(1.5)));
            assertFalse(num(1.5).isEqual(num(2)));
            assertTrue(Value.bool(true).isEqual(Value.bool(true)));
            assertFalse(Value.bool(true).isEqual(Value.bool(false)));
            assertTrue(Value.NIL.isEqual(Value.NIL));
        }

        @Test
        @DisplayName("numbers compare as IEEE-754")
        void ieee() {
            assertFalse(num(Double.NaN).isEqual(num(Double.NaN)));
            assertTrue(num(0.0).isEqual(num(-0.0)));
        }

        @Test
        void stringsByContent() {
            assertTrue(str("abc").isEqual(str("abc")));
            assertFalse(str("abc").isEqual(str("abd")));
            // Same text interned in another table
            StringTable other = new StringTable();
            assertTrue(str("abc")
                    .isEqual(Value.string(other.intern("abc"))));
        }

        @Test
        @DisplayName("variants never equal each other")
        void mixedVariants() {
            assertFalse(num(0).isEqual(Value.bool(false)));
            assertFalse(Value.NIL.isEqual(Value.bool(false)));
            assertFalse(str("1").isEqual(num(1)));
        }

        @Test
        @DisplayName("reference variants are never equal")
        void referenceVariants() {
            Value.Closure c = closure("f");
            assertFalse(c.isEqual(c));
            assertFalse(c.isEqual(new Value.Closure(c.functionHandle(),
                    c.upvalues())));

            GcWeakMut<Value> ref = stored(num(1));
            Value p = Value.upvaluePtr(ref);
            assertFalse(p.isEqual(p));
            assertFalse(p.isEqual(Value.upvaluePtr(ref)));
            assertFalse(p.isEqual(num(1)));
            assertFalse(num(1).isEqual(p));

            Value open = new Value.OpenUpvalue(values.share(num(1)));
            assertFalse(open.isEqual(open));
            assertFalse(num(1).isEqual(open));
        }
    }

    @Nested
    @DisplayName("updateNumber")
    class UpdateNumber {

        /** A simple cell not in any heap (like a stack slot). */
        Cell<Value> slot(Value v) {
            Value[] stack = {v};
            return new Frame(stack).localCell(0);
        }

        @Test
        void numberIsReplaced() {
            Cell<Value> home = slot(num(1));
            assertTrue(home.get().updateNumber(home, 2));
            assertEquals(num(2), home.get());
        }

        @Test
        @DisplayName("tunnels through UpvaluePtr to the storage")
        void throughPointer() {
            GcWeakMut<Value> storage = stored(num(1));
            Cell<Value> home = slot(Value.upvaluePtr(storage));
            Value ptr = home.get();
            assertTrue(ptr.updateNumber(home, 9));
            // The pointer stays, the storage changes
            assertSame(ptr, home.get());
            assertEquals(num(9), storage.upgrade().get());
        }

        @Test
        @DisplayName("tunnels through a chain of UpvaluePtrs")
        void throughChain() {
            GcWeakMut<Value> mid = stored(Value.NIL);
            Cell<Value> home = slot(Value.upvaluePtr(mid));
            // A later write makes the middle storage a pointer too
            GcWeakMut<Value> terminal = stored(num(1));
            Value inner = Value.upvaluePtr(terminal);
            mid.upgrade().set(inner);
            assertTrue(home.get().updateNumber(home, 7));
            assertEquals(num(7), terminal.upgrade().get());
            assertSame(inner, mid.upgrade().get());
        }

        @Test
        @DisplayName("updateNumberIn starts from the cell content")
        void fromCell() {
            Cell<Value> home = slot(num(1));
            assertTrue(Value.updateNumberIn(home, 4));
            assertEquals(num(4), home.get());

            GcWeakMut<Value> storage = stored(num(1));
            Cell<Value> ptrHome = slot(Value.upvaluePtr(storage));
            Value ptr = ptrHome.get();
            assertTrue(Value.updateNumberIn(ptrHome, 5));
            assertSame(ptr, ptrHome.get());
            assertEquals(num(5), storage.upgrade().get());

            Cell<Value> boolHome = slot(Value.bool(false));
            assertFalse(Value.updateNumberIn(boolHome, 6));
            assertEquals(Value.bool(false), boolHome.get());
        }

        @Test
        @DisplayName("fails for every other variant without mutation")
        void otherVariantsFail() {
            List<Value> others = List.of(Value.bool(true), Value.NIL,
                    str("s"), closure("f"),
                    new Value.OpenUpvalue(values.share(num(1))));
            for (Value v : others) {
                Cell<Value> home = slot(v);
                assertFalse(v.updateNumber(home, 3), v::toString);
                assertSame(v, home.get());
            }
        }

        @Test
        @DisplayName("does not pass through an OpenUpvalue")
        void notThroughOpen() {
            SharedCell<Value> cell = values.share(num(1));
            GcWeakMut<Value> storage =
                    stored(new Value.OpenUpvalue(cell));
            Cell<Value> home = slot(Value.upvaluePtr(storage));
            assertFalse(home.get().updateNumber(home, 2));
            assertEquals(num(1), cell.get());
        }

        @Test
        @DisplayName("a pointer to a non-number fails")
        void pointerToBool() {
            GcWeakMut<Value> storage = stored(Value.bool(true));
            Cell<Value> home = slot(Value.upvaluePtr(storage));
            assertFalse(home.get().updateNumber(home, 2));
            assertEquals(Value.bool(true), storage.upgrade().get());
        }

        @Test
        @DisplayName("through a pointer whose storage was reclaimed is fatal")
        void reclaimed() {
            GcWeakMut<Value> storage = stored(num(1));
            Cell<Value> home = slot(Value.upvaluePtr(storage));
            values.reclaim(storage);
            assertThrows(InterpreterError.class,
                    () -> home.get().updateNumber(home, 2));
        }
    }

    @Nested
    @DisplayName("UpvaluePtr construction")
    class UpvaluePtrConstruction {

        @Test
        @DisplayName("rejects a referent that is an UpvaluePtr")
        void rejectsNested() {
            Value inner = Value.upvaluePtr(stored(num(1)));
            GcWeakMut<Value> outer = stored(inner);
            InterpreterError e = assertThrows(InterpreterError.class,
                    () -> Value.upvaluePtr(outer));
            assertThat(e.getMessage(), containsString("UpvaluePtr"));
        }

        @Test
        void acceptsOpenUpvalueReferent() {
            Value open = new Value.OpenUpvalue(values.share(num(1)));
            Value.UpvaluePtr p = Value.upvaluePtr(stored(open));
            assertSame(open, p.referent());
        }

        @Test
        void rejectsReclaimedReferent() {
            GcWeakMut<Value> storage = stored(num(1));
            values.reclaim(storage);
            assertThrows(InterpreterError.class,
                    () -> Value.upvaluePtr(storage));
        }

        @Test
        @DisplayName("no variant built by the factories nests pointers")
        void invariantHoldsForEveryReferent() {
            for (Value v : everyVariant()) {
                GcWeakMut<Value> ref = stored(v);
                if (v.isUpvaluePtr()) {
                    assertThrows(InterpreterError.class,
                            () -> Value.upvaluePtr(ref));
                } else {
                    assertFalse(Value.upvaluePtr(ref).referent()
                            .isUpvaluePtr());
                }
            }
        }
    }

    @Nested
    @DisplayName("Tracing for the collector")
    class Tracing {

        /** Records what a value reports. */
        class Recorder implements Tracer {
            final List<SharedCell<?>> owning = new ArrayList<>();
            final List<GcHandle<?>> weak = new ArrayList<>();

            @Override
            public void owning(SharedCell<?> cell) { owning.add(cell); }

            @Override
            public void weak(GcHandle<?> handle) { weak.add(handle); }
        }

        @Test
        void scalarsHoldNothing() {
            for (Value v : List.of(num(1), Value.bool(true), Value.NIL)) {
                Recorder r = new Recorder();
                v.trace(r);
                assertTrue(r.owning.isEmpty() && r.weak.isEmpty());
            }
        }

        @Test
        void closureHoldsOnlyWeak() {
            GcWeakMut<Value> u = stored(num(1));
            Value.Closure c =
                    new Value.Closure(function("f", 0), List.of(u));
            Recorder r = new Recorder();
            c.trace(r);
            assertTrue(r.owning.isEmpty());
            assertEquals(List.of(c.functionHandle(), u), r.weak);
        }

        @Test
        void openUpvalueOwnsItsCell() {
            SharedCell<Value> cell = values.share(num(1));
            Recorder r = new Recorder();
            new Value.OpenUpvalue(cell).trace(r);
            assertEquals(List.of(cell), r.owning);
            assertTrue(r.weak.isEmpty());
        }

        @Test
        void pointerAndStringAreWeak() {
            GcWeakMut<Value> ref = stored(num(1));
            Recorder r = new Recorder();
            Value.upvaluePtr(ref).trace(r);
            str("s").trace(r);
            assertTrue(r.owning.isEmpty());
            assertThat(r.weak.size(), is(2));
            assertEquals(ref, r.weak.get(0));
        }
    }

    @Test
    @DisplayName("toString names the variant")
    void debugRendering() {
        assertEquals("Number(1.5)", num(1.5).toString());
        assertEquals("Bool(true)", Value.bool(true).toString());
        assertEquals("Nil", Value.NIL.toString());
        assertEquals("Str(\"x\")", str("x").toString());
        assertEquals("Closure(<fn f>, 0 upvalues)",
                closure("f").toString());
        assertThat(Value.upvaluePtr(stored(num(1))).toString(),
                containsString("UpvaluePtr("));
        assertEquals("OpenUpvalue(Number(2.0))",
                new Value.OpenUpvalue(values.share(num(2))).toString());
    }
}
