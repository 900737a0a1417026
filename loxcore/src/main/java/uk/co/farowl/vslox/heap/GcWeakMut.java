// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vslox.heap;

import uk.co.farowl.vslox.support.InterpreterError;

/**
 * A non-owning handle giving read and write access to an object in a
 * {@link Heap}. A closure refers to each variable it captures this way,
 * and so does a closed upvalue.
 *
 * @param <T> type of object in the heap
 */
public final class GcWeakMut<T> extends GcHandle<T> {

    GcWeakMut(Heap<T> heap, int index, int generation) {
        super(heap, index, generation);
    }

    /**
     * Return a {@link Cell} through which the referent may be read or
     * replaced. The cell addresses the heap slot, not a copy, so a
     * write through it is seen by every other holder of the slot.
     *
     * @return view of the slot as a cell
     * @throws InterpreterError if the referent has been reclaimed
     */
    public Cell<T> upgrade() throws InterpreterError {
        // Fail now, not at first use, if already reclaimed.
        heap.get(index, generation);
        return new SlotCell();
    }

    /**
     * A read-only handle to the same slot.
     *
     * @return read-only handle
     */
    public GcWeak<T> readOnly() {
        return new GcWeak<>(heap, index, generation);
    }

    @Override
    String kind() { return "weak-mut"; }

    /** Temporary access to the slot of the enclosing handle. */
    private class SlotCell implements Cell<T> {

        @Override
        public T get() { return heap.get(index, generation); }

        @Override
        public void set(T value) { heap.set(index, generation, value); }

        @Override
        public String toString() { return GcWeakMut.this.toString(); }
    }
}
