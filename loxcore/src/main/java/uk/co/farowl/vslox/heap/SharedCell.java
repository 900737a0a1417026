// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vslox.heap;

import uk.co.farowl.vslox.support.InterpreterError;

/**
 * An owning, reference-counted cell in a {@link Heap}. This is the
 * storage of a local variable that has been captured by a closure
 * while the frame that declared it is still live (an "open" upvalue).
 * Each holder that {@link #share() shares} the cell must eventually
 * {@link #release() release} it, and when the last does so the slot is
 * reclaimed, unless the collector has {@link Heap#adopt(SharedCell)
 * adopted} it in the meantime.
 * <p>
 * Closures do not hold a {@code SharedCell}: they hold the
 * {@link GcWeakMut} obtained from {@link #downgrade()}, which resolves
 * to the same slot.
 *
 * @param <T> type of object held
 */
public final class SharedCell<T> implements Cell<T> {

    private final Heap<T> heap;
    private final int index;
    private final int generation;

    SharedCell(Heap<T> heap, int index, int generation) {
        this.heap = heap;
        this.index = index;
        this.generation = generation;
    }

    @Override
    public T get() { return heap.get(index, generation); }

    @Override
    public void set(T value) { heap.set(index, generation, value); }

    /**
     * Add a holder to the cell.
     *
     * @return this cell
     * @throws InterpreterError if the cell has been reclaimed
     */
    public SharedCell<T> share() throws InterpreterError {
        heap.retain(index, generation);
        return this;
    }

    /**
     * Remove a holder from the cell. When no holders remain the slot is
     * reclaimed (unless adopted by the collector).
     *
     * @throws InterpreterError if there were no holders to remove
     */
    public void release() throws InterpreterError {
        heap.release(index, generation);
    }

    /**
     * Number of holders currently sharing the cell.
     *
     * @return count of holders
     */
    public int holders() { return heap.holders(index, generation); }

    /**
     * Create a non-owning handle to this cell's storage.
     *
     * @return weak handle to the slot
     */
    public GcWeakMut<T> downgrade() {
        return new GcWeakMut<>(heap, index, generation);
    }

    /**
     * Whether the cell is still present in its heap.
     *
     * @return {@code true} iff not reclaimed
     */
    public boolean isLive() { return heap.isLive(index, generation); }

    Heap<T> heap() { return heap; }

    int index() { return index; }

    int generation() { return generation; }

    @Override
    public String toString() {
        return String.format("<cell %s#%d.%d>", heap.getName(), index,
                generation);
    }
}
