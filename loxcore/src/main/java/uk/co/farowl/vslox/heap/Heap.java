// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vslox.heap;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import uk.co.farowl.vslox.support.InterpreterError;

/**
 * An arena of generation-tagged slots, standing for the storage a
 * collector owns. Non-owning references into the arena are
 * {@link GcWeak} and {@link GcWeakMut} handles: a slot index and the
 * generation the slot had when the handle was made. When a slot is
 * reclaimed its generation advances, so every outstanding handle to it
 * fails to upgrade, even after the slot is reused.
 * <p>
 * A slot is owned either by the collector ({@link #allocate(Object)},
 * {@link #allocateMut(Object)}, {@link #adopt(SharedCell)}), in which
 * case only {@link #reclaim(GcHandle)} frees it, or by the holders of a
 * {@link SharedCell} ({@link #share(Object)}), in which case it is freed
 * when the last holder releases it.
 * <p>
 * The heap decides nothing about <i>when</i> to reclaim: that is for
 * the collector that drives it.
 *
 * @param <T> type of object stored
 */
public final class Heap<T> {

    /** Logger for heap activity. */
    static final Logger logger = LoggerFactory.getLogger(Heap.class);

    /** System property giving the default initial capacity. */
    public static final String CAPACITY_PROPERTY =
            "uk.co.farowl.vslox.heap.capacity";

    /** System property that raises allocation logging to DEBUG. */
    public static final String TRACE_PROPERTY =
            "uk.co.farowl.vslox.heap.trace";

    /** Initial number of slots reserved when not specified. */
    static final int DEFAULT_CAPACITY =
            Integer.getInteger(CAPACITY_PROPERTY, 64);

    /** Level at which allocation and reclamation are logged. */
    private static final Level ACTIVITY_LEVEL =
            Boolean.getBoolean(TRACE_PROPERTY) ? Level.DEBUG
                    : Level.TRACE;

    /** Who keeps a slot alive. */
    private enum Owner { FREE, COLLECTOR, SHARED }

    /** One slot of the arena. */
    private static final class Slot<T> {
        T value;
        int generation;
        Owner owner = Owner.FREE;
        /** Holders of the slot when {@code owner == SHARED}. */
        int holders;
    }

    /** Name of this heap, used in messages. */
    private final String name;

    private final List<Slot<T>> slots;

    /** Indices of free slots, most recently freed first. */
    private final Deque<Integer> free = new ArrayDeque<>();

    /** Number of slots not free. */
    private int live;

    /**
     * Create a heap with the default initial capacity.
     *
     * @param name of the heap for messages
     */
    public Heap(String name) { this(name, DEFAULT_CAPACITY); }

    /**
     * Create a heap with a given initial capacity.
     *
     * @param name of the heap for messages
     * @param capacity initial number of slots to reserve
     */
    public Heap(String name, int capacity) {
        this.name = name;
        this.slots = new ArrayList<>(Math.max(capacity, 0));
        logger.atDebug().setMessage("Heap '{}' created (capacity {})")
                .addArgument(name).addArgument(capacity).log();
    }

    /** @return the name of this heap */
    public String getName() { return name; }

    /**
     * Store an object owned by the collector, and return a read-only
     * handle to it.
     *
     * @param value to store
     * @return handle to the stored object
     */
    public GcWeak<T> allocate(T value) {
        int i = claim(value, Owner.COLLECTOR);
        return new GcWeak<>(this, i, slots.get(i).generation);
    }

    /**
     * Store an object owned by the collector, and return a handle
     * through which it may be read and replaced.
     *
     * @param value to store
     * @return handle to the stored object
     */
    public GcWeakMut<T> allocateMut(T value) {
        int i = claim(value, Owner.COLLECTOR);
        return new GcWeakMut<>(this, i, slots.get(i).generation);
    }

    /**
     * Store an object in a reference-counted cell with a single holder
     * (the caller).
     *
     * @param value initial content
     * @return the owning cell
     */
    public SharedCell<T> share(T value) {
        int i = claim(value, Owner.SHARED);
        Slot<T> slot = slots.get(i);
        slot.holders = 1;
        return new SharedCell<>(this, i, slot.generation);
    }

    /**
     * Transfer ownership of a shared cell to the collector. The content
     * and the slot are unchanged, so that every handle obtained from
     * {@link SharedCell#downgrade()} continues to resolve to it. The
     * holders may go on to release the cell without the slot being
     * reclaimed.
     *
     * @param cell to adopt
     * @return a handle to the (now collector-owned) storage
     * @throws InterpreterError if the cell is from another heap or has
     *     been reclaimed
     */
    public GcWeakMut<T> adopt(SharedCell<T> cell)
            throws InterpreterError {
        InterpreterError.check(cell.heap() == this,
                "cell %s does not belong to heap '%s'", cell, name);
        Slot<T> slot = liveSlot(cell.index(), cell.generation());
        if (slot.owner == Owner.SHARED) {
            slot.owner = Owner.COLLECTOR;
            logger.atLevel(ACTIVITY_LEVEL)
                    .setMessage("Heap '{}' adopted slot {}")
                    .addArgument(name).addArgument(cell.index()).log();
        }
        return cell.downgrade();
    }

    /**
     * Free a slot owned by the collector. Every handle to it will fail
     * to upgrade from now on.
     *
     * @param handle to the slot to free
     * @throws InterpreterError if the handle is from another heap, is
     *     stale, or designates a cell that still has holders
     */
    public void reclaim(GcHandle<T> handle) throws InterpreterError {
        InterpreterError.check(handle.heap == this,
                "%s does not belong to heap '%s'", handle, name);
        Slot<T> slot = liveSlot(handle.index, handle.generation);
        InterpreterError.check(slot.owner == Owner.COLLECTOR,
                "cannot reclaim %s: still shared by %d holder(s)",
                handle, slot.holders);
        free(handle.index, slot);
    }

    /** @return number of slots currently holding an object */
    public int liveCount() { return live; }

    /** @return number of slots ever created (free or not) */
    public int capacity() { return slots.size(); }

    @Override
    public String toString() {
        return String.format("Heap('%s', live=%d, capacity=%d)", name,
                live, slots.size());
    }

    // Slot access for handles and cells ------------------------------

    boolean isLive(int index, int generation) {
        if (index < 0 || index >= slots.size()) { return false; }
        Slot<T> slot = slots.get(index);
        return slot.owner != Owner.FREE && slot.generation == generation;
    }

    T get(int index, int generation) throws InterpreterError {
        return liveSlot(index, generation).value;
    }

    void set(int index, int generation, T value)
            throws InterpreterError {
        liveSlot(index, generation).value = value;
    }

    void retain(int index, int generation) throws InterpreterError {
        Slot<T> slot = liveSlot(index, generation);
        slot.holders += 1;
    }

    void release(int index, int generation) throws InterpreterError {
        Slot<T> slot = liveSlot(index, generation);
        InterpreterError.check(slot.holders > 0,
                "release of slot %d in heap '%s' without holders",
                index, name);
        if (--slot.holders == 0 && slot.owner == Owner.SHARED) {
            free(index, slot);
        }
    }

    int holders(int index, int generation) throws InterpreterError {
        return liveSlot(index, generation).holders;
    }

    // Plumbing -------------------------------------------------------

    private Slot<T> liveSlot(int index, int generation)
            throws InterpreterError {
        if (!isLive(index, generation)) {
            throw new InterpreterError(
                    "upgrade of reclaimed slot %d (generation %d) in heap '%s'",
                    index, generation, name);
        }
        return slots.get(index);
    }

    private int claim(T value, Owner owner) {
        int i;
        Slot<T> slot;
        Integer f = free.poll();
        if (f != null) {
            i = f;
            slot = slots.get(i);
        } else {
            i = slots.size();
            slot = new Slot<>();
            slots.add(slot);
        }
        slot.value = value;
        slot.owner = owner;
        slot.holders = 0;
        live += 1;
        logger.atLevel(ACTIVITY_LEVEL)
                .setMessage("Heap '{}' slot {}.{} allocated ({})")
                .addArgument(name).addArgument(i)
                .addArgument(slot.generation).addArgument(owner).log();
        return i;
    }

    private void free(int index, Slot<T> slot) {
        logger.atLevel(ACTIVITY_LEVEL)
                .setMessage("Heap '{}' slot {}.{} reclaimed")
                .addArgument(name).addArgument(index)
                .addArgument(slot.generation).log();
        slot.value = null;
        slot.owner = Owner.FREE;
        slot.holders = 0;
        slot.generation += 1;
        live -= 1;
        free.push(index);
    }
}
