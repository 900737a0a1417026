// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vslox.runtime;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.vslox.heap.GcWeak;
import uk.co.farowl.vslox.heap.GcWeakMut;
import uk.co.farowl.vslox.heap.Heap;
import uk.co.farowl.vslox.heap.SharedCell;
import uk.co.farowl.vslox.support.InterpreterError;

/**
 * Creation of {@link Value.Closure} values, resolving the compiler's
 * {@link Upvalue} descriptors against the frame in which the closure is
 * made.
 */
public final class Closures {

    /** Logger for closure creation. */
    static final Logger logger = LoggerFactory.getLogger(Closures.class);

    private Closures() {} // no instances

    /**
     * Make a closure over a function. For each descriptor in turn:
     * <ul>
     * <li>a local of {@code frame} is captured by a handle to its
     * {@link Value.OpenUpvalue OpenUpvalue} cell, which is created (and
     * left in the slot) the first time that local is captured;</li>
     * <li>a variable of the enclosing closure is captured by copying
     * the handle that closure holds, without resolving it again.</li>
     * </ul>
     * The closure's captured variables are in descriptor order.
     *
     * @param function to close over
     * @param descriptors of the captured variables, in order
     * @param frame in which the closure is being made
     * @param heap in which to allocate new open upvalue cells
     * @return the new closure
     * @throws InterpreterError if a descriptor does not match the frame
     *     or its closure
     */
    public static Value.Closure capture(GcWeak<Function> function,
            List<Upvalue> descriptors, Frame frame, Heap<Value> heap)
            throws InterpreterError {
        List<GcWeakMut<Value>> captured =
                new ArrayList<>(descriptors.size());
        for (Upvalue u : descriptors) {
            if (u.isLocal()) {
                captured.add(captureLocal(frame, u.index(), heap));
            } else {
                Value.Closure enclosing = frame.closure();
                InterpreterError.check(enclosing != null,
                        "non-local upvalue %d captured at top level",
                        u.index());
                captured.add(enclosing.upvalue(u.index()));
            }
        }
        Value.Closure closure = new Value.Closure(function, captured);
        logger.atDebug().setMessage("Created {}").addArgument(closure)
                .log();
        return closure;
    }

    /**
     * Return a handle to the storage of a local, converting the slot to
     * an open upvalue if this is the first capture.
     */
    private static GcWeakMut<Value> captureLocal(Frame frame, int index,
            Heap<Value> heap) {
        Value v = frame.local(index);
        if (v instanceof Value.OpenUpvalue open) {
            return open.cell().downgrade();
        } else if (v instanceof Value.UpvaluePtr ptr) {
            // Already promoted: share the storage it refers to.
            return ptr.ref();
        } else {
            SharedCell<Value> cell = heap.share(v);
            frame.setLocal(index, new Value.OpenUpvalue(cell));
            logger.atDebug().setMessage("Local {} opened as {}")
                    .addArgument(index).addArgument(cell).log();
            return cell.downgrade();
        }
    }
}
