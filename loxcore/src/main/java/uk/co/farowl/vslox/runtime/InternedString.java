// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vslox.runtime;

import uk.co.farowl.vslox.heap.GcWeak;
import uk.co.farowl.vslox.support.InterpreterError;

/**
 * A handle to text stored once in a {@link StringTable}. The handle
 * does not own the text. Two handles are equal if their text is equal,
 * which for handles from the same table means they are the same entry.
 */
public final class InternedString {

    private final GcWeak<String> handle;

    InternedString(GcWeak<String> handle) { this.handle = handle; }

    /**
     * The text this handle refers to.
     *
     * @return the interned text
     * @throws InterpreterError if the table entry has been reclaimed
     */
    public String text() throws InterpreterError {
        return handle.upgrade();
    }

    /**
     * The non-owning handle into the string heap.
     *
     * @return the handle
     */
    public GcWeak<String> handle() { return handle; }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof InternedString s) {
            return handle.equals(s.handle) || text().equals(s.text());
        }
        return false;
    }

    @Override
    public int hashCode() { return text().hashCode(); }

    @Override
    public String toString() {
        return handle.isLive() ? text() : handle.toString();
    }
}
