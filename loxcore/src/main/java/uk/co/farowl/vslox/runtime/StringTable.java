// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vslox.runtime;

import java.util.HashMap;
import java.util.Map;

import uk.co.farowl.vslox.heap.Heap;

/**
 * The table of interned strings. Each distinct text is stored once, in
 * a {@link Heap} owned by the table, and every request to intern that
 * text returns the same {@link InternedString}. Entries are never
 * evicted.
 */
public final class StringTable {

    private final Heap<String> heap;
    private final Map<String, InternedString> table = new HashMap<>();

    /** Create an empty table with its own heap. */
    public StringTable() { this(new Heap<>("strings")); }

    /**
     * Create an empty table storing its text in the given heap.
     *
     * @param heap to hold the text
     */
    public StringTable(Heap<String> heap) { this.heap = heap; }

    /**
     * Return the handle for the given text, adding it to the table if
     * it is not already present.
     *
     * @param text to intern
     * @return the one handle for that text
     */
    public InternedString intern(String text) {
        return table.computeIfAbsent(text,
                t -> new InternedString(heap.allocate(t)));
    }

    /** @return number of distinct strings interned */
    public int size() { return table.size(); }

    /** @return the heap holding the text */
    public Heap<String> heap() { return heap; }
}
