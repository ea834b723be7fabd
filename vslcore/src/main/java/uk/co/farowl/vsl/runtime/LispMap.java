// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * The Lisp map, written in braces. Keys are {@link LispString}s or
 * {@link LispKeyword}s: since these are distinct classes with
 * value-based {@code equals}, the string {@code "a"} and the keyword
 * {@code :a} are different keys. Entries iterate in insertion order, but
 * equality of maps does not depend on it.
 * <p>
 * A map is immutable: {@link #assoc(LispObject...)} and
 * {@link #dissoc(LispObject...)} return new maps.
 */
public final class LispMap implements LispObject {

    /** Convenient constant for a map with no entries. */
    public static final LispMap EMPTY =
            new LispMap(Collections.emptyMap());

    /** The entries, never modified once construction completes. */
    private final Map<LispObject, LispObject> map;

    private LispMap(Map<LispObject, LispObject> map) { this.map = map; }

    /**
     * Build a map from alternate keys and values.
     *
     * @param kvs keys and values alternately
     * @return the new map
     * @throws TypeMismatchError if there are an odd number of elements
     *     or a key is not a string or keyword
     */
    public static LispMap fromPairs(LispObject... kvs)
            throws TypeMismatchError {
        return EMPTY.assoc(kvs);
    }

    /**
     * Check that a value may be used as a key.
     *
     * @param key proposed key
     * @return {@code key}
     * @throws TypeMismatchError if it is not a string or keyword
     */
    static LispObject checkKey(LispObject key) throws TypeMismatchError {
        if (key instanceof LispString || key instanceof LispKeyword) {
            return key;
        }
        throw new TypeMismatchError(
                "map key must be a string or keyword, not %s",
                key.getType());
    }

    /**
     * Return a map with the entries of this one, and additionally the
     * given keys bound to the given values, replacing any existing
     * entries for those keys.
     *
     * @param kvs keys and values alternately
     * @return the new map
     * @throws TypeMismatchError if there are an odd number of elements
     *     or a key is not a string or keyword
     */
    public LispMap assoc(LispObject... kvs) throws TypeMismatchError {
        if (kvs.length % 2 != 0) {
            throw new TypeMismatchError(
                    "map needs an even number of keys and values (%d given)",
                    kvs.length);
        }
        Map<LispObject, LispObject> m = new LinkedHashMap<>(map);
        for (int i = 0; i < kvs.length; i += 2) {
            m.put(checkKey(kvs[i]), kvs[i + 1]);
        }
        return new LispMap(m);
    }

    /**
     * Return a map with the entries of this one, except for the given
     * keys. Keys not present are ignored.
     *
     * @param keys to remove
     * @return the new map
     */
    public LispMap dissoc(LispObject... keys) {
        Map<LispObject, LispObject> m = new LinkedHashMap<>(map);
        for (LispObject k : keys) { m.remove(k); }
        return new LispMap(m);
    }

    /**
     * Return a map with the same keys as this one, and the values
     * replaced by the result of a function of each value.
     *
     * @param f the function
     * @return the new map
     */
    LispMap mapValues(UnaryOperator<LispObject> f) {
        Map<LispObject, LispObject> m = new LinkedHashMap<>();
        for (Map.Entry<LispObject, LispObject> e : map.entrySet()) {
            m.put(e.getKey(), f.apply(e.getValue()));
        }
        return new LispMap(m);
    }

    /**
     * Return the value bound to a key.
     *
     * @param key to look up
     * @return the value or {@code null} if the key is not present
     */
    public LispObject get(LispObject key) { return map.get(key); }

    /**
     * @param key to look up
     * @return whether the key is present
     */
    public boolean containsKey(LispObject key) {
        return map.containsKey(key);
    }

    /** @return number of entries */
    public int size() { return map.size(); }

    /** @return the keys in insertion order */
    public LispList keys() { return LispList.from(map.keySet()); }

    /** @return the values in the insertion order of their keys */
    public LispList vals() { return LispList.from(map.values()); }

    /** @return a read-only view of the entries */
    public Set<Map.Entry<LispObject, LispObject>> entrySet() {
        return Collections.unmodifiableMap(map).entrySet();
    }

    @Override
    public LispType getType() { return LispType.MAP; }

    @Override
    public boolean equals(Object other) {
        return other instanceof LispObject o
                && Comparison.equal(this, o);
    }

    @Override
    public int hashCode() { return map.hashCode(); }

    @Override
    public String toString() { return Printer.print(this, true); }
}
