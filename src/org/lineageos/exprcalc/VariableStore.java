/*
    SPDX-FileCopyrightText: 2026 The LineageOS Project
    SPDX-License-Identifier: Apache-2.0
*/

package org.lineageos.exprcalc;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Named numeric values visible to expressions.
 * <p>
 * Each session owns its own store and hands it to the contexts it
 * creates; there is no shared instance.  Not thread-safe.
 */
public class VariableStore {
    private final Map<String, Double> mValues = new LinkedHashMap<>();

    public VariableStore() {
    }

    public VariableStore(Map<String, Double> initial) {
        for (Map.Entry<String, Double> e : initial.entrySet()) {
            set(e.getKey(), e.getValue());
        }
    }

    /**
     * Bind name to value, replacing any previous binding.
     *
     * @throws IllegalArgumentException if name is not an identifier or
     *         names a built-in constant or function
     */
    public void set(String name, double value) {
        if (!Symbols.isIdentifier(name)) {
            throw new IllegalArgumentException("Invalid variable name: " + name);
        }
        if (Symbols.isConstant(name)) {
            throw new IllegalArgumentException("Cannot overwrite built-in constant: " + name);
        }
        if (BuiltinFunctions.isBuiltin(name)) {
            // The tokenizer always reads such a name as the function.
            throw new IllegalArgumentException("Cannot shadow built-in function: " + name);
        }
        mValues.put(name, value);
    }

    // Value bound to name, or null.
    public Double get(String name) {
        return mValues.get(name);
    }

    public boolean contains(String name) {
        return mValues.containsKey(name);
    }

    public boolean remove(String name) {
        return mValues.remove(name) != null;
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(mValues.keySet());
    }

    public int size() {
        return mValues.size();
    }

    public void clear() {
        mValues.clear();
    }
}
