/*
    SPDX-FileCopyrightText: 2026 The LineageOS Project
    SPDX-License-Identifier: Apache-2.0
*/

package org.lineageos.exprcalc;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * User-defined functions visible to expressions.
 * <p>
 * Bodies may mention functions that are not defined yet; names are only
 * resolved when a call is evaluated.  Like {@link VariableStore}, each
 * session owns its instance.  Not thread-safe.
 */
public class FunctionStore {
    private static final Logger LOG = LoggerFactory.getLogger(FunctionStore.class);

    private final Map<String, UserFunction> mFunctions = new LinkedHashMap<>();

    /**
     * Define or redefine a function.
     *
     * @param name function name; may not shadow a built-in function or constant
     * @param params parameter names, distinct identifiers
     * @param bodyText expression over the parameters (and any variables)
     * @return the stored definition
     * @throws IllegalArgumentException for a bad name or parameter list
     * @throws SyntaxException if the body does not parse
     */
    public UserFunction define(String name, List<String> params, String bodyText) {
        if (!Symbols.isIdentifier(name)) {
            throw new IllegalArgumentException("Invalid function name: " + name);
        }
        if (BuiltinFunctions.isBuiltin(name)) {
            throw new IllegalArgumentException("Cannot overwrite built-in function: " + name);
        }
        if (Symbols.isConstant(name)) {
            throw new IllegalArgumentException("Cannot overwrite built-in constant: " + name);
        }
        Set<String> seen = new HashSet<>();
        for (String param : params) {
            if (!Symbols.isIdentifier(param) || Symbols.isConstant(param)
                    || BuiltinFunctions.isBuiltin(param)) {
                throw new IllegalArgumentException("Invalid parameter name: " + param);
            }
            if (!seen.add(param)) {
                throw new IllegalArgumentException("Duplicate parameter name: " + param);
            }
        }
        ExprNode body = Parser.parse(bodyText);
        UserFunction fn = new UserFunction(name, params, bodyText, body);
        if (mFunctions.put(name, fn) != null) {
            LOG.debug("Redefined {}", fn);
        } else {
            LOG.debug("Defined {}", fn);
        }
        return fn;
    }

    // Definition for name, or null.
    public UserFunction get(String name) {
        return mFunctions.get(name);
    }

    public boolean contains(String name) {
        return mFunctions.containsKey(name);
    }

    public boolean remove(String name) {
        return mFunctions.remove(name) != null;
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(mFunctions.keySet());
    }

    public int size() {
        return mFunctions.size();
    }

    public void clear() {
        mFunctions.clear();
    }
}
