/*
    SPDX-FileCopyrightText: 2026 The LineageOS Project
    SPDX-License-Identifier: Apache-2.0
*/

package org.lineageos.exprcalc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A function defined by the user, e.g. {@code f(x, y) = x^2 + y}.
 * The body is parsed once, when the function is defined, and the tree is
 * kept alongside the text it came from.
 */
public final class UserFunction {
    private final String mName;
    private final List<String> mParams;
    private final String mBodyText;
    private final ExprNode mBody;

    UserFunction(String name, List<String> params, String bodyText, ExprNode body) {
        mName = Objects.requireNonNull(name);
        mParams = Collections.unmodifiableList(new ArrayList<>(params));
        mBodyText = Objects.requireNonNull(bodyText);
        mBody = Objects.requireNonNull(body);
    }

    public String getName() {
        return mName;
    }

    public List<String> getParams() {
        return mParams;
    }

    public int getArity() {
        return mParams.size();
    }

    public String getBodyText() {
        return mBodyText;
    }

    public ExprNode getBody() {
        return mBody;
    }

    @Override
    public String toString() {
        return mName + "(" + String.join(", ", mParams) + ") = " + mBodyText;
    }
}
