/*
    SPDX-FileCopyrightText: 2026 The LineageOS Project
    SPDX-License-Identifier: Apache-2.0
*/

package org.lineageos.exprcalc;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

// User-visible error strings, kept in res/ like the app's string resources.
// Lookups are not localized; the engine always reports in the root bundle.
final class Messages {
    private static final String BUNDLE = "org.lineageos.exprcalc.strings";
    private static final ResourceBundle sStrings =
            ResourceBundle.getBundle(BUNDLE, Locale.ROOT);

    private Messages() {
    }

    static String get(String key, Object... args) {
        String pattern;
        try {
            pattern = sStrings.getString(key);
        } catch (MissingResourceException e) {
            throw new IllegalStateException("Missing string resource: " + key, e);
        }
        if (args.length == 0) {
            return pattern;
        }
        return new MessageFormat(pattern, Locale.ROOT).format(args);
    }
}
