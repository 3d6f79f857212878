package com.example.demo.shortcuts.model;

import java.util.Locale;

/**
 * Emission policy of a template's include.
 */
public enum TemplateOnly {
    /**
     * Always emitted (no templateonly attribute)
     */
    NONE,
    /**
     * templateonly="true": built for its variables only, the include is never emitted
     */
    ALWAYS,
    /**
     * templateonly="auto": emitted only when some menu item references the include
     */
    AUTO;

    public static TemplateOnly fromValue(String value) {
        if (value == null) {
            return NONE;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true":
                return ALWAYS;
            case "auto":
                return AUTO;
            default:
                return NONE;
        }
    }
}
