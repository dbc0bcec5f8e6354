package com.drawpool.storage;

import java.util.Locale;

/** Visibility of an archived asset. */
public enum AssetAccess {
    PRIVATE,
    PUBLIC;

    /** Lower-case path segment used in storage locations. */
    public String segment() {
        return name().toLowerCase(Locale.ROOT);
    }
}
