package com.ivamare.lifecycle.version;

import java.util.Locale;

/**
 * Entity families sharing the lifecycle engine. Each family owns one version ledger.
 */
public enum EntityFamily {
    CONTENT("content"),
    PAGE("page"),
    BLOCK("block");

    private final String key;

    EntityFamily(String key) {
        this.key = key;
    }

    /**
     * Canonical key, also the default workflow entity type of the family.
     */
    public String key() {
        return key;
    }

    public static EntityFamily fromKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Entity family is required");
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (EntityFamily family : values()) {
            if (family.key.equals(normalized)) {
                return family;
            }
        }
        throw new IllegalArgumentException("Unknown entity family: " + key);
    }
}
