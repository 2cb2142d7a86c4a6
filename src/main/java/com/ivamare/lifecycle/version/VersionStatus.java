package com.ivamare.lifecycle.version;

import java.util.Locale;

/**
 * Status of a version record.
 */
public enum VersionStatus {
    /** Awaiting publication */
    DRAFT,

    /** The single live version of an entity */
    PUBLISHED,

    /** Previously published, since superseded */
    ARCHIVED;

    /**
     * Lower-case label matching the workflow state of the same name.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
