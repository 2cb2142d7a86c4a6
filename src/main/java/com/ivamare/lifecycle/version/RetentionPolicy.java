package com.ivamare.lifecycle.version;

/**
 * What a ledger does when an entity already holds the maximum number of versions.
 */
public enum RetentionPolicy {
    /** Refuse the new draft */
    REJECT,

    /** Drop the lowest-numbered version that is neither published nor the latest */
    EVICT_OLDEST
}
