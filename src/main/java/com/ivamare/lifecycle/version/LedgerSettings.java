package com.ivamare.lifecycle.version;

/**
 * Per-family ledger configuration.
 *
 * @param family Entity family served by the ledger
 * @param retentionLimit Maximum versions kept per entity; 0 means unlimited
 * @param retentionPolicy Behaviour once the limit is reached
 */
public record LedgerSettings(
    EntityFamily family,
    int retentionLimit,
    RetentionPolicy retentionPolicy
) {
    public LedgerSettings {
        if (family == null) {
            throw new IllegalArgumentException("Entity family is required");
        }
        if (retentionLimit < 0) {
            throw new IllegalArgumentException("Retention limit must not be negative: " + retentionLimit);
        }
        retentionPolicy = retentionPolicy != null ? retentionPolicy : RetentionPolicy.REJECT;
    }

    public static LedgerSettings unlimited(EntityFamily family) {
        return new LedgerSettings(family, 0, RetentionPolicy.REJECT);
    }

    public boolean isBounded() {
        return retentionLimit > 0;
    }
}
