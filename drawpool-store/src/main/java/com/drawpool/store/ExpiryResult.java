package com.drawpool.store;

/** Outcome of {@link JobStore#expire(DrawJob, String)}. */
public enum ExpiryResult {
    /** Another pass (or process) deleted the row first; nothing was credited. */
    ALREADY_REMOVED,
    /** Row deleted but the owning user no longer exists, so no credit and no log. */
    REMOVED_WITHOUT_REFUND,
    /** Row deleted, power credited back and a refund log appended. */
    REFUNDED
}
