package org.lsmkv.core.sstable;

import java.util.Optional;

/**
 * Outcome of a point lookup in one file. A tombstone is reported separately
 * from absence so callers can stop searching older files.
 */
public class LookupResult {

    public enum Status { FOUND, DELETED, ABSENT }

    private static final LookupResult ABSENT = new LookupResult(Status.ABSENT, null);
    private static final LookupResult DELETED = new LookupResult(Status.DELETED, null);

    private final Status status;
    private final byte[] value;

    private LookupResult(Status status, byte[] value) {
        this.status = status;
        this.value = value;
    }

    public static LookupResult found(byte[] value) {
        return new LookupResult(Status.FOUND, value);
    }

    public static LookupResult deleted() {
        return DELETED;
    }

    public static LookupResult absent() {
        return ABSENT;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }

    public Optional<byte[]> getValue() {
        return Optional.ofNullable(value);
    }
}
