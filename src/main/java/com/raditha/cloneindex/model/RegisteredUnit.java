package com.raditha.cloneindex.model;

/**
 * A record together with the unit whose token signature it was built from.
 * This is what the search services iterate over.
 *
 * @param record Registered record
 * @param unit   Source unit carrying the structural tokens
 */
public record RegisteredUnit(CodeRecord record, CodeUnit unit) {

    public RegisteredUnit {
        if (record == null || unit == null) {
            throw new IllegalArgumentException("record and unit are required");
        }
    }

    public String contentHash() {
        return record.contentHash();
    }

    /**
     * Self-match check: same identity, or the same file and start line.
     */
    public boolean sameCodeAs(RegisteredUnit other) {
        return contentHash().equals(other.contentHash())
                || record.location().sameStart(other.record.location());
    }
}
