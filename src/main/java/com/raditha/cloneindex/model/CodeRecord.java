package com.raditha.cloneindex.model;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Persisted identity of a registered code unit.
 * The fingerprint is attached at registration time and never changes
 * afterwards; only metadata may be enriched, which yields a new record.
 *
 * @param contentHash Content-addressed id (see {@link CodeUnit#contentHash()})
 * @param fingerprint 64-bit SimHash, unsigned semantics; null until computed
 * @param name        Unit name
 * @param kind        Unit kind
 * @param location    File and line range
 * @param createdAt   Registration timestamp, drives cache invalidation
 * @param metadata    Free-form enrichment data
 */
public record CodeRecord(
        String contentHash,
        @Nullable Long fingerprint,
        String name,
        UnitKind kind,
        SourceLocation location,
        Instant createdAt,
        Map<String, Object> metadata) {

    public CodeRecord {
        if (contentHash == null || contentHash.isBlank()) {
            throw new IllegalArgumentException("contentHash cannot be blank");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /**
     * Build the record for a freshly registered unit.
     */
    public static CodeRecord forUnit(CodeUnit unit, @Nullable Long fingerprint, Instant createdAt) {
        return new CodeRecord(
                unit.contentHash(),
                fingerprint,
                unit.name(),
                unit.kind(),
                unit.location(),
                createdAt,
                Map.of());
    }

    public boolean hasFingerprint() {
        return fingerprint != null;
    }

    @Nullable
    public String filePath() {
        return location.filePath();
    }

    /**
     * Copy of this record with one extra metadata entry.
     */
    public CodeRecord withMetadata(String key, Object value) {
        Map<String, Object> enriched = new HashMap<>(metadata);
        enriched.put(key, value);
        return new CodeRecord(contentHash, fingerprint, name, kind, location, createdAt, enriched);
    }

    @Override
    public String toString() {
        return kind + " " + name + " @ " + location;
    }
}
