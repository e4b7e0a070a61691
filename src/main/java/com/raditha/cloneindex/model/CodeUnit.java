package com.raditha.cloneindex.model;

import org.jspecify.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Set;

/**
 * A function, class or module as delivered by a structural extractor.
 * Immutable once produced.
 *
 * @param name         Unit name (method or type name)
 * @param kind         Unit kind
 * @param tokens       Ordered structural token signature
 * @param location     File and line range
 * @param dependencies Names of called methods and referenced types
 * @param complexity   Cyclomatic-style complexity estimate
 * @param source       Normalized source text, if the extractor kept it
 */
public record CodeUnit(
        String name,
        UnitKind kind,
        List<String> tokens,
        SourceLocation location,
        Set<String> dependencies,
        int complexity,
        @Nullable String source) {

    public CodeUnit {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
        location = location == null ? SourceLocation.unknown() : location;
        dependencies = dependencies == null ? Set.of() : Set.copyOf(dependencies);
    }

    /**
     * Create a unit with only a token signature, mostly useful for tests and
     * extractors that do not keep source text.
     */
    public static CodeUnit of(String name, UnitKind kind, List<String> tokens, SourceLocation location) {
        return new CodeUnit(name, kind, tokens, location, Set.of(), 1, null);
    }

    /**
     * Stable content-addressed identity: SHA-256 over file path, start line and
     * the normalized source (the token signature when no source was kept).
     */
    public String contentHash() {
        StringBuilder content = new StringBuilder();
        content.append(location.filePath() == null ? "" : location.filePath())
                .append('\n')
                .append(location.startLine())
                .append('\n');
        if (source != null) {
            content.append(source);
        } else {
            content.append(kind).append(':').append(name).append('\n');
            content.append(String.join("|", tokens));
        }
        return sha256(content.toString());
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
