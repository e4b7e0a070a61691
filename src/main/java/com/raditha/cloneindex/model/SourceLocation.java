package com.raditha.cloneindex.model;

import org.jspecify.annotations.Nullable;

/**
 * Where a code unit lives in the source tree.
 *
 * @param filePath  Path of the source file, null for code registered without a file
 * @param startLine Starting line number (1-indexed)
 * @param endLine   Ending line number (1-indexed, inclusive)
 */
public record SourceLocation(
        @Nullable String filePath,
        int startLine,
        int endLine) {

    public SourceLocation {
        if (startLine < 0 || endLine < startLine) {
            throw new IllegalArgumentException(
                    String.format("Invalid line range %d-%d", startLine, endLine));
        }
    }

    /**
     * Location for code that was registered without a backing file.
     */
    public static SourceLocation unknown() {
        return new SourceLocation(null, 0, 0);
    }

    /**
     * Two locations denote the same code when they share file and start line.
     * Locations without a file never match.
     */
    public boolean sameStart(SourceLocation other) {
        return other != null
                && filePath != null
                && filePath.equals(other.filePath)
                && startLine == other.startLine;
    }

    /**
     * Format as "path:L45-52" for display.
     */
    public String toDisplayString() {
        String file = filePath == null ? "<memory>" : filePath;
        if (startLine == endLine) {
            return file + ":L" + startLine;
        }
        return file + ":L" + startLine + "-" + endLine;
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
