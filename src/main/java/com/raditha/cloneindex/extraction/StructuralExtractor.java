package com.raditha.cloneindex.extraction;

import com.raditha.cloneindex.model.CodeUnit;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Turns source code into code units with structural token signatures.
 */
public interface StructuralExtractor {

    /**
     * Extract all units from a source file.
     *
     * @throws IOException         if the file cannot be read
     * @throws ExtractionException if the file does not parse
     */
    List<CodeUnit> extract(Path file) throws IOException;

    /**
     * Extract all units from source text.
     *
     * @param source   source text
     * @param filePath path recorded in unit locations, null for in-memory code
     * @throws ExtractionException if the source does not parse
     */
    List<CodeUnit> extractFromSource(String source, @Nullable String filePath);
}
