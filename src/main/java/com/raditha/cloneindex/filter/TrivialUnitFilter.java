package com.raditha.cloneindex.filter;

import com.raditha.cloneindex.model.CodeUnit;
import com.raditha.cloneindex.model.RegisteredUnit;
import com.raditha.cloneindex.model.UnitKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Set;

/**
 * Excludes test code and trivial boilerplate from duplicate search.
 * <p>
 * Trivial units are ones that are expected to look alike everywhere:
 * accessors, {@code equals}/{@code hashCode}/{@code toString} implementations
 * with no branching, and empty or near-empty bodies. Reporting them as
 * duplicates is noise.
 */
public class TrivialUnitFilter implements UnitFilter {

    private static final Logger logger = LoggerFactory.getLogger(TrivialUnitFilter.class);

    static final Set<String> BOILERPLATE_METHODS = Set.of(
            "equals", "hashCode", "toString", "compareTo", "clone",
            "close", "iterator", "size", "isEmpty", "getInstance");

    private static final String[] TEST_NAME_PATTERNS = {"test", "should_", "given_", "when_"};
    private static final int MAX_ACCESSOR_TOKENS = 8;

    private final boolean includeTests;
    private final int maxTrivialTokens;

    /**
     * Create filter that excludes tests, boilerplate and empty units.
     */
    public TrivialUnitFilter() {
        this(false, 0);
    }

    /**
     * @param includeTests     keep test methods and test classes
     * @param maxTrivialTokens units with this many tokens or fewer are trivial
     */
    public TrivialUnitFilter(boolean includeTests, int maxTrivialTokens) {
        if (maxTrivialTokens < 0) {
            throw new IllegalArgumentException("maxTrivialTokens must be >= 0");
        }
        this.includeTests = includeTests;
        this.maxTrivialTokens = maxTrivialTokens;
    }

    @Override
    public boolean shouldExclude(RegisteredUnit registered) {
        CodeUnit unit = registered.unit();
        if (!includeTests && isTestCode(unit)) {
            logger.debug("Excluding test unit: {}", unit.name());
            return true;
        }
        if (isTrivial(unit)) {
            logger.debug("Excluding trivial unit: {}", unit.name());
            return true;
        }
        return false;
    }

    /**
     * Check if a unit looks like test code, by name or by location.
     */
    public boolean isTestCode(CodeUnit unit) {
        String path = unit.location().filePath();
        if (path != null) {
            String normalized = path.replace('\\', '/');
            if (normalized.contains("/src/test/") || normalized.startsWith("src/test/")) {
                return true;
            }
        }

        String name = unit.name();
        if (unit.kind() == UnitKind.CLASS) {
            return name.startsWith("Test") || name.endsWith("Test") || name.endsWith("Tests");
        }
        String lower = name.toLowerCase(Locale.ROOT);
        for (String pattern : TEST_NAME_PATTERNS) {
            if (lower.startsWith(pattern)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Check if a unit is boilerplate that is not worth reporting.
     */
    public boolean isTrivial(CodeUnit unit) {
        if (unit.tokens().size() <= maxTrivialTokens) {
            return true;
        }
        if (unit.kind() != UnitKind.FUNCTION || unit.complexity() > 1) {
            return false;
        }
        String name = unit.name();
        return BOILERPLATE_METHODS.contains(name) || isAccessor(name, unit);
    }

    private boolean isAccessor(String name, CodeUnit unit) {
        boolean accessorName = (name.startsWith("get") && name.length() > 3)
                || (name.startsWith("set") && name.length() > 3)
                || (name.startsWith("is") && name.length() > 2);
        // An accessor body is a single return or a single assignment
        return accessorName && unit.tokens().size() <= MAX_ACCESSOR_TOKENS;
    }
}
