package com.raditha.cloneindex.filter;

import com.raditha.cloneindex.model.RegisteredUnit;

/**
 * Decides which registered units take part in duplicate search.
 */
@FunctionalInterface
public interface UnitFilter {

    /**
     * @return true if the unit should be left out of the comparison
     */
    boolean shouldExclude(RegisteredUnit unit);

    /**
     * Filter that keeps everything.
     */
    static UnitFilter none() {
        return unit -> false;
    }

    default UnitFilter or(UnitFilter other) {
        return unit -> shouldExclude(unit) || other.shouldExclude(unit);
    }
}
