package com.raditha.cloneindex.engine;

import com.raditha.cloneindex.model.CodeRecord;

/**
 * Result of registering one code unit.
 *
 * @param record The registered record, or the existing one for repeated content
 * @param status What happened
 */
public record Registration(CodeRecord record, Status status) {

    public enum Status {
        /** New record, indexed and stored */
        REGISTERED,
        /** Identical content was already registered; nothing changed */
        ALREADY_REGISTERED,
        /** New record, indexed for this session but the store rejected it */
        REGISTERED_NOT_PERSISTED
    }

    public boolean isNew() {
        return status != Status.ALREADY_REGISTERED;
    }

    public boolean isPersisted() {
        return status != Status.REGISTERED_NOT_PERSISTED;
    }
}
