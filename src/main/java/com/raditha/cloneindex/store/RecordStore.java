package com.raditha.cloneindex.store;

import com.raditha.cloneindex.model.RegisteredUnit;

import java.util.List;

/**
 * Durable home of registered records and the units they were built from.
 * Records are keyed by content hash; saving an existing hash replaces it.
 */
public interface RecordStore {

    void save(RegisteredUnit unit) throws RecordStoreException;

    /**
     * All stored units in insertion order.
     */
    List<RegisteredUnit> findAll() throws RecordStoreException;

    List<RegisteredUnit> findByFile(String filePath) throws RecordStoreException;

    /**
     * @return true if a record with this hash existed
     */
    boolean delete(String contentHash) throws RecordStoreException;

    /**
     * @return number of records removed
     */
    int deleteByFile(String filePath) throws RecordStoreException;

    void clear() throws RecordStoreException;
}
