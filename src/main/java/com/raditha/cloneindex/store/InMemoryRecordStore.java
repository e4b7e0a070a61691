package com.raditha.cloneindex.store;

import com.raditha.cloneindex.model.RegisteredUnit;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Store that lives only as long as the process. Never fails.
 */
public class InMemoryRecordStore implements RecordStore {

    private final Map<String, RegisteredUnit> units = new LinkedHashMap<>();

    @Override
    public synchronized void save(RegisteredUnit unit) {
        units.put(unit.contentHash(), unit);
    }

    @Override
    public synchronized List<RegisteredUnit> findAll() {
        return new ArrayList<>(units.values());
    }

    @Override
    public synchronized List<RegisteredUnit> findByFile(String filePath) {
        return units.values().stream()
                .filter(u -> Objects.equals(filePath, u.record().filePath()))
                .toList();
    }

    @Override
    public synchronized boolean delete(String contentHash) {
        return units.remove(contentHash) != null;
    }

    @Override
    public synchronized int deleteByFile(String filePath) {
        int before = units.size();
        units.values().removeIf(u -> Objects.equals(filePath, u.record().filePath()));
        return before - units.size();
    }

    @Override
    public synchronized void clear() {
        units.clear();
    }
}
