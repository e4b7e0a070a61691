package com.raditha.cloneindex.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.raditha.cloneindex.model.CodeRecord;
import com.raditha.cloneindex.model.CodeUnit;
import com.raditha.cloneindex.model.RegisteredUnit;
import com.raditha.cloneindex.model.SourceLocation;
import com.raditha.cloneindex.model.UnitKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Record store backed by a single JSON document.
 * <p>
 * The file is read on first access and rewritten after every change, through
 * a temporary file that replaces the original so a crash never leaves a
 * half-written store behind. Records are written as DTOs rather than the model
 * types so that the file format does not follow every model change.
 */
public class JsonFileRecordStore implements RecordStore {

    private static final Logger logger = LoggerFactory.getLogger(JsonFileRecordStore.class);

    static final int FORMAT_VERSION = 1;

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .registerModule(new Jdk8Module())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    /**
     * On-disk document.
     */
    public record StoreDTO(int version, List<UnitDTO> units) {}

    public record UnitDTO(
            String contentHash,
            Long fingerprint,
            String name,
            String kind,
            String filePath,
            int startLine,
            int endLine,
            Instant createdAt,
            Map<String, Object> metadata,
            List<String> tokens,
            Set<String> dependencies,
            int complexity,
            String source) {}

    private final Path file;
    private Map<String, RegisteredUnit> units;

    public JsonFileRecordStore(Path file) {
        this.file = file;
    }

    @Override
    public synchronized void save(RegisteredUnit unit) throws RecordStoreException {
        loaded().put(unit.contentHash(), unit);
        flush();
    }

    @Override
    public synchronized List<RegisteredUnit> findAll() throws RecordStoreException {
        return new ArrayList<>(loaded().values());
    }

    @Override
    public synchronized List<RegisteredUnit> findByFile(String filePath) throws RecordStoreException {
        return loaded().values().stream()
                .filter(u -> Objects.equals(filePath, u.record().filePath()))
                .toList();
    }

    @Override
    public synchronized boolean delete(String contentHash) throws RecordStoreException {
        boolean removed = loaded().remove(contentHash) != null;
        if (removed) {
            flush();
        }
        return removed;
    }

    @Override
    public synchronized int deleteByFile(String filePath) throws RecordStoreException {
        Map<String, RegisteredUnit> current = loaded();
        int before = current.size();
        current.values().removeIf(u -> Objects.equals(filePath, u.record().filePath()));
        int removed = before - current.size();
        if (removed > 0) {
            flush();
        }
        return removed;
    }

    @Override
    public synchronized void clear() throws RecordStoreException {
        loaded().clear();
        flush();
    }

    private Map<String, RegisteredUnit> loaded() throws RecordStoreException {
        if (units == null) {
            units = read();
        }
        return units;
    }

    private Map<String, RegisteredUnit> read() throws RecordStoreException {
        Map<String, RegisteredUnit> result = new LinkedHashMap<>();
        if (!Files.exists(file)) {
            return result;
        }
        try {
            StoreDTO dto = mapper.readValue(file.toFile(), StoreDTO.class);
            if (dto.version() != FORMAT_VERSION) {
                throw new RecordStoreException("Unsupported store format version " + dto.version() + " in " + file);
            }
            if (dto.units() != null) {
                for (UnitDTO unit : dto.units()) {
                    RegisteredUnit registered = fromDTO(unit);
                    result.put(registered.contentHash(), registered);
                }
            }
            logger.debug("Loaded {} records from {}", result.size(), file);
            return result;
        } catch (IOException | IllegalArgumentException e) {
            throw new RecordStoreException("Failed to read record store " + file, e);
        }
    }

    private void flush() throws RecordStoreException {
        List<UnitDTO> dtos = units.values().stream().map(JsonFileRecordStore::toDTO).toList();
        Path temp = null;
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), new StoreDTO(FORMAT_VERSION, dtos));
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            RecordStoreException failure = new RecordStoreException("Failed to write record store " + file, e);
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException cleanup) {
                    failure.addSuppressed(cleanup);
                }
            }
            throw failure;
        }
    }

    private static UnitDTO toDTO(RegisteredUnit registered) {
        CodeRecord record = registered.record();
        CodeUnit unit = registered.unit();
        return new UnitDTO(
                record.contentHash(),
                record.fingerprint(),
                record.name(),
                record.kind().name(),
                record.location().filePath(),
                record.location().startLine(),
                record.location().endLine(),
                record.createdAt(),
                record.metadata(),
                unit.tokens(),
                unit.dependencies(),
                unit.complexity(),
                unit.source());
    }

    private static RegisteredUnit fromDTO(UnitDTO dto) {
        UnitKind kind = UnitKind.valueOf(dto.kind());
        SourceLocation location = new SourceLocation(dto.filePath(), dto.startLine(), dto.endLine());
        CodeUnit unit = new CodeUnit(dto.name(), kind, dto.tokens(), location, dto.dependencies(),
                dto.complexity(), dto.source());
        CodeRecord record = new CodeRecord(dto.contentHash(), dto.fingerprint(), dto.name(), kind, location,
                dto.createdAt(), dto.metadata() == null ? Map.of() : dto.metadata());
        return new RegisteredUnit(record, unit);
    }
}
