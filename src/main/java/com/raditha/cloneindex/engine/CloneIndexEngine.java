package com.raditha.cloneindex.engine;

import com.raditha.cloneindex.cache.CacheKey;
import com.raditha.cloneindex.cache.ResultCache;
import com.raditha.cloneindex.config.DetectionConfig;
import com.raditha.cloneindex.detection.DuplicateSearchService;
import com.raditha.cloneindex.extraction.JavaStructuralExtractor;
import com.raditha.cloneindex.extraction.StructuralExtractor;
import com.raditha.cloneindex.fingerprint.FingerprintEngine;
import com.raditha.cloneindex.graph.AdaptiveGraphResult;
import com.raditha.cloneindex.graph.AdaptiveThresholdFinder;
import com.raditha.cloneindex.graph.SimilarityGraph;
import com.raditha.cloneindex.graph.SimilarityGraphBuilder;
import com.raditha.cloneindex.index.BKTree;
import com.raditha.cloneindex.index.IndexStats;
import com.raditha.cloneindex.model.CodeRecord;
import com.raditha.cloneindex.model.CodeUnit;
import com.raditha.cloneindex.model.DuplicatePair;
import com.raditha.cloneindex.model.RegisteredUnit;
import com.raditha.cloneindex.model.SearchMode;
import com.raditha.cloneindex.model.SimilarMatch;
import com.raditha.cloneindex.store.InMemoryRecordStore;
import com.raditha.cloneindex.store.RecordStore;
import com.raditha.cloneindex.store.RecordStoreException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * One near-duplicate detection session.
 * <p>
 * Owns the registered units, their fingerprint index, the result cache and the
 * backing store. Registration and removal keep all four consistent; searches
 * read the in-memory state only. Store failures never undo in-memory changes:
 * a record the store rejected stays searchable for the rest of the session.
 * <p>
 * Not thread-safe: one caller registers, then queries.
 */
public class CloneIndexEngine {

    private static final Logger logger = LoggerFactory.getLogger(CloneIndexEngine.class);

    static final int SIMILAR_LIMIT = 10;
    static final int RELATED_MIN_HAMMING = 10;

    private final DetectionConfig config;
    private final RecordStore store;
    private final StructuralExtractor extractor;
    private final Clock clock;
    private final FingerprintEngine fingerprints = new FingerprintEngine();
    private final DuplicateSearchService searchService;
    private final SimilarityGraphBuilder graphBuilder;
    private final AdaptiveThresholdFinder adaptiveFinder;
    private final ResultCache cache = new ResultCache();

    private final Map<String, RegisteredUnit> units = new LinkedHashMap<>();
    private final BKTree<CodeRecord> index = new BKTree<>(CodeRecord::contentHash);

    public CloneIndexEngine() {
        this(DetectionConfig.defaults(), new InMemoryRecordStore());
    }

    public CloneIndexEngine(DetectionConfig config, RecordStore store) {
        this(config, store, new JavaStructuralExtractor(), Clock.systemUTC());
    }

    public CloneIndexEngine(DetectionConfig config, RecordStore store, StructuralExtractor extractor, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.store = Objects.requireNonNull(store, "store");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.searchService = new DuplicateSearchService(config);
        this.graphBuilder = new SimilarityGraphBuilder(config);
        this.adaptiveFinder = new AdaptiveThresholdFinder(config, graphBuilder);
    }

    /**
     * Silence progress logging of long scans.
     */
    public CloneIndexEngine silent(boolean silent) {
        searchService.silent(silent);
        graphBuilder.silent(silent);
        return this;
    }

    public DetectionConfig getConfig() {
        return config;
    }

    /**
     * Register a code unit. Identical content is registered once.
     */
    public Registration register(CodeUnit unit) {
        return register(unit, fingerprints.fingerprint(unit.tokens()));
    }

    /**
     * Register a batch. Fingerprints are computed in parallel, records are
     * inserted in input order.
     */
    public List<Registration> registerAll(List<CodeUnit> batch) {
        List<Long> computed = batch.parallelStream()
                .map(unit -> fingerprints.fingerprint(unit.tokens()))
                .toList();
        List<Registration> registrations = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            registrations.add(register(batch.get(i), computed.get(i)));
        }
        long added = registrations.stream().filter(Registration::isNew).count();
        logger.info("Registered {} of {} units ({} total)", added, batch.size(), units.size());
        return registrations;
    }

    /**
     * Extract and register all units of some source text. With a non-null path,
     * units of that file that no longer exist are dropped; unchanged units keep
     * their records.
     */
    public List<Registration> registerSource(String source, @Nullable String filePath) {
        List<CodeUnit> extracted = extractor.extractFromSource(source, filePath);
        if (filePath != null) {
            dropStaleUnits(filePath, extracted);
        }
        return registerAll(extracted);
    }

    /**
     * Extract and register a source file, replacing its earlier registration.
     * Unchanged units are reported as {@link Registration.Status#ALREADY_REGISTERED}.
     *
     * @throws IOException if the file cannot be read
     */
    public List<Registration> registerFile(Path file) throws IOException {
        List<CodeUnit> extracted = extractor.extract(file);
        dropStaleUnits(file.toString(), extracted);
        return registerAll(extracted);
    }

    private void dropStaleUnits(String filePath, List<CodeUnit> extracted) {
        Set<String> current = new HashSet<>();
        for (CodeUnit unit : extracted) {
            current.add(unit.contentHash());
        }
        List<RegisteredUnit> stale = units.values().stream()
                .filter(u -> filePath.equals(u.record().filePath()))
                .filter(u -> !current.contains(u.contentHash()))
                .toList();
        for (RegisteredUnit unit : stale) {
            discard(unit);
        }
        if (!stale.isEmpty()) {
            cache.clear();
            logger.debug("Dropped {} stale units of {}", stale.size(), filePath);
        }
    }

    private Registration register(CodeUnit unit, long fingerprint) {
        String hash = unit.contentHash();
        RegisteredUnit existing = units.get(hash);
        if (existing != null) {
            logger.debug("Already registered: {}", existing.record());
            return new Registration(existing.record(), Registration.Status.ALREADY_REGISTERED);
        }

        CodeRecord record = CodeRecord.forUnit(unit, fingerprint, clock.instant());
        RegisteredUnit registered = new RegisteredUnit(record, unit);
        units.put(hash, registered);
        index.insert(fingerprint, record);

        try {
            store.save(registered);
            return new Registration(record, Registration.Status.REGISTERED);
        } catch (RecordStoreException e) {
            logger.error("Could not persist {}, keeping it for this session only", record, e);
            return new Registration(record, Registration.Status.REGISTERED_NOT_PERSISTED);
        }
    }

    /**
     * Load everything the store holds into this session.
     *
     * @param skipMissingFiles leave out records whose source file no longer exists
     * @return number of units loaded
     * @throws RecordStoreException if the store cannot be read
     */
    public int loadFromStore(boolean skipMissingFiles) throws RecordStoreException {
        int loaded = 0;
        int skipped = 0;
        for (RegisteredUnit stored : store.findAll()) {
            String filePath = stored.record().filePath();
            if (skipMissingFiles && filePath != null && !Files.exists(Path.of(filePath))) {
                skipped++;
                continue;
            }
            RegisteredUnit unit = stored;
            if (!stored.record().hasFingerprint()) {
                long fingerprint = fingerprints.fingerprint(stored.unit().tokens());
                CodeRecord old = stored.record();
                unit = new RegisteredUnit(new CodeRecord(old.contentHash(), fingerprint, old.name(), old.kind(),
                        old.location(), old.createdAt(), old.metadata()), stored.unit());
            }
            if (units.putIfAbsent(unit.contentHash(), unit) == null) {
                index.insert(unit.record().fingerprint(), unit.record());
                loaded++;
            }
        }
        cache.clear();
        logger.info("Loaded {} units from store ({} skipped for missing files)", loaded, skipped);
        return loaded;
    }

    /**
     * @return true if a unit with this hash was registered
     */
    public boolean remove(String contentHash) {
        RegisteredUnit removed = units.get(contentHash);
        if (removed == null) {
            return false;
        }
        discard(removed);
        cache.clear();
        return true;
    }

    private void discard(RegisteredUnit unit) {
        units.remove(unit.contentHash());
        unindex(unit);
        try {
            store.delete(unit.contentHash());
        } catch (RecordStoreException e) {
            logger.error("Could not delete {} from the store", unit.record(), e);
        }
    }

    /**
     * Remove every unit registered for a file.
     *
     * @return number of units removed
     */
    public int removeFile(String filePath) {
        List<RegisteredUnit> matching = units.values().stream()
                .filter(u -> filePath.equals(u.record().filePath()))
                .toList();
        for (RegisteredUnit unit : matching) {
            units.remove(unit.contentHash());
            unindex(unit);
        }
        try {
            store.deleteByFile(filePath);
        } catch (RecordStoreException e) {
            logger.error("Could not delete records of {} from the store", filePath, e);
        }
        if (!matching.isEmpty()) {
            cache.clear();
            logger.debug("Removed {} units of {}", matching.size(), filePath);
        }
        return matching.size();
    }

    /**
     * Drop everything: store, registered units, index and cache.
     */
    public void clear() {
        try {
            store.clear();
        } catch (RecordStoreException e) {
            logger.error("Could not clear the store", e);
        }
        units.clear();
        index.clear();
        cache.clear();
    }

    /**
     * Attach a metadata entry to a registered record.
     *
     * @return the enriched record, empty if the hash is unknown
     */
    public Optional<CodeRecord> enrich(String contentHash, String key, Object value) {
        RegisteredUnit current = units.get(contentHash);
        if (current == null) {
            return Optional.empty();
        }
        RegisteredUnit enriched = new RegisteredUnit(current.record().withMetadata(key, value), current.unit());
        units.put(contentHash, enriched);
        // cached pairs still hold the record without this entry
        cache.clear();
        try {
            store.save(enriched);
        } catch (RecordStoreException e) {
            logger.error("Could not persist metadata of {}", enriched.record(), e);
        }
        return Optional.of(enriched.record());
    }

    private void unindex(RegisteredUnit unit) {
        if (unit.record().hasFingerprint() && !index.remove(unit.record().fingerprint(), unit.contentHash())) {
            throw new IllegalStateException("Registered unit missing from index: " + unit.record());
        }
    }

    /**
     * Duplicates under the configured threshold, mode and filters; the top
     * percentage of pairs instead when the configuration sets one.
     */
    public List<DuplicatePair> findDuplicates() {
        if (config.topPercent() != null) {
            return findTopPercentDuplicates(config.topPercent(), config.searchMode(), config.includeTrivial());
        }
        return findDuplicates(config.similarityThreshold(), config.searchMode(), config.includeTrivial(), true);
    }

    public List<DuplicatePair> findDuplicates(double threshold, SearchMode mode, boolean includeTrivial,
                                              boolean useCache) {
        CacheKey key = new CacheKey(threshold, mode, includeTrivial, units.size());
        Instant newest = newestTimestamp();
        if (useCache) {
            Optional<List<DuplicatePair>> cached = cache.get(key, newest);
            if (cached.isPresent()) {
                return cached.get();
            }
        }
        List<DuplicatePair> result = List.copyOf(
                searchService.findDuplicates(registeredUnits(), threshold, mode, includeTrivial, index));
        cache.put(key, result, newest);
        return result;
    }

    public List<DuplicatePair> findTopPercentDuplicates(double percent, SearchMode mode, boolean includeTrivial) {
        return searchService.findTopPercent(registeredUnits(), percent, mode, includeTrivial, index);
    }

    public List<DuplicatePair> findTopDuplicates(int count, SearchMode mode, boolean includeTrivial) {
        return searchService.findTopN(registeredUnits(), count, mode, includeTrivial, index);
    }

    /**
     * Registered units resembling an arbitrary unit, under the configured
     * Hamming radius and similarity threshold.
     */
    public List<SimilarMatch> findSimilar(CodeUnit unit) {
        return findSimilar(unit, config.similarityThreshold(), SIMILAR_LIMIT);
    }

    public List<SimilarMatch> findSimilar(CodeUnit unit, double threshold, int limit) {
        return searchService.findSimilar(unit, fingerprints.fingerprint(unit.tokens()), registeredUnits(), index,
                config.hammingThreshold(), threshold, limit);
    }

    /**
     * Units related to a registered one. The Hamming radius is derived from
     * the threshold but never below {@value #RELATED_MIN_HAMMING}.
     *
     * @return matches, most similar first; empty for unknown hashes
     */
    public List<SimilarMatch> relatedUnits(String contentHash, double threshold, int maxResults) {
        RegisteredUnit target = units.get(contentHash);
        if (target == null || !target.record().hasFingerprint()) {
            return List.of();
        }
        int bound = Math.max(RELATED_MIN_HAMMING,
                (int) Math.floor(DetectionConfig.FINGERPRINT_BITS * (1.0 - threshold)));
        return searchService.findSimilar(target.unit(), target.record().fingerprint(), registeredUnits(), index,
                Math.min(bound, DetectionConfig.FINGERPRINT_BITS), threshold, maxResults);
    }

    public SimilarityGraph buildSimilarityGraph(double threshold, SearchMode mode) {
        return graphBuilder.buildGraph(registeredUnits(), threshold, mode, index);
    }

    public AdaptiveGraphResult findAdaptiveGraph(int targetEdges, int maxEdges, double minThreshold,
                                                 double maxThreshold, SearchMode mode) {
        return adaptiveFinder.findAdaptiveThreshold(registeredUnits(), targetEdges, maxEdges,
                minThreshold, maxThreshold, mode, index);
    }

    public Optional<CodeRecord> getRecord(String contentHash) {
        RegisteredUnit unit = units.get(contentHash);
        return unit == null ? Optional.empty() : Optional.of(unit.record());
    }

    public List<RegisteredUnit> registeredUnits() {
        return new ArrayList<>(units.values());
    }

    public int size() {
        return units.size();
    }

    public EngineStatistics statistics() {
        Set<String> files = new HashSet<>();
        int functions = 0;
        int classes = 0;
        int modules = 0;
        for (RegisteredUnit unit : units.values()) {
            if (unit.record().filePath() != null) {
                files.add(unit.record().filePath());
            }
            switch (unit.record().kind()) {
                case FUNCTION -> functions++;
                case CLASS -> classes++;
                case MODULE -> modules++;
            }
        }
        IndexStats indexStats = index.stats();
        return new EngineStatistics(units.size(), files.size(), functions, classes, modules,
                config.hammingThreshold(), indexStats.size(), indexStats.depth(), cache.size());
    }

    private Instant newestTimestamp() {
        Instant newest = Instant.EPOCH;
        for (RegisteredUnit unit : units.values()) {
            if (unit.record().createdAt().isAfter(newest)) {
                newest = unit.record().createdAt();
            }
        }
        return newest;
    }
}
