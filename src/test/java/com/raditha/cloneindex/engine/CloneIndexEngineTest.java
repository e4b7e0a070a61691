package com.raditha.cloneindex.engine;

import com.raditha.cloneindex.TestUnits;
import com.raditha.cloneindex.config.DetectionConfig;
import com.raditha.cloneindex.extraction.ExtractionException;
import com.raditha.cloneindex.extraction.JavaStructuralExtractor;
import com.raditha.cloneindex.graph.AdaptiveGraphResult;
import com.raditha.cloneindex.graph.Neighbor;
import com.raditha.cloneindex.graph.SimilarityGraph;
import com.raditha.cloneindex.model.CodeRecord;
import com.raditha.cloneindex.model.CodeUnit;
import com.raditha.cloneindex.model.DuplicatePair;
import com.raditha.cloneindex.model.RegisteredUnit;
import com.raditha.cloneindex.model.SearchMode;
import com.raditha.cloneindex.model.SimilarMatch;
import com.raditha.cloneindex.store.InMemoryRecordStore;
import com.raditha.cloneindex.store.JsonFileRecordStore;
import com.raditha.cloneindex.store.RecordStore;
import com.raditha.cloneindex.store.RecordStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class CloneIndexEngineTest {

    private static final String SERVICE = """
            class Service {
                int total(int[] values) {
                    int sum = 0;
                    for (int v : values) {
                        if (v > 0) {
                            sum += v;
                        }
                    }
                    return sum;
                }

                int count(int[] items) {
                    int n = 0;
                    for (int i : items) {
                        if (i > 0) {
                            n += i;
                        }
                    }
                    return n;
                }
            }
            """;

    @Mock
    private RecordStore failingStore;

    private MutableClock clock;
    private CloneIndexEngine engine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        engine = new CloneIndexEngine(DetectionConfig.defaults(), new InMemoryRecordStore(),
                new JavaStructuralExtractor(), clock).silent(true);
    }

    private List<CodeUnit> abcUnits() {
        return List.of(
                TestUnits.unit("A", "FUNC:1", "CALL:print"),
                TestUnits.unit("B", "FUNC:1", "CALL:print"),
                TestUnits.unit("C", "FUNC:3", "CALL:open", "CALL:close"));
    }

    @Test
    void testRegisterAndFindAbcDuplicates() {
        List<Registration> registrations = engine.registerAll(abcUnits());

        assertTrue(registrations.stream().allMatch(r -> r.status() == Registration.Status.REGISTERED));
        List<DuplicatePair> pairs = engine.findDuplicates(0.9, SearchMode.FAST, false, false);
        assertEquals(1, pairs.size());
        assertEquals(1.0, pairs.get(0).similarity(), 0.0001);
        assertEquals(pairs, engine.findDuplicates(0.9, SearchMode.EXHAUSTIVE, false, false));
    }

    @Test
    void testRegisteringSameContentTwice() {
        CodeUnit unit = TestUnits.unit("A", "FUNC:1", "CALL:print");
        Registration first = engine.register(unit);
        Registration second = engine.register(unit);

        assertEquals(Registration.Status.ALREADY_REGISTERED, second.status());
        assertFalse(second.isNew());
        assertSame(first.record(), second.record());
        assertEquals(1, engine.size());
    }

    @Test
    void testStoreFailureKeepsRecordInMemory() throws RecordStoreException {
        doThrow(new RecordStoreException("disk full")).when(failingStore).save(any());
        CloneIndexEngine flaky = new CloneIndexEngine(DetectionConfig.defaults(), failingStore,
                new JavaStructuralExtractor(), clock).silent(true);

        List<Registration> registrations = flaky.registerAll(abcUnits());

        assertTrue(registrations.stream().noneMatch(Registration::isPersisted));
        assertEquals(Registration.Status.REGISTERED_NOT_PERSISTED, registrations.get(0).status());
        assertEquals(3, flaky.size());
        assertEquals(1, flaky.findDuplicates(0.9, SearchMode.FAST, false, false).size());
    }

    @Test
    void testRemovalStoreFailureStillUpdatesMemory() throws RecordStoreException {
        doThrow(new RecordStoreException("read only")).when(failingStore).delete(anyString());
        doThrow(new RecordStoreException("read only")).when(failingStore).clear();
        CloneIndexEngine flaky = new CloneIndexEngine(DetectionConfig.defaults(), failingStore,
                new JavaStructuralExtractor(), clock).silent(true);
        List<Registration> registrations = flaky.registerAll(abcUnits());

        assertTrue(flaky.remove(registrations.get(0).record().contentHash()));
        assertEquals(2, flaky.size());
        flaky.clear();
        assertEquals(0, flaky.size());
        verify(failingStore).clear();
    }

    @Test
    void testCacheServesUntilNewerRecordArrives() {
        engine.registerAll(abcUnits());
        List<DuplicatePair> first = engine.findDuplicates(0.9, SearchMode.FAST, false, true);
        List<DuplicatePair> second = engine.findDuplicates(0.9, SearchMode.FAST, false, true);
        assertSame(first, second, "second query is served from the cache");

        clock.advance(Duration.ofSeconds(1));
        engine.register(TestUnits.unit("D", "FUNC:1", "CALL:print"));

        List<DuplicatePair> third = engine.findDuplicates(0.9, SearchMode.FAST, false, true);
        assertNotSame(first, third);
        assertEquals(3, third.size(), "A, B and D are pairwise identical");
    }

    @Test
    void testRemovalInvalidatesCache() {
        List<Registration> registrations = engine.registerAll(abcUnits());
        assertEquals(1, engine.findDuplicates(0.9, SearchMode.FAST, false, true).size());

        engine.remove(registrations.get(1).record().contentHash());
        engine.register(TestUnits.unit("E", "FUNC:9"));

        assertTrue(engine.findDuplicates(0.9, SearchMode.FAST, false, true).isEmpty());
    }

    @Test
    void testDefaultQueryUsesConfiguration() {
        engine.registerAll(abcUnits());
        assertEquals(1, engine.findDuplicates().size());

        CloneIndexEngine topPercent = new CloneIndexEngine(DetectionConfig.defaults().withTopPercent(50.0),
                new InMemoryRecordStore(), new JavaStructuralExtractor(), clock).silent(true);
        topPercent.registerAll(abcUnits());
        assertEquals(1, topPercent.findDuplicates().size());
    }

    @Test
    void testTopDuplicates() {
        engine.registerAll(abcUnits());

        List<DuplicatePair> top = engine.findTopDuplicates(1, SearchMode.FAST, false);

        assertEquals(1, top.size());
        assertEquals(Set.of("A", "B"), Set.of(top.get(0).first().name(), top.get(0).second().name()));
    }

    @Test
    void testRemoveAndReRegister() {
        Registration a = engine.register(TestUnits.unit("A", "FUNC:1", "CALL:print"));
        engine.register(TestUnits.unit("B", "FUNC:1", "CALL:print"));

        assertTrue(engine.remove(a.record().contentHash()));
        assertFalse(engine.remove(a.record().contentHash()));
        assertTrue(engine.getRecord(a.record().contentHash()).isEmpty());
        assertTrue(engine.findDuplicates(0.9, SearchMode.FAST, false, false).isEmpty());

        assertEquals(Registration.Status.REGISTERED, engine.register(TestUnits.unit("A", "FUNC:1", "CALL:print")).status());
        assertEquals(1, engine.findDuplicates(0.9, SearchMode.FAST, false, false).size());
    }

    @Test
    void testEnrich() {
        Registration a = engine.register(TestUnits.unit("A", "FUNC:1", "CALL:print"));

        CodeRecord enriched = engine.enrich(a.record().contentHash(), "owner", "billing").orElseThrow();

        assertEquals("billing", enriched.metadata().get("owner"));
        assertEquals(enriched, engine.getRecord(a.record().contentHash()).orElseThrow());
        assertEquals(a.record().fingerprint(), enriched.fingerprint());
        assertTrue(engine.enrich("unknown", "k", "v").isEmpty());
    }

    @Test
    void testEnrichInvalidatesCachedPairs() {
        List<Registration> registrations = engine.registerAll(abcUnits());
        String a = registrations.get(0).record().contentHash();
        List<DuplicatePair> before = engine.findDuplicates(0.9, SearchMode.FAST, false, true);

        CodeRecord enriched = engine.enrich(a, "k", "v").orElseThrow();
        List<DuplicatePair> after = engine.findDuplicates(0.9, SearchMode.FAST, false, true);

        assertNotSame(before, after);
        assertEquals(1, after.size());
        DuplicatePair pair = after.get(0);
        CodeRecord side = pair.first().contentHash().equals(a) ? pair.first() : pair.second();
        assertEquals(enriched, side);
    }

    @Test
    void testRegisterSourceReplacesPreviousVersion() {
        engine.registerSource(SERVICE, "src/main/java/Service.java");
        assertEquals(3, engine.size());

        List<DuplicatePair> pairs = engine.findDuplicates(0.9, SearchMode.EXHAUSTIVE, false, false);
        assertEquals(1, pairs.size(), "total and count differ only in names");

        engine.registerSource(SERVICE.replace("return n;", "return n + 1;"), "src/main/java/Service.java");
        assertEquals(3, engine.size(), "old units of the file are replaced, not added to");
    }

    @Test
    void testReRegisteringUnchangedSourceKeepsRecords() {
        String path = "src/main/java/Service.java";
        List<Registration> first = engine.registerSource(SERVICE, path);
        String total = first.get(1).record().contentHash();
        engine.enrich(total, "owner", "billing");
        List<DuplicatePair> cached = engine.findDuplicates(0.9, SearchMode.EXHAUSTIVE, false, true);

        clock.advance(Duration.ofSeconds(5));
        List<Registration> second = engine.registerSource(SERVICE, path);

        assertTrue(second.stream().allMatch(r -> r.status() == Registration.Status.ALREADY_REGISTERED));
        CodeRecord kept = engine.getRecord(total).orElseThrow();
        assertEquals("billing", kept.metadata().get("owner"));
        assertEquals(first.get(1).record().createdAt(), kept.createdAt());
        assertSame(cached, engine.findDuplicates(0.9, SearchMode.EXHAUSTIVE, false, true));
    }

    @Test
    void testReRegisteringChangedSourceDropsOnlyStaleUnits() {
        String path = "src/main/java/Service.java";
        List<Registration> first = engine.registerSource(SERVICE, path);
        String total = first.get(1).record().contentHash();
        String count = first.get(2).record().contentHash();

        List<Registration> second = engine.registerSource(SERVICE.replace("return n;", "return n + 1;"), path);

        assertEquals(Registration.Status.ALREADY_REGISTERED, second.get(1).status());
        assertEquals(Registration.Status.REGISTERED, second.get(2).status());
        assertTrue(engine.getRecord(total).isPresent());
        assertTrue(engine.getRecord(count).isEmpty());
        assertEquals(3, engine.statistics().indexSize());
    }

    @Test
    void testRegisterSourceRejectsBrokenCodeWithoutLosingOldUnits() {
        engine.registerSource(SERVICE, "src/main/java/Service.java");

        assertThrows(ExtractionException.class, () -> engine.registerSource("class {", "src/main/java/Service.java"));
        assertEquals(3, engine.size());
    }

    @Test
    void testRegisterFileAndRemoveFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("Service.java");
        Files.writeString(file, SERVICE);

        engine.registerFile(file);
        assertEquals(3, engine.statistics().totalUnits());
        assertEquals(1, engine.statistics().files());

        assertEquals(3, engine.removeFile(file.toString()));
        assertEquals(0, engine.size());
    }

    @Test
    void testLoadFromStore(@TempDir Path dir) throws IOException, RecordStoreException {
        Path storeFile = dir.resolve("records.json");
        Path source = dir.resolve("Service.java");
        Files.writeString(source, SERVICE);

        CloneIndexEngine writer = new CloneIndexEngine(DetectionConfig.defaults(),
                new JsonFileRecordStore(storeFile), new JavaStructuralExtractor(), clock).silent(true);
        writer.registerFile(source);
        writer.registerAll(abcUnits());

        CloneIndexEngine reader = new CloneIndexEngine(DetectionConfig.defaults(),
                new JsonFileRecordStore(storeFile), new JavaStructuralExtractor(), clock).silent(true);
        assertEquals(6, reader.loadFromStore(false));
        assertEquals(writer.findDuplicates(0.9, SearchMode.FAST, false, false),
                reader.findDuplicates(0.9, SearchMode.FAST, false, false));

        CloneIndexEngine skipping = new CloneIndexEngine(DetectionConfig.defaults(),
                new JsonFileRecordStore(storeFile), new JavaStructuralExtractor(), clock).silent(true);
        assertEquals(3, skipping.loadFromStore(true), "the A/B/C files were never written to disk");
    }

    @Test
    void testFindSimilarAndRelatedUnits() {
        List<Registration> registrations = engine.registerAll(abcUnits());
        String a = registrations.get(0).record().contentHash();

        List<SimilarMatch> similar = engine.findSimilar(TestUnits.unit("Q", "FUNC:1", "CALL:print"));
        assertEquals(2, similar.size());

        List<SimilarMatch> related = engine.relatedUnits(a, 0.3, 10);
        assertEquals(1, related.size());
        assertEquals("B", related.get(0).record().name());
        assertTrue(engine.relatedUnits("unknown", 0.3, 10).isEmpty());
    }

    @Test
    void testSimilarityGraph() {
        List<Registration> registrations = engine.registerAll(abcUnits());
        String a = registrations.get(0).record().contentHash();
        String b = registrations.get(1).record().contentHash();
        String c = registrations.get(2).record().contentHash();

        SimilarityGraph graph = engine.buildSimilarityGraph(0.9, SearchMode.FAST);

        assertEquals(List.of(new Neighbor(b, 1.0)), graph.neighbors(a));
        assertEquals(List.of(new Neighbor(a, 1.0)), graph.neighbors(b));
        assertTrue(graph.containsNode(c));
        assertTrue(graph.neighbors(c).isEmpty());
    }

    @Test
    void testAdaptiveGraph() {
        Random random = new Random(12);
        List<CodeUnit> units = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            units.add(TestUnits.unit("u" + i, TestUnits.randomTokens(random, 15)));
        }
        engine.registerAll(units);

        AdaptiveGraphResult result = engine.findAdaptiveGraph(10, 100, 0.1, 0.9, SearchMode.EXHAUSTIVE);

        assertTrue(result.iterations() <= engine.getConfig().maxAdaptiveIterations());
        assertTrue(result.threshold() >= 0.1 && result.threshold() <= 0.9);
        assertEquals(50, result.graph().nodeCount());
    }

    @Test
    void testStatistics() {
        engine.registerAll(abcUnits());
        engine.registerSource(SERVICE, "src/main/java/Service.java");

        EngineStatistics stats = engine.statistics();

        assertEquals(6, stats.totalUnits());
        assertEquals(4, stats.files());
        assertEquals(5, stats.functions());
        assertEquals(1, stats.classes());
        assertEquals(0, stats.modules());
        assertEquals(10, stats.hammingThreshold());
        assertEquals(6, stats.indexSize());
    }

    @Test
    void testRegisteredUnitsIsACopy() {
        engine.registerAll(abcUnits());
        List<RegisteredUnit> units = engine.registeredUnits();
        units.clear();
        assertEquals(3, engine.size());
    }

    /**
     * Clock whose time only moves when told to.
     */
    static class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
