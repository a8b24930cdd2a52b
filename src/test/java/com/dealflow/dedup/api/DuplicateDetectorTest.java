package com.dealflow.dedup.api;

import com.dealflow.dedup.audit.DetectionLogEntry;
import com.dealflow.dedup.core.model.ComparableRecord;
import com.dealflow.dedup.core.model.DetectionResult;
import com.dealflow.dedup.core.model.DuplicateCluster;
import com.dealflow.dedup.core.model.SimilarityScore;
import com.dealflow.dedup.core.model.StrategyType;
import com.dealflow.dedup.core.model.SuggestedAction;
import com.dealflow.dedup.decision.ConfidenceLevel;
import com.dealflow.dedup.metrics.MicrometerMetricsService;
import com.dealflow.dedup.notification.DuplicateDetectedEvent;
import com.dealflow.dedup.repository.InMemoryRecordRepository;
import com.dealflow.dedup.similarity.FieldWeights;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DuplicateDetector Tests")
class DuplicateDetectorTest {

    private InMemoryRecordRepository repository;
    private List<DuplicateDetectedEvent> events;
    private SimpleMeterRegistry meterRegistry;
    private DuplicateDetector detector;

    @BeforeEach
    void setUp() {
        repository = new InMemoryRecordRepository();
        events = new CopyOnWriteArrayList<>();
        meterRegistry = new SimpleMeterRegistry();
        detector = DuplicateDetector.builder()
                .recordRepository(repository)
                .notifier(events::add)
                .metricsService(new MicrometerMetricsService(meterRegistry))
                .asyncThreads(2)
                .build();
    }

    @AfterEach
    void tearDown() {
        detector.close();
    }

    private static ComparableRecord renewal(String id) {
        return ComparableRecord.builder()
                .id(id)
                .dealName("Acme Renewal")
                .customerName("Acme Corp")
                .dealValue(100_000.0)
                .vendorId("v1")
                .build();
    }

    @Test
    @DisplayName("Stored duplicate is merged, logged and notified")
    void detectAgainstRepository() {
        repository.save(renewal("d1"));
        ComparableRecord incoming = renewal("d2");

        DetectionResult result = detector.detect(incoming);

        assertTrue(result.isDuplicate());
        assertEquals(SuggestedAction.AUTO_MERGE, result.suggestedAction());
        assertEquals("d1", result.topMatch().orElseThrow().matchedEntityId());
        assertEquals(StrategyType.EXACT_MATCH, result.topMatch().orElseThrow().strategy());

        List<DetectionLogEntry> logged = detector.getDetectionLogService().findForEntity("d2");
        assertEquals(1, logged.size());
        assertEquals(1, events.size());
        assertEquals("d2", events.get(0).dealId());
        assertEquals("auto_merge", events.get(0).suggestedAction());
    }

    @Test
    @DisplayName("Empty repository yields no duplicates")
    void detectWithNoCandidates() {
        DetectionResult result = detector.detect(renewal("d2"));

        assertFalse(result.isDuplicate());
        assertEquals(SuggestedAction.NO_ACTION, result.suggestedAction());
        assertTrue(events.isEmpty());
    }

    @Test
    @DisplayName("Explicit pool bypasses the repository and side effects")
    void detectWithOptions() {
        repository.save(renewal("d1"));

        DetectionResult result = detector.detect(renewal("d2"), DetectionOptions.against(List.of()));

        assertFalse(result.isDuplicate());
        assertTrue(detector.getDetectionLogService().findPending().isEmpty());
    }

    @Test
    @DisplayName("Batch and cluster run through the facade")
    void batchAndCluster() {
        List<ComparableRecord> records = List.of(renewal("a"), renewal("b"),
                ComparableRecord.builder().id("c").dealName("Warehouse Fitout").customerName("Initech").build());
        repository.saveAll(records);

        assertEquals(3, detector.detectBatch(records).size());

        List<DuplicateCluster> clusters = detector.cluster(records);
        assertEquals(1, clusters.size());
        assertEquals("a|b", clusters.get(0).clusterKey());
    }

    @Test
    @DisplayName("Score uses the configured default weights")
    void score() {
        SimilarityScore same = detector.score(renewal("a"), renewal("b"));
        SimilarityScore namesOnly = detector.score(renewal("a"), renewal("b"), FieldWeights.namesOnly());

        assertEquals(1.0, same.overall(), 1e-9);
        assertEquals(1.0, namesOnly.overall(), 1e-9);
    }

    @Test
    @DisplayName("Classification follows the configured thresholds")
    void classify() {
        assertEquals(ConfidenceLevel.HIGH, detector.classify(0.9));
        assertEquals(ConfidenceLevel.MEDIUM, detector.classify(0.75));
        assertEquals(ConfidenceLevel.LOW, detector.classify(0.5));
        assertEquals(ConfidenceLevel.NONE, detector.classify(0.1));
    }

    @Test
    @DisplayName("Async view is created once and recreated after close")
    void asyncLifecycle() throws Exception {
        repository.save(renewal("d1"));

        AsyncDuplicateDetector async = detector.async();
        assertSame(async, detector.async());

        DetectionResult result = async.detectAsync(renewal("d2")).get(5, TimeUnit.SECONDS);
        assertTrue(result.isDuplicate());

        detector.close();
        assertNotSame(async, detector.async());
    }

    @Test
    @DisplayName("Builder defaults and validation")
    void builderValidation() {
        try (DuplicateDetector defaults = DuplicateDetector.builder().build()) {
            assertEquals(DetectionConfig.defaults().toString(), defaults.getConfig().toString());
            assertFalse(defaults.detect(renewal("x")).isDuplicate());
        }
        assertThrows(IllegalArgumentException.class, () -> DuplicateDetector.builder().config(null));
        assertThrows(IllegalArgumentException.class, () -> DuplicateDetector.builder().asyncThreads(0));
    }

    @Test
    @DisplayName("Detections are timed in the meter registry")
    void metricsRecorded() {
        repository.save(renewal("d1"));

        detector.detect(renewal("d2"));

        assertFalse(meterRegistry.getMeters().isEmpty());
    }
}
