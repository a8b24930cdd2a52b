package com.dealflow.dedup.api;

import com.dealflow.dedup.audit.DetectionLogEntry;
import com.dealflow.dedup.audit.DetectionLogService;
import com.dealflow.dedup.audit.InMemoryDetectionLogRepository;
import com.dealflow.dedup.core.model.ComparableRecord;
import com.dealflow.dedup.core.model.DetectionResult;
import com.dealflow.dedup.core.model.EntityKind;
import com.dealflow.dedup.core.model.StrategyType;
import com.dealflow.dedup.core.model.SuggestedAction;
import com.dealflow.dedup.decision.DecisionPolicy;
import com.dealflow.dedup.decision.MatchAggregator;
import com.dealflow.dedup.metrics.MetricsService;
import com.dealflow.dedup.notification.DuplicateDetectedEvent;
import com.dealflow.dedup.notification.DuplicateNotifier;
import com.dealflow.dedup.repository.CandidateLookupException;
import com.dealflow.dedup.repository.RecordRepository;
import com.dealflow.dedup.strategy.StrategyRegistry;
import com.dealflow.dedup.tracing.NoOpTracingService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

@DisplayName("DuplicateDetectionService Tests")
@ExtendWith(MockitoExtension.class)
class DuplicateDetectionServiceTest {

    @Mock
    private RecordRepository recordRepository;

    @Mock
    private DuplicateNotifier notifier;

    @Mock
    private MetricsService metricsService;

    private InMemoryDetectionLogRepository logRepository;
    private DuplicateDetectionService service;

    @BeforeEach
    void setUp() {
        DetectionConfig config = DetectionConfig.defaults();
        logRepository = new InMemoryDetectionLogRepository();
        service = new DuplicateDetectionService(
                config,
                StrategyRegistry.createDefault(config),
                new MatchAggregator(),
                new DecisionPolicy(config),
                recordRepository,
                new DetectionLogService(logRepository, new ObjectMapper(), metricsService),
                notifier,
                metricsService,
                new NoOpTracingService());
    }

    private static ComparableRecord acmeRenewal(String id, String customer, double value) {
        return ComparableRecord.builder()
                .id(id)
                .dealName("Acme Renewal")
                .customerName(customer)
                .dealValue(value)
                .vendorId("v1")
                .build();
    }

    @Nested
    @DisplayName("Detection against a supplied pool")
    class SuppliedPoolTests {

        @Test
        @DisplayName("Near-duplicate deals are reported with a high confidence")
        void nearDuplicate() {
            ComparableRecord a = acmeRenewal("A", "Acme Inc", 100000.0);
            ComparableRecord b = acmeRenewal("B", "ACME Incorporated", 101000.0);
            b = ComparableRecord.builder(b).dealName("Acme Renewal ").build();

            DetectionResult result = service.detect(a, DetectionOptions.against(List.of(b)));

            assertTrue(result.isDuplicate());
            assertEquals("B", result.topMatch().orElseThrow().matchedEntityId());
            assertTrue(result.confidence() >= 0.85);
            assertTrue(result.suggestedAction() == SuggestedAction.AUTO_MERGE
                    || result.suggestedAction() == SuggestedAction.MANUAL_REVIEW);
            assertEquals(1, result.matchCount());
        }

        @Test
        @DisplayName("An empty pool yields the empty result")
        void emptyPool() {
            DetectionResult result = service.detect(acmeRenewal("X", "Acme", 1.0), DetectionOptions.against(List.of()));

            assertFalse(result.isDuplicate());
            assertTrue(result.matches().isEmpty());
            assertEquals(SuggestedAction.NO_ACTION, result.suggestedAction());
            assertEquals(0.0, result.confidence());
            verifyNoInteractions(recordRepository);
        }

        @Test
        @DisplayName("The record itself and candidates without an id are never compared")
        void selfAndAnonymousExcluded() {
            ComparableRecord record = acmeRenewal("A", "Acme", 1000.0);
            ComparableRecord anonymous = acmeRenewal(null, "Acme", 1000.0);

            DetectionResult result = service.detect(record, DetectionOptions.against(List.of(record, anonymous)));

            assertEquals(DetectionResult.empty(), result);
        }

        @Test
        @DisplayName("Supplied pools never produce side effects")
        void noSideEffects() {
            ComparableRecord a = acmeRenewal("A", "Acme", 1000.0);
            ComparableRecord b = acmeRenewal("B", "Acme", 1000.0);

            DetectionResult result = service.detect(a, DetectionOptions.against(List.of(b)));

            assertTrue(result.isDuplicate());
            verifyNoInteractions(notifier);
            assertEquals(0, logRepository.count());
        }

        @Test
        @DisplayName("Only the selected strategies run")
        void strategySelection() {
            ComparableRecord a = ComparableRecord.builder().id("A").dealName("Enterprise License Renewal")
                    .customerName("Acme Corp").build();
            ComparableRecord b = ComparableRecord.builder().id("B").dealName("Enterprise Licence Renewal")
                    .customerName("Acme Corp").build();

            DetectionResult exactOnly = service.detect(a, DetectionOptions.builder()
                    .candidates(List.of(b)).strategies(StrategyType.EXACT_MATCH).build());
            DetectionResult fuzzyOnly = service.detect(a, DetectionOptions.builder()
                    .candidates(List.of(b)).strategies(StrategyType.FUZZY_NAME).build());

            assertFalse(exactOnly.isDuplicate());
            assertTrue(fuzzyOnly.isDuplicate());
            assertEquals(StrategyType.FUZZY_NAME, fuzzyOnly.topMatch().orElseThrow().strategy());
        }

        @Test
        @DisplayName("An explicit threshold can surface matches that suggest no action")
        void explicitThreshold() {
            LocalDate close = LocalDate.of(2024, 3, 31);
            ComparableRecord a = ComparableRecord.builder().id("A").dealName("Renewal").customerName("Acme")
                    .dealValue(500.0).closeDate(close).build();
            ComparableRecord b = ComparableRecord.builder(a).id("B").build();
            DetectionOptions.Builder options = DetectionOptions.builder()
                    .candidates(List.of(b))
                    .strategies(StrategyType.MULTI_FACTOR);

            DetectionResult byDefault = service.detect(a, options.build());
            DetectionResult lowered = service.detect(a, options.threshold(0.7).build());

            assertFalse(byDefault.isDuplicate());
            assertTrue(lowered.isDuplicate());
            assertEquals(0.75, lowered.confidence(), 1e-9);
            assertEquals(SuggestedAction.NO_ACTION, lowered.suggestedAction());
        }

        @Test
        @DisplayName("Metrics are recorded for every detection")
        void metricsRecorded() {
            ComparableRecord a = acmeRenewal("A", "Acme", 1000.0);
            ComparableRecord b = acmeRenewal("B", "Acme", 1000.0);

            service.detect(a, DetectionOptions.against(List.of(b)));

            verify(metricsService).recordDetectionDuration(eq(SuggestedAction.AUTO_MERGE), any());
            verify(metricsService).recordMatchCount(1);
            verify(metricsService).recordTopConfidence(1.0);
            verify(metricsService).incrementStrategyMatches(StrategyType.EXACT_MATCH, 1);
        }
    }

    @Nested
    @DisplayName("Detection against the repository")
    class RepositoryPoolTests {

        @Test
        @DisplayName("Logs the top match and notifies when the record has an id")
        void sideEffects() {
            ComparableRecord stored = acmeRenewal("deal-1", "Acme", 1000.0);
            ComparableRecord incoming = acmeRenewal("deal-2", "Acme Inc", 1000.0);
            when(recordRepository.findCandidates(incoming)).thenReturn(List.of(stored));

            DetectionResult result = service.detect(incoming);

            assertEquals(SuggestedAction.AUTO_MERGE, result.suggestedAction());
            ArgumentCaptor<DuplicateDetectedEvent> event = ArgumentCaptor.forClass(DuplicateDetectedEvent.class);
            verify(notifier).notifyDuplicate(event.capture());
            assertEquals("deal-2", event.getValue().dealId());
            assertEquals("auto_merge", event.getValue().suggestedAction());

            DetectionLogEntry entry = logRepository.findByPair(EntityKind.DEAL, "deal-1", "deal-2").orElseThrow();
            assertEquals(1.0, entry.confidence());
            assertEquals(StrategyType.EXACT_MATCH, entry.strategy());
        }

        @Test
        @DisplayName("Records without an id produce no side effects")
        void noIdNoSideEffects() {
            ComparableRecord stored = acmeRenewal("deal-1", "Acme", 1000.0);
            ComparableRecord incoming = acmeRenewal(null, "Acme", 1000.0);
            when(recordRepository.findCandidates(incoming)).thenReturn(List.of(stored));

            assertTrue(service.detect(incoming).isDuplicate());
            verifyNoInteractions(notifier);
            assertEquals(0, logRepository.count());
        }

        @Test
        @DisplayName("A failing notifier does not fail detection and is counted")
        void notifierFailureSwallowed() {
            ComparableRecord stored = acmeRenewal("deal-1", "Acme", 1000.0);
            ComparableRecord incoming = acmeRenewal("deal-2", "Acme", 1000.0);
            when(recordRepository.findCandidates(incoming)).thenReturn(List.of(stored));
            doThrow(new IllegalStateException("webhook down")).when(notifier).notifyDuplicate(any());

            DetectionResult result = assertDoesNotThrow(() -> service.detect(incoming));

            assertTrue(result.isDuplicate());
            verify(metricsService).incrementSideEffectFailure(DuplicateDetectionService.NOTIFICATION_SIDE_EFFECT);
            assertEquals(1, logRepository.count());
        }

        @Test
        @DisplayName("A repository failure aborts detection as CandidateLookupException")
        void repositoryFailure() {
            ComparableRecord incoming = acmeRenewal("deal-2", "Acme", 1000.0);
            IllegalStateException cause = new IllegalStateException("connection reset");
            when(recordRepository.findCandidates(incoming)).thenThrow(cause);

            CandidateLookupException thrown = assertThrows(CandidateLookupException.class,
                    () -> service.detect(incoming));

            assertSame(cause, thrown.getCause());
            verifyNoInteractions(notifier);
            verify(metricsService, never()).recordMatchCount(anyInt());
        }

        @Test
        @DisplayName("A CandidateLookupException from the repository is rethrown as is")
        void lookupExceptionPassesThrough() {
            CandidateLookupException failure = new CandidateLookupException("timeout");
            when(recordRepository.findAll()).thenThrow(failure);

            assertSame(failure, assertThrows(CandidateLookupException.class, () -> service.fetchAll()));
        }
    }
}
