package com.dealflow.dedup.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Model Tests")
class ModelTest {

    @Nested
    @DisplayName("DuplicateCluster")
    class DuplicateClusterTests {

        @Test
        @DisplayName("Key is independent of member order")
        void keyIsSorted() {
            assertEquals("a|b|c", DuplicateCluster.keyFor(List.of("c", "a", "b")));
            assertEquals(DuplicateCluster.keyFor(List.of("b", "a")), DuplicateCluster.keyFor(List.of("a", "b")));
        }

        @Test
        @DisplayName("Active cluster sorts members and derives the key")
        void active() {
            DuplicateCluster cluster = DuplicateCluster.active(EntityKind.DEAL, List.of("z", "m"), 0.85);

            assertEquals(List.of("m", "z"), cluster.memberIds());
            assertEquals("m|z", cluster.clusterKey());
            assertEquals(ClusterStatus.ACTIVE, cluster.status());
            assertEquals(2, cluster.clusterSize());
            assertTrue(cluster.contains("z"));
            assertFalse(cluster.contains("q"));
        }

        @Test
        @DisplayName("Cluster ids follow cluster_<millis>_<9 chars>")
        void generatedId() {
            String id = DuplicateCluster.generateClusterId();

            assertTrue(id.matches("cluster_\\d+_[0-9a-z]{9}"), id);
            assertNotEquals(id, DuplicateCluster.generateClusterId());
        }

        @Test
        @DisplayName("Fewer than two members is rejected")
        void tooSmall() {
            assertThrows(IllegalArgumentException.class,
                    () -> DuplicateCluster.active(EntityKind.DEAL, List.of("solo"), 0.9));
        }

        @ParameterizedTest
        @DisplayName("Confidence must lie in [0,1]")
        @ValueSource(doubles = {-0.01, 1.01})
        void confidenceRange(double confidence) {
            assertThrows(IllegalArgumentException.class,
                    () -> DuplicateCluster.active(EntityKind.DEAL, List.of("a", "b"), confidence));
        }

        @Test
        @DisplayName("Explicit key and timestamp are kept")
        void explicitFields() {
            Instant createdAt = Instant.parse("2024-03-01T10:00:00Z");
            DuplicateCluster cluster = new DuplicateCluster("c1", "custom", EntityKind.VENDOR,
                    List.of("a", "b"), 0.9, createdAt, ClusterStatus.MERGED);

            assertEquals("custom", cluster.clusterKey());
            assertEquals(createdAt, cluster.createdAt());
        }
    }

    @Nested
    @DisplayName("SimilarityFactors")
    class SimilarityFactorsTests {

        @Test
        @DisplayName("Keyed map follows factor order, not insertion order")
        void keyedMapOrder() {
            SimilarityFactors factors = SimilarityFactors.builder()
                    .put(SimilarityFactor.CONTACTS, 0.5)
                    .put(SimilarityFactor.DEAL_NAME, 0.9)
                    .build();

            assertEquals(List.of("dealName", "contacts"), List.copyOf(factors.toKeyedMap().keySet()));
            assertEquals(2, factors.size());
            assertEquals(0.9, factors.get(SimilarityFactor.DEAL_NAME).getAsDouble());
            assertTrue(factors.get(SimilarityFactor.PRODUCTS).isEmpty());
        }

        @ParameterizedTest
        @DisplayName("Scores outside [0,1] are rejected")
        @ValueSource(doubles = {-0.5, 1.5, Double.NaN})
        void range(double score) {
            assertThrows(IllegalArgumentException.class,
                    () -> SimilarityFactors.builder().put(SimilarityFactor.DEAL_VALUE, score));
        }

        @Test
        @DisplayName("Equal scores are equal factors")
        void equality() {
            SimilarityFactors a = SimilarityFactors.builder().put(SimilarityFactor.CLOSE_DATE, 0.7).build();
            SimilarityFactors b = SimilarityFactors.builder().put(SimilarityFactor.CLOSE_DATE, 0.7).build();

            assertEquals(a, b);
            assertEquals(a.hashCode(), b.hashCode());
            assertNotEquals(SimilarityFactors.empty(), a);
        }
    }

    @Nested
    @DisplayName("MatchCandidate and DetectionResult")
    class MatchTests {

        private final ComparableRecord matched = ComparableRecord.builder().id("m1").dealName("Deal").build();

        @Test
        @DisplayName("Similarity score mirrors confidence")
        void ofMirrorsConfidence() {
            MatchCandidate candidate = MatchCandidate.of(matched, 0.9, StrategyType.FUZZY_NAME, null, null);

            assertEquals("m1", candidate.matchedEntityId());
            assertEquals(0.9, candidate.similarityScore());
            assertEquals(SimilarityFactors.empty(), candidate.factors());
            assertEquals("", candidate.reasoning());
        }

        @Test
        @DisplayName("Confidence outside [0,1] is rejected")
        void invalidConfidence() {
            assertThrows(IllegalArgumentException.class,
                    () -> MatchCandidate.of(matched, 1.2, StrategyType.EXACT_MATCH, null, null));
            assertThrows(NullPointerException.class,
                    () -> MatchCandidate.of(matched, 0.5, null, null, null));
        }

        @Test
        @DisplayName("Empty result has no top match")
        void emptyResult() {
            DetectionResult empty = DetectionResult.empty();

            assertFalse(empty.isDuplicate());
            assertEquals(SuggestedAction.NO_ACTION, empty.suggestedAction());
            assertTrue(empty.topMatch().isEmpty());
            assertEquals(0, empty.matchCount());
        }

        @Test
        @DisplayName("Top match is the first entry")
        void topMatch() {
            MatchCandidate first = MatchCandidate.of(matched, 0.97, StrategyType.EXACT_MATCH, null, "exact");
            DetectionResult result = new DetectionResult(true, List.of(first), SuggestedAction.AUTO_MERGE, 0.97);

            assertSame(first, result.topMatch().orElseThrow());
            assertThrows(UnsupportedOperationException.class, () -> result.matches().add(first));
        }
    }

    @Nested
    @DisplayName("ComparableRecord")
    class ComparableRecordTests {

        @Test
        @DisplayName("Records with ids compare by id")
        void equalityById() {
            ComparableRecord a = ComparableRecord.builder().id("d1").dealName("One").build();
            ComparableRecord b = ComparableRecord.builder().id("d1").dealName("Other").build();
            ComparableRecord c = ComparableRecord.builder().dealName("One").build();

            assertEquals(a, b);
            assertEquals(a.hashCode(), b.hashCode());
            assertNotEquals(a, c);
        }

        @Test
        @DisplayName("Zero and missing deal values count as absent")
        void hasDealValue() {
            assertFalse(ComparableRecord.builder().build().hasDealValue());
            assertFalse(ComparableRecord.builder().dealValue(0.0).build().hasDealValue());
            assertTrue(ComparableRecord.builder().dealValue(1.0).build().hasDealValue());
        }

        @Test
        @DisplayName("Collections are copied and unmodifiable")
        void immutableCollections() {
            ComparableRecord record = ComparableRecord.builder()
                    .products(List.of("A"))
                    .attributes(Map.of("region", "EMEA"))
                    .build();

            assertThrows(UnsupportedOperationException.class, () -> record.getProducts().add("B"));
            assertEquals("EMEA", record.getAttributes().get("region"));
            assertNotNull(record.getCreatedAt());
        }

        @Test
        @DisplayName("Copy builder keeps every field")
        void copyBuilder() {
            ComparableRecord original = ComparableRecord.builder()
                    .id("d9").dealName("Deal").customerName("Acme").vendorId("v1").dealValue(5.0).build();

            ComparableRecord copy = ComparableRecord.builder(original).build();

            assertEquals("Acme", copy.getCustomerName());
            assertEquals("v1", copy.getVendorId());
            assertEquals(original.getCreatedAt(), copy.getCreatedAt());
        }
    }
}
