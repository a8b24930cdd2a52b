package com.dealflow.dedup.api;

import com.dealflow.dedup.core.model.ComparableRecord;
import com.dealflow.dedup.core.model.EntityKind;
import com.dealflow.dedup.core.model.StrategyType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DetectionOptions Tests")
class DetectionOptionsTest {

    @Test
    @DisplayName("Defaults query the repository with the configured threshold")
    void defaults() {
        DetectionOptions options = DetectionOptions.defaults();

        assertFalse(options.hasCandidates());
        assertNull(options.getCandidates());
        assertNull(options.getThreshold());
        assertNull(options.getStrategies());
        assertEquals(EntityKind.DEAL, options.getEntityKind());
    }

    @Test
    @DisplayName("An explicit pool is copied, even when empty")
    void against() {
        List<ComparableRecord> pool = new ArrayList<>();
        DetectionOptions options = DetectionOptions.against(pool);
        pool.add(ComparableRecord.builder().id("late").build());

        assertTrue(options.hasCandidates());
        assertTrue(options.getCandidates().isEmpty());
    }

    @Test
    @DisplayName("Zero is a valid explicit threshold")
    void zeroThreshold() {
        assertEquals(0.0, DetectionOptions.builder().threshold(0.0).build().getThreshold());
    }

    @ParameterizedTest
    @DisplayName("Thresholds outside [0,1] are rejected")
    @ValueSource(doubles = {-0.2, 1.0001, Double.NaN})
    void invalidThreshold(double threshold) {
        assertThrows(IllegalArgumentException.class, () -> DetectionOptions.builder().threshold(threshold));
    }

    @Test
    @DisplayName("Strategy varargs build an enabled set")
    void strategies() {
        DetectionOptions options = DetectionOptions.builder()
                .strategies(StrategyType.EXACT_MATCH, StrategyType.FUZZY_NAME)
                .build();

        assertEquals(Set.of(StrategyType.EXACT_MATCH, StrategyType.FUZZY_NAME), options.getStrategies());
    }

    @Test
    @DisplayName("Entity kind is required")
    void entityKindRequired() {
        assertThrows(IllegalArgumentException.class, () -> DetectionOptions.builder().entityKind(null));
    }

    @Test
    @DisplayName("toBuilder keeps pool and threshold")
    void toBuilder() {
        DetectionOptions original = DetectionOptions.builder()
                .candidates(List.of())
                .threshold(0.6)
                .entityKind(EntityKind.CONTACT)
                .build();

        DetectionOptions copy = original.toBuilder().build();

        assertTrue(copy.hasCandidates());
        assertEquals(0.6, copy.getThreshold());
        assertEquals(EntityKind.CONTACT, copy.getEntityKind());
    }
}
