package com.vtb.attribution.training;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ClassificationMetricsTest {

    @Test
    void testPerfectPrediction() {
        int[] truth = {0, 1, 2, 2};
        assertEquals(1.0, ClassificationMetrics.weightedF1(truth, truth.clone(), 3), 1e-12);
    }

    @Test
    void testWeightedBySupport() {
        // класс 0: P = 1, R = 0.5; класс 1: P = 2/3, R = 1
        double f1 = ClassificationMetrics.weightedF1(new int[]{0, 0, 1, 1}, new int[]{0, 1, 1, 1}, 2);
        assertEquals((2.0 / 3 * 2 + 0.8 * 2) / 4, f1, 1e-9);
    }

    @Test
    void testNeverPredictedClass() {
        double f1 = ClassificationMetrics.weightedF1(new int[]{0, 1}, new int[]{1, 1}, 2);
        // класс 0: F1 = 0; класс 1: P = 0.5, R = 1, F1 = 2/3
        assertEquals(1.0 / 3, f1, 1e-9);
    }

    @Test
    void testInvalidInput() {
        assertThrows(IllegalArgumentException.class,
            () -> ClassificationMetrics.weightedF1(new int[]{0}, new int[]{0, 1}, 2));
        assertEquals(0.0, ClassificationMetrics.weightedF1(new int[0], new int[0], 2));
    }
}
