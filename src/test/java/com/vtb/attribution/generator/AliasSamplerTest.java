package com.vtb.attribution.generator;

import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AliasSamplerTest {

    @Test
    void testFrequenciesFollowWeights() {
        AliasSampler sampler = new AliasSampler(new double[]{1, 0, 3});
        Well19937c random = new Well19937c(42);

        int[] counts = new int[3];
        int draws = 20000;
        for (int i = 0; i < draws; i++) {
            counts[sampler.sample(random)]++;
        }

        assertEquals(0, counts[1], "Исход с нулевым весом не выбирается");
        assertEquals(0.25, (double) counts[0] / draws, 0.02);
        assertEquals(0.75, (double) counts[2] / draws, 0.02);
    }

    @Test
    void testSingleOutcome() {
        AliasSampler sampler = new AliasSampler(new double[]{0.3});
        Well19937c random = new Well19937c(1);
        for (int i = 0; i < 100; i++) {
            assertEquals(0, sampler.sample(random));
        }
        assertEquals(1, sampler.size());
    }

    @Test
    void testInvalidWeights() {
        assertThrows(IllegalArgumentException.class, () -> new AliasSampler(new double[0]));
        assertThrows(IllegalArgumentException.class, () -> new AliasSampler(null));
        assertThrows(IllegalArgumentException.class, () -> new AliasSampler(new double[]{0, 0}));
        assertThrows(IllegalArgumentException.class, () -> new AliasSampler(new double[]{1, -1}));
        assertThrows(IllegalArgumentException.class, () -> new AliasSampler(new double[]{Double.NaN}));
    }
}
