package com.vtb.attribution.training;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class StratifiedSplitTest {

    private static final int[] LABELS = {0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 1, 1, 1, 1, 1};

    @Test
    void testEachClassKeepsItsShare() {
        StratifiedSplit split = StratifiedSplit.of(LABELS, 0.2, 27);

        assertEquals(3, split.test().length);
        assertEquals(12, split.train().length);
        assertEquals(2, Arrays.stream(split.test()).filter(row -> LABELS[row] == 0).count());
        assertEquals(1, Arrays.stream(split.test()).filter(row -> LABELS[row] == 1).count());
    }

    @Test
    void testPartsAreDisjointAndComplete() {
        StratifiedSplit split = StratifiedSplit.of(LABELS, 0.2, 27);

        Set<Integer> rows = new HashSet<>();
        IntStream.of(split.train()).forEach(rows::add);
        IntStream.of(split.test()).forEach(row -> assertTrue(rows.add(row), "Строка в обеих выборках: " + row));
        assertEquals(LABELS.length, rows.size());
    }

    @Test
    void testSameSeedSameSplit() {
        StratifiedSplit first = StratifiedSplit.of(LABELS, 0.2, 27);
        StratifiedSplit second = StratifiedSplit.of(LABELS, 0.2, 27);

        assertArrayEquals(first.train(), second.train());
        assertArrayEquals(first.test(), second.test());
    }

    @Test
    void testEveryClassInBothParts() {
        StratifiedSplit split = StratifiedSplit.of(new int[]{0, 0, 1, 1}, 0.01, 1);
        assertEquals(2, split.test().length, "Хотя бы один пример каждого класса в тесте");
        assertEquals(2, split.train().length);
    }

    @Test
    void testInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> StratifiedSplit.of(new int[]{0, 0, 1}, 0.2, 27));
        assertThrows(IllegalArgumentException.class, () -> StratifiedSplit.of(LABELS, 0.0, 27));
        assertThrows(IllegalArgumentException.class, () -> StratifiedSplit.of(LABELS, 1.0, 27));
    }
}
