package com.vtb.attribution.training;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Стратифицированное разбиение на обучающую и тестовую выборки
 * с фиксированным seed для воспроизводимости.
 */
public record StratifiedSplit(int[] train, int[] test) {

    /**
     * @param labels       метки классов строк датасета
     * @param testFraction доля тестовой выборки в каждом классе, (0, 1)
     * @param seed         seed генератора перестановок
     */
    public static StratifiedSplit of(int[] labels, double testFraction, long seed) {
        if (testFraction <= 0 || testFraction >= 1) {
            throw new IllegalArgumentException("Доля тестовой выборки должна быть в (0, 1): " + testFraction);
        }
        Map<Integer, List<Integer>> byClass = new LinkedHashMap<>();
        for (int i = 0; i < labels.length; i++) {
            byClass.computeIfAbsent(labels[i], key -> new ArrayList<>()).add(i);
        }

        Random random = new Random(seed);
        List<Integer> train = new ArrayList<>();
        List<Integer> test = new ArrayList<>();
        for (List<Integer> rows : byClass.values()) {
            if (rows.size() < 2) {
                throw new IllegalArgumentException("В каждом классе должно быть не меньше двух примеров");
            }
            Collections.shuffle(rows, random);
            int testSize = (int) Math.round(rows.size() * testFraction);
            testSize = Math.max(1, Math.min(rows.size() - 1, testSize));
            test.addAll(rows.subList(0, testSize));
            train.addAll(rows.subList(testSize, rows.size()));
        }
        Collections.sort(train);
        Collections.sort(test);
        return new StratifiedSplit(toArray(train), toArray(test));
    }

    private static int[] toArray(List<Integer> values) {
        return values.stream().mapToInt(Integer::intValue).toArray();
    }
}
