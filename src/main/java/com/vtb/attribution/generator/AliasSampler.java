package com.vtb.attribution.generator;

import org.apache.commons.math3.random.RandomGenerator;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Точный сэмплер дискретного распределения (метод псевдонимов Уолкера, вариант Воуза).
 *
 * Построение таблиц O(n), одна выборка O(1).
 */
public class AliasSampler {

    private final double[] probability;
    private final int[] alias;

    /**
     * @param weights неотрицательные веса исходов 0..n-1, нормировка не требуется
     */
    public AliasSampler(double[] weights) {
        if (weights == null || weights.length == 0) {
            throw new IllegalArgumentException("Распределение должно иметь хотя бы один исход");
        }
        int n = weights.length;
        double total = 0;
        for (double weight : weights) {
            if (weight < 0 || Double.isNaN(weight) || Double.isInfinite(weight)) {
                throw new IllegalArgumentException("Некорректный вес исхода: " + weight);
            }
            total += weight;
        }
        if (total <= 0) {
            throw new IllegalArgumentException("Сумма весов должна быть положительной");
        }

        probability = new double[n];
        alias = new int[n];
        double[] scaled = new double[n];
        Deque<Integer> small = new ArrayDeque<>();
        Deque<Integer> large = new ArrayDeque<>();
        for (int i = 0; i < n; i++) {
            scaled[i] = weights[i] * n / total;
            if (scaled[i] < 1.0) {
                small.push(i);
            } else {
                large.push(i);
            }
        }

        while (!small.isEmpty() && !large.isEmpty()) {
            int less = small.pop();
            int more = large.pop();
            probability[less] = scaled[less];
            alias[less] = more;
            scaled[more] = (scaled[more] + scaled[less]) - 1.0;
            if (scaled[more] < 1.0) {
                small.push(more);
            } else {
                large.push(more);
            }
        }
        // остаток из-за погрешности округления
        while (!large.isEmpty()) {
            int index = large.pop();
            probability[index] = 1.0;
            alias[index] = index;
        }
        while (!small.isEmpty()) {
            int index = small.pop();
            probability[index] = 1.0;
            alias[index] = index;
        }
    }

    public int sample(RandomGenerator random) {
        int column = random.nextInt(probability.length);
        return random.nextDouble() < probability[column] ? column : alias[column];
    }

    public int size() {
        return probability.length;
    }
}
