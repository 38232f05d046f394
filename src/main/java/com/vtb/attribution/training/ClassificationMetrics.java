package com.vtb.attribution.training;

/**
 * Метрики качества многоклассовой классификации.
 */
public final class ClassificationMetrics {

    private ClassificationMetrics() {}

    /**
     * F1, усреднённый по классам с весом, равным числу истинных примеров класса.
     * Класс без предсказанных примеров получает precision = 0.
     */
    public static double weightedF1(int[] truth, int[] prediction, int numClasses) {
        if (truth.length != prediction.length) {
            throw new IllegalArgumentException(
                String.format("Размеры не совпадают: %d и %d", truth.length, prediction.length));
        }
        if (truth.length == 0) {
            return 0.0;
        }
        int[] truePositive = new int[numClasses];
        int[] predicted = new int[numClasses];
        int[] support = new int[numClasses];
        for (int i = 0; i < truth.length; i++) {
            support[truth[i]]++;
            predicted[prediction[i]]++;
            if (truth[i] == prediction[i]) {
                truePositive[truth[i]]++;
            }
        }

        double weighted = 0.0;
        for (int c = 0; c < numClasses; c++) {
            if (support[c] == 0) {
                continue;
            }
            double precision = predicted[c] == 0 ? 0.0 : (double) truePositive[c] / predicted[c];
            double recall = (double) truePositive[c] / support[c];
            double f1 = precision + recall == 0 ? 0.0 : 2 * precision * recall / (precision + recall);
            weighted += f1 * support[c];
        }
        return weighted / truth.length;
    }
}
