package com.vtb.attribution.training;

import com.fasterxml.jackson.databind.JsonNode;
import com.vtb.attribution.config.AttributionConfig;
import com.vtb.attribution.generator.IncidentGenerator;
import com.vtb.attribution.model.AttributionModel;
import com.vtb.attribution.models.DatabaseVersion;
import com.vtb.attribution.models.IntrusionSetProfile;
import com.vtb.attribution.models.SyntheticIncident;
import com.vtb.attribution.models.TrainingResult;
import com.vtb.attribution.parser.IntrusionSetExtractor;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smile.classification.DiscreteNaiveBayes;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Обучение модели атрибуции на синтетических инцидентах.
 *
 * Для каждой группировки генерируется {@code perLabel} инцидентов, датасет
 * стратифицированно делится 80/20, на обучающей части обучается бинарный
 * мешок токенов + Bernoulli Naive Bayes, на тестовой считается взвешенный F1.
 *
 * Ошибки обучения не пробрасываются: они логируются, а результат
 * возвращается без модели.
 */
public class AttributionTrainer {

    private final AttributionConfig.Training settings;
    private final IncidentGenerator generator;
    private final DatabaseVersion databaseVersion;
    private final Logger log;

    public AttributionTrainer(AttributionConfig config, DatabaseVersion suppliedVersion) {
        this(config, suppliedVersion,
            new IncidentGenerator(config.getGenerator(), new Well19937c()),
            LoggerFactory.getLogger(AttributionTrainer.class));
    }

    public AttributionTrainer(AttributionConfig config,
                              DatabaseVersion suppliedVersion,
                              IncidentGenerator generator,
                              Logger log) {
        this.settings = config.getTraining();
        this.generator = generator;
        this.log = log;
        this.databaseVersion = resolveVersion(suppliedVersion, settings.baseline());
        log.info("Версия данных модели: {}", databaseVersion);
    }

    /**
     * Если переданная версия строго новее базовой, к базовой версии
     * прибавляется единица в micro компоненте; иначе используется базовая.
     */
    public static DatabaseVersion resolveVersion(DatabaseVersion supplied, DatabaseVersion baseline) {
        if (supplied != null && supplied.isNewerThan(baseline)) {
            return baseline.incrementMicro();
        }
        return baseline;
    }

    /**
     * Извлечь профили из бандлов и обучить модель.
     */
    public TrainingResult retrain(List<List<JsonNode>> bundles) {
        log.info("Количество бандлов группировок: {}", bundles != null ? bundles.size() : 0);
        return train(IntrusionSetExtractor.extractAll(bundles));
    }

    /**
     * Синтетический датасет: {@code perLabel} инцидентов на каждую метку.
     */
    public List<SyntheticIncident> createIncidentData(Map<String, IntrusionSetProfile> profiles) {
        List<SyntheticIncident> incidents = new ArrayList<>();
        for (Map.Entry<String, IntrusionSetProfile> entry : profiles.entrySet()) {
            for (int i = 0; i < settings.getPerLabel(); i++) {
                incidents.add(SyntheticIncident.builder()
                    .label(entry.getKey())
                    .tokens(generator.generate(entry.getValue()))
                    .build());
            }
        }
        log.debug("Сгенерировано инцидентов: {}", incidents.size());
        return incidents;
    }

    public TrainingResult train(Map<String, IntrusionSetProfile> profiles) {
        try {
            List<SyntheticIncident> incidents = createIncidentData(profiles);

            Map<String, Integer> classIndex = new LinkedHashMap<>();
            profiles.keySet().stream().sorted().forEach(label -> classIndex.put(label, classIndex.size()));
            if (classIndex.size() < 2) {
                throw new IllegalArgumentException(
                    "Для обучения нужно минимум две группировки, получено: " + classIndex.size());
            }

            List<String> documents = new ArrayList<>(incidents.size());
            int[] labels = new int[incidents.size()];
            for (int i = 0; i < incidents.size(); i++) {
                documents.add(incidents.get(i).toDocument());
                labels[i] = classIndex.get(incidents.get(i).getLabel());
            }

            StratifiedSplit split = StratifiedSplit.of(labels, settings.getTestFraction(), settings.getSeed());

            BinaryTokenVectorizer vectorizer = new BinaryTokenVectorizer().fit(select(documents, split.train()));
            DiscreteNaiveBayes classifier = new DiscreteNaiveBayes(
                DiscreteNaiveBayes.Model.BERNOULLI, classIndex.size(), vectorizer.size());
            for (int row : split.train()) {
                classifier.update(vectorizer.transform(documents.get(row)), labels[row]);
            }

            AttributionModel model = new AttributionModel(
                vectorizer, classifier, new ArrayList<>(classIndex.keySet()), databaseVersion);

            int[] truth = new int[split.test().length];
            int[] predicted = new int[split.test().length];
            for (int i = 0; i < split.test().length; i++) {
                int row = split.test()[i];
                truth[i] = labels[row];
                predicted[i] = model.predictIndex(vectorizer.transform(documents.get(row)));
            }
            double f1 = ClassificationMetrics.weightedF1(truth, predicted, classIndex.size());
            log.info("Модель обучена: {} классов, {} признаков, F1 = {}",
                classIndex.size(), vectorizer.size(), String.format("%.4f", f1));

            return TrainingResult.builder()
                .model(model)
                .f1Score(f1)
                .version(databaseVersion)
                .build();
        } catch (Exception e) {
            log.warn("Не удалось обучить модель атрибуции: {}", e.getMessage());
            log.error("Ошибка обучения", e);
        }
        return TrainingResult.failed(databaseVersion);
    }

    public DatabaseVersion getDatabaseVersion() {
        return databaseVersion;
    }

    private static List<String> select(List<String> documents, int[] rows) {
        List<String> selected = new ArrayList<>(rows.length);
        for (int row : rows) {
            selected.add(documents.get(row));
        }
        return selected;
    }
}
