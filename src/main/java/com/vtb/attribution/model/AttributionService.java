package com.vtb.attribution.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.vtb.attribution.config.AttributionConfig;
import com.vtb.attribution.models.AttributionResult;
import com.vtb.attribution.models.DatabaseVersion;
import com.vtb.attribution.models.ModelMetadata;
import com.vtb.attribution.parser.IncidentParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Атрибуция инцидентов по обученной модели.
 *
 * Модель загружается лениво при первом предсказании и кэшируется на время
 * жизни сервиса. Если загрузка не удалась, сервис переходит в состояние
 * {@link State#DEGRADED} и повторяет попытку при следующем вызове.
 * Загрузка защищена блокировкой: параллельные вызовы загружают модель один раз.
 *
 * {@link #predict(String)} никогда не бросает исключений: ошибки кодируются
 * в {@link AttributionResult}.
 */
public class AttributionService {

    public enum State {
        UNINITIALIZED,
        READY,
        DEGRADED
    }

    private final ModelArtifacts artifacts;
    private final int topN;
    private final Logger log;
    private final Object loadLock = new Object();

    private volatile AttributionModel model;
    private volatile DatabaseVersion dbVersion;
    private volatile State state;

    public AttributionService(AttributionConfig.Model settings) {
        this(new ModelArtifacts(new FileArtifactStore(Path.of(settings.getLocation())),
                settings.getMetadataFile(), settings.getModelFile()),
            settings.getTopN(), DatabaseVersion.BASELINE, LoggerFactory.getLogger(AttributionService.class));
    }

    public AttributionService(ModelArtifacts artifacts, int topN, DatabaseVersion initialVersion, Logger log) {
        if (topN <= 0) {
            throw new IllegalArgumentException("topN должен быть положительным: " + topN);
        }
        this.artifacts = artifacts;
        this.topN = topN;
        this.dbVersion = initialVersion != null ? initialVersion : DatabaseVersion.BASELINE;
        this.log = log;
        this.state = State.UNINITIALIZED;
        if (artifacts != null) {
            log.info("Модель хранится в {}", artifacts.describeModel());
        }
    }

    /**
     * Сервис поверх уже обученной модели, без хранилища.
     */
    public static AttributionService ofModel(AttributionModel model, int topN) {
        AttributionService service = new AttributionService(null, topN,
            model.getVersion(), LoggerFactory.getLogger(AttributionService.class));
        service.model = model;
        service.state = State.READY;
        return service;
    }

    /**
     * Атрибутировать инцидент, заданный строкой семантических идентификаторов.
     */
    public AttributionResult predict(String incident) {
        if (incident == null || incident.isEmpty()) {
            return AttributionResult.sentinel(AttributionResult.EMPTY_INPUT, dbVersion);
        }
        AttributionModel current = ensureLoaded();
        if (current == null) {
            return AttributionResult.sentinel(AttributionResult.NO_MODEL, dbVersion);
        }
        try {
            double[] probabilities = current.predictProbabilities(incident);
            List<String> classes = current.getClasses();
            List<Integer> ranking = IntStream.range(0, probabilities.length)
                .boxed()
                .sorted(Comparator.comparingDouble((Integer i) -> probabilities[i]).reversed())
                .limit(topN)
                .toList();

            List<String> labels = new ArrayList<>(ranking.size());
            List<Double> probas = new ArrayList<>(ranking.size());
            for (int index : ranking) {
                labels.add(classes.get(index));
                probas.add(probabilities[index]);
            }
            return AttributionResult.builder()
                .labels(labels)
                .probabilities(probas)
                .dbVersion(dbVersion.toString())
                .build();
        } catch (Exception e) {
            log.warn("Не удалось выполнить предсказание для {}", incident);
            log.error("Ошибка предсказания", e);
        }
        return AttributionResult.sentinel(AttributionResult.PREDICT_ERROR, dbVersion);
    }

    /**
     * Атрибутировать инцидент в виде STIX бандла.
     */
    public AttributionResult predict(JsonNode incidentBundle) {
        if (incidentBundle == null) {
            return AttributionResult.sentinel(AttributionResult.EMPTY_INPUT, dbVersion);
        }
        return predict(IncidentParser.toIncidentString(incidentBundle));
    }

    /**
     * Загрузить модель, если она ещё не загружена.
     *
     * @return модель или null, если загрузить её не удалось
     */
    AttributionModel ensureLoaded() {
        AttributionModel current = model;
        if (current != null) {
            return current;
        }
        synchronized (loadLock) {
            if (model == null) {
                model = loadFiles();
                state = model != null ? State.READY : State.DEGRADED;
            }
            return model;
        }
    }

    private AttributionModel loadFiles() {
        if (artifacts == null) {
            return null;
        }
        try {
            ModelMetadata metadata = artifacts.readMetadata();
            log.info("Метаданные модели загружены из {}", artifacts.describeMetadata());
            dbVersion = DatabaseVersion.parse(metadata.getDbVersion());
            log.info("Версия модели {}, метаданные созданы {}", metadata.getDbVersion(), metadata.getTimeMetadataCreated());
        } catch (Exception e) {
            log.warn("Не удалось загрузить метаданные модели из {}", artifacts.describeMetadata());
            log.error("Ошибка загрузки метаданных", e);
        }

        try {
            AttributionModel loaded = artifacts.readModel();
            log.info("Модель загружена из {}", artifacts.describeModel());
            return loaded;
        } catch (Exception e) {
            log.warn("Не удалось загрузить модель из {}", artifacts.describeModel());
            log.error("Ошибка загрузки модели", e);
        }
        return null;
    }

    public State getState() {
        return state;
    }

    public DatabaseVersion getDbVersion() {
        return dbVersion;
    }

    public boolean isReady() {
        return state == State.READY;
    }
}
