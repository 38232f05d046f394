package com.vtb.attribution.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.vtb.attribution.models.DatabaseVersion;
import lombok.Data;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Конфигурация атрибуции из YAML файла (attribution-config.yaml).
 * Отсутствующие секции и значения заполняются значениями по умолчанию.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AttributionConfig {

    static final String RESOURCE_NAME = "attribution-config.yaml";

    private Generator generator;
    private Training training;
    private Model model;

    /**
     * Загрузить конфигурацию из classpath. Каждый вызов возвращает новый экземпляр,
     * который вызывающий может менять.
     */
    public static AttributionConfig load() {
        try (InputStream is = AttributionConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (is == null) {
                throw new IllegalStateException(RESOURCE_NAME + " не найден в classpath");
            }
            return newMapper().readValue(is, AttributionConfig.class).ensureDefaults();
        } catch (IOException e) {
            throw new IllegalStateException("Ошибка загрузки конфигурации: " + e.getMessage(), e);
        }
    }

    /**
     * Загрузить конфигурацию из внешнего файла.
     */
    public static AttributionConfig load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Файл конфигурации не найден: " + path);
        }
        try (InputStream is = Files.newInputStream(path)) {
            return newMapper().readValue(is, AttributionConfig.class).ensureDefaults();
        } catch (IOException e) {
            throw new IllegalArgumentException("Ошибка чтения конфигурации " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Конфигурация только со значениями по умолчанию.
     */
    public static AttributionConfig defaults() {
        return new AttributionConfig().ensureDefaults();
    }

    AttributionConfig ensureDefaults() {
        if (generator == null) {
            generator = new Generator();
        }
        generator.ensureDefaults();
        if (training == null) {
            training = new Training();
        }
        training.ensureDefaults();
        if (model == null) {
            model = new Model();
        }
        model.ensureDefaults();
        return this;
    }

    private static ObjectMapper newMapper() {
        return new ObjectMapper(new YAMLFactory());
    }

    @Data
    public static class Generator {
        private static final int DEFAULT_MIN_SIZE = 10;
        private static final int DEFAULT_MAX_SIZE = 50;

        private Integer minSize;
        private Integer maxSize;
        private Double alpha;
        private Double beta;
        private Fractions fractions;

        private void ensureDefaults() {
            if (minSize == null) {
                minSize = DEFAULT_MIN_SIZE;
            }
            if (maxSize == null) {
                maxSize = DEFAULT_MAX_SIZE;
            }
            if (alpha == null) {
                alpha = 1.5;
            }
            if (beta == null) {
                beta = 10.0;
            }
            if (fractions == null) {
                fractions = new Fractions();
            }
            fractions.ensureDefaults();
        }
    }

    /**
     * Доли категорий в размере инцидента.
     */
    @Data
    public static class Fractions {
        private Double attackPatterns;
        private Double tools;
        private Double malwares;
        private Double other;

        private void ensureDefaults() {
            if (attackPatterns == null) {
                attackPatterns = 0.5;
            }
            if (tools == null) {
                tools = 0.2;
            }
            if (malwares == null) {
                malwares = 0.2;
            }
            if (other == null) {
                other = 0.1;
            }
        }
    }

    @Data
    public static class Training {
        private Integer perLabel;
        private Double testFraction;
        private Long seed;
        private String baselineVersion;

        private void ensureDefaults() {
            if (perLabel == null) {
                perLabel = 100;
            }
            if (testFraction == null) {
                testFraction = 0.2;
            }
            if (seed == null) {
                seed = 27L;
            }
            if (baselineVersion == null) {
                baselineVersion = DatabaseVersion.BASELINE.toString();
            }
        }

        public DatabaseVersion baseline() {
            return DatabaseVersion.parse(baselineVersion);
        }
    }

    @Data
    public static class Model {
        private String location;
        private String modelFile;
        private String metadataFile;
        private Integer topN;

        private void ensureDefaults() {
            if (location == null) {
                location = "data";
            }
            if (modelFile == null) {
                modelFile = "model.ser";
            }
            if (metadataFile == null) {
                metadataFile = "meta_data.json";
            }
            if (topN == null) {
                topN = 3;
            }
        }
    }
}
