package com.vtb.attribution.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vtb.attribution.models.ModelMetadata;
import com.vtb.attribution.models.TrainingResult;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.time.Instant;

/**
 * Два ресурса обученной модели: метаданные (JSON) и сериализованная модель.
 */
@Slf4j
public class ModelArtifacts {

    public static final String DEFAULT_METADATA_NAME = "meta_data.json";
    public static final String DEFAULT_MODEL_NAME = "model.ser";

    private final ArtifactStore store;
    private final String metadataName;
    private final String modelName;
    private final ObjectMapper objectMapper;

    public ModelArtifacts(ArtifactStore store) {
        this(store, DEFAULT_METADATA_NAME, DEFAULT_MODEL_NAME);
    }

    public ModelArtifacts(ArtifactStore store, String metadataName, String modelName) {
        this.store = store;
        this.metadataName = metadataName;
        this.modelName = modelName;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Сохранить результат обучения: сначала модель, затем метаданные.
     */
    public ModelMetadata save(TrainingResult result) throws IOException {
        if (result == null || !result.isSuccessful()) {
            throw new IllegalArgumentException("Нельзя сохранить результат неудачного обучения");
        }
        writeModel(result.getModel());
        ModelMetadata metadata = ModelMetadata.builder()
            .dbVersion(result.getVersion().toString())
            .timeMetadataCreated(Instant.now())
            .f1Score(result.getF1Score())
            .labels(result.getModel().getClasses().size())
            .build();
        writeMetadata(metadata);
        return metadata;
    }

    public void writeModel(AttributionModel model) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(buffer)) {
            out.writeObject(model);
        }
        store.write(modelName, buffer.toByteArray());
        log.info("Модель сохранена: {} ({} байт)", store.describe(modelName), buffer.size());
    }

    public void writeMetadata(ModelMetadata metadata) throws IOException {
        store.write(metadataName, objectMapper.writeValueAsBytes(metadata));
        log.info("Метаданные модели сохранены: {}", store.describe(metadataName));
    }

    public ModelMetadata readMetadata() throws IOException {
        return objectMapper.readValue(store.read(metadataName), ModelMetadata.class);
    }

    /**
     * @throws InvalidObjectException если в ресурсе лежит не модель атрибуции
     */
    public AttributionModel readModel() throws IOException {
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(store.read(modelName)))) {
            Object value = in.readObject();
            if (!(value instanceof AttributionModel model)) {
                throw new InvalidObjectException("Ресурс " + store.describe(modelName)
                    + " не содержит модель атрибуции: " + (value == null ? "null" : value.getClass().getName()));
            }
            return model;
        } catch (ClassNotFoundException e) {
            throw new InvalidObjectException("Неизвестный класс в артефакте модели: " + e.getMessage());
        }
    }

    public String describeMetadata() {
        return store.describe(metadataName);
    }

    public String describeModel() {
        return store.describe(modelName);
    }
}
