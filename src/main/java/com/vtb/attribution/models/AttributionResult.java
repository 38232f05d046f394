package com.vtb.attribution.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Результат атрибуции инцидента.
 *
 * Поле {@code label} содержит либо ранжированный список групп с вероятностями,
 * либо целочисленный код ошибки.
 */
@Data
@Builder
@JsonPropertyOrder({"label", "db_version"})
public class AttributionResult {

    /** Пустой или некорректный текст инцидента. */
    public static final int EMPTY_INPUT = -1;
    /** Модель не загружена. */
    public static final int NO_MODEL = -2;
    /** Ошибка во время предсказания. */
    public static final int PREDICT_ERROR = -3;

    @JsonIgnore
    private Integer status;
    @JsonIgnore
    @Builder.Default
    private List<String> labels = new ArrayList<>();
    @JsonIgnore
    @Builder.Default
    private List<Double> probabilities = new ArrayList<>();
    @JsonProperty("db_version")
    private String dbVersion;

    public static AttributionResult sentinel(int status, DatabaseVersion version) {
        return AttributionResult.builder()
            .status(status)
            .dbVersion(String.valueOf(version))
            .build();
    }

    @JsonIgnore
    public boolean isRanked() {
        return status == null;
    }

    /**
     * Лучшая метка или null, если вместо ранжирования вернулся код ошибки.
     */
    @JsonIgnore
    public String getTopLabel() {
        return isRanked() && !labels.isEmpty() ? labels.get(0) : null;
    }

    @JsonProperty("label")
    public Object getLabel() {
        if (!isRanked()) {
            return status;
        }
        return new RankedLabels(labels, probabilities);
    }

    public record RankedLabels(@JsonProperty("labels") List<String> labels,
                               @JsonProperty("probas") List<Double> probas) {
    }
}
