package com.vtb.attribution.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Метаданные обученной модели (meta_data.json).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelMetadata {
    @JsonProperty("db_version")
    private String dbVersion;
    @JsonProperty("time_metadata_created")
    private Instant timeMetadataCreated;
    @JsonProperty("f1_score")
    private Double f1Score;
    @JsonProperty("labels")
    private Integer labels;
}
