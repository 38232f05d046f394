package com.vtb.attribution.models;

import com.vtb.attribution.model.AttributionModel;
import lombok.Builder;
import lombok.Data;

/**
 * Результат обучения: модель, F1 на тестовой выборке и итоговая версия.
 * При неудаче модель и F1 равны null.
 */
@Data
@Builder
public class TrainingResult {
    private AttributionModel model;
    private Double f1Score;
    private DatabaseVersion version;

    public static TrainingResult failed(DatabaseVersion version) {
        return TrainingResult.builder().version(version).build();
    }

    public boolean isSuccessful() {
        return model != null;
    }
}
