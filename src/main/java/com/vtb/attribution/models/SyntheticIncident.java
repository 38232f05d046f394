package com.vtb.attribution.models;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Синтетический инцидент: набор семантических идентификаторов с меткой группировки.
 */
@Data
@Builder
public class SyntheticIncident {
    /** Документ-заглушка для пустого инцидента. */
    public static final String PLACEHOLDER_DOCUMENT = " ";

    private String label;
    @Builder.Default
    private List<String> tokens = new ArrayList<>();

    /**
     * Текст для векторизатора: токены через пробел, либо одиночный пробел
     * если инцидент пуст.
     */
    public String toDocument() {
        if (tokens == null || tokens.isEmpty()) {
            return PLACEHOLDER_DOCUMENT;
        }
        return String.join(" ", tokens);
    }
}
