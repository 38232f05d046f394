package com.vtb.attribution.models;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.Function;

/**
 * Типы STIX объектов, которые могут быть связаны с группировкой (intrusion set).
 *
 * Каждый тип знает, как получить свой семантический идентификатор
 * и в какую категорию выборки он попадает при генерации инцидентов.
 */
public enum EntityType {
    ATTACK_PATTERN("attack-pattern", SamplingCategory.ATTACK_PATTERNS,
        node -> "attack-pattern-" + stripSpaces(text(node, "x_mitre_id").split("\\.", -1)[0])),
    MALWARE("malware", SamplingCategory.MALWARES,
        node -> "malware-" + stripSpaces(text(node, "name"))),
    TOOL("tool", SamplingCategory.TOOLS,
        node -> "tool-" + stripSpaces(text(node, "name"))),
    IDENTITY("identity", SamplingCategory.OTHER, node -> text(node, "id")),
    LOCATION("location", SamplingCategory.OTHER, node -> text(node, "id")),
    VULNERABILITY("vulnerability", SamplingCategory.OTHER, node -> text(node, "id")),
    INDICATOR("indicator", SamplingCategory.OTHER, node -> text(node, "id"));

    private final String stixType;
    private final SamplingCategory category;
    private final Function<JsonNode, String> semanticIdFunction;

    EntityType(String stixType, SamplingCategory category, Function<JsonNode, String> semanticIdFunction) {
        this.stixType = stixType;
        this.category = category;
        this.semanticIdFunction = semanticIdFunction;
    }

    public String getStixType() {
        return stixType;
    }

    public SamplingCategory getCategory() {
        return category;
    }

    /**
     * Семантический идентификатор объекта. Отсутствующие поля дают пустые строки.
     */
    public String deriveSemanticId(JsonNode stixObject) {
        return semanticIdFunction.apply(stixObject);
    }

    public static Optional<EntityType> fromStixType(String stixType) {
        if (stixType == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(type -> type.stixType.equals(stixType))
            .findFirst();
    }

    /**
     * Определить тип по префиксу STIX идентификатора ({@code malware--...}).
     */
    public static Optional<EntityType> fromStixId(String stixId) {
        if (stixId == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(type -> stixId.startsWith(type.stixType + "--"))
            .findFirst();
    }

    private static String text(JsonNode node, String field) {
        if (node == null) {
            return "";
        }
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText("") : "";
    }

    private static String stripSpaces(String value) {
        return value.replace(" ", "");
    }

    /**
     * Категории, между которыми распределяется размер синтетического инцидента.
     */
    public enum SamplingCategory {
        ATTACK_PATTERNS,
        TOOLS,
        MALWARES,
        OTHER
    }
}
