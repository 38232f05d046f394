package com.vtb.attribution.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.vtb.attribution.models.EntityType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Преобразование инцидента (STIX бандла) в строку для классификатора.
 *
 * Тип объекта определяется по префиксу его id, объекты прочих типов пропускаются.
 */
public final class IncidentParser {

    private IncidentParser() {}

    public static String toIncidentString(JsonNode incident) {
        List<String> tokens = new ArrayList<>();
        for (JsonNode object : IntrusionSetExtractor.objects(incident)) {
            String id = IntrusionSetExtractor.text(object, "id");
            Optional<EntityType> type = EntityType.fromStixId(id);
            type.ifPresent(entityType -> tokens.add(entityType.deriveSemanticId(object)));
        }
        return String.join(" ", tokens);
    }
}
