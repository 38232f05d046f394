package com.vtb.attribution.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.vtb.attribution.models.Entity;
import com.vtb.attribution.models.EntityType;
import com.vtb.attribution.models.IntrusionSetProfile;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Построение профиля группировки из STIX бандла.
 *
 * Допущения о входных данных:
 * <ul>
 *   <li>бандл описывает ровно одну группировку;</li>
 *   <li>в бандле лежат объекты, связанные с этой группировкой, и отношения к ней.</li>
 * </ul>
 * Эти допущения не проверяются: при нескольких intrusion-set берётся первый.
 */
@Slf4j
public final class IntrusionSetExtractor {

    static final String INTRUSION_SET = "intrusion-set";
    static final String RELATIONSHIP = "relationship";

    private IntrusionSetExtractor() {}

    public static Optional<IntrusionSetProfile> extract(List<JsonNode> bundleObjects) {
        if (bundleObjects == null || bundleObjects.isEmpty()) {
            return Optional.empty();
        }

        JsonNode intrusionSet = null;
        for (JsonNode object : bundleObjects) {
            if (INTRUSION_SET.equals(text(object, "type"))) {
                intrusionSet = object;
                break;
            }
        }
        if (intrusionSet == null) {
            log.debug("В бандле нет объекта intrusion-set");
            return Optional.empty();
        }

        String intrusionSetId = text(intrusionSet, "id");
        IntrusionSetProfile.Builder profile = IntrusionSetProfile.builder(intrusionSetId)
            .name(text(intrusionSet, "name"));

        Map<String, RelatedObject> relatedObjects = indexRelatedObjects(bundleObjects);

        for (JsonNode relationship : bundleObjects) {
            if (intrusionSetId.isEmpty() || !RELATIONSHIP.equals(text(relationship, "type"))) {
                continue;
            }
            String relationType = text(relationship, "relationship_type");
            String sourceRef = text(relationship, "source_ref");
            String targetRef = text(relationship, "target_ref");

            if (intrusionSetId.equals(sourceRef)) {
                addRelated(profile, relatedObjects, targetRef, relationType, false);
            }
            if (intrusionSetId.equals(targetRef)) {
                addRelated(profile, relatedObjects, sourceRef, relationType, true);
            }
        }

        IntrusionSetProfile result = profile.build();
        log.debug("Профиль {}: {} сущностей", result.label(), result.size());
        return Optional.of(result);
    }

    /**
     * Извлечь профили из набора бандлов. Ключом служит метка группировки
     * (имя + "_" + идентификатор); при совпадении меток побеждает последний бандл.
     */
    public static Map<String, IntrusionSetProfile> extractAll(List<List<JsonNode>> bundles) {
        Map<String, IntrusionSetProfile> profiles = new LinkedHashMap<>();
        if (bundles == null) {
            return profiles;
        }
        for (List<JsonNode> bundle : bundles) {
            extract(bundle).ifPresent(profile -> {
                IntrusionSetProfile previous = profiles.put(profile.label(), profile);
                if (previous != null) {
                    log.debug("Профиль {} перезаписан более поздним бандлом", profile.label());
                }
            });
        }
        log.info("Извлечено профилей группировок: {}", profiles.size());
        return profiles;
    }

    private static Map<String, RelatedObject> indexRelatedObjects(List<JsonNode> bundleObjects) {
        Map<String, RelatedObject> index = new HashMap<>();
        for (JsonNode object : bundleObjects) {
            String type = text(object, "type");
            if (RELATIONSHIP.equals(type) || INTRUSION_SET.equals(type)) {
                continue;
            }
            EntityType.fromStixType(type).ifPresent(entityType ->
                index.put(text(object, "id"), new RelatedObject(entityType, entityType.deriveSemanticId(object))));
        }
        return index;
    }

    private static void addRelated(IntrusionSetProfile.Builder profile,
                                   Map<String, RelatedObject> relatedObjects,
                                   String reference,
                                   String relationType,
                                   boolean subject) {
        RelatedObject related = relatedObjects.get(reference);
        if (related == null) {
            return;
        }
        profile.addEntity(Entity.builder()
            .identifier(reference)
            .entityType(related.type())
            .semanticId(related.semanticId())
            .subject(subject)
            .relation(relationType)
            .build());
    }

    static String text(JsonNode node, String field) {
        if (node == null) {
            return "";
        }
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText("") : "";
    }

    static List<JsonNode> objects(JsonNode bundle) {
        if (bundle == null) {
            return Collections.emptyList();
        }
        JsonNode objects = bundle.get("objects");
        if (objects == null || !objects.isArray()) {
            return Collections.emptyList();
        }
        List<JsonNode> result = new ArrayList<>(objects.size());
        objects.forEach(result::add);
        return result;
    }

    private record RelatedObject(EntityType type, String semanticId) {}
}
