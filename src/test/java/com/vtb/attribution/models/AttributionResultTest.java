package com.vtb.attribution.models;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты для JSON формы результата атрибуции
 */
class AttributionResultTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void testSentinelSerializedAsInteger() throws Exception {
        AttributionResult result = AttributionResult.sentinel(AttributionResult.NO_MODEL, DatabaseVersion.BASELINE);
        String json = mapper.writeValueAsString(result);

        assertEquals("{\"label\":-2,\"db_version\":\"(0, 0, 1)\"}", json);
        assertNull(result.getTopLabel());
    }

    @Test
    void testRankedLabelsSerialized() throws Exception {
        AttributionResult result = AttributionResult.builder()
            .labels(List.of("APT Alpha_x", "APT Beta_y"))
            .probabilities(List.of(0.9, 0.1))
            .dbVersion("(0, 0, 2)")
            .build();

        JsonNode json = mapper.readTree(mapper.writeValueAsString(result));
        assertEquals(2, json.size(), "Только label и db_version");
        assertEquals("APT Alpha_x", json.get("label").get("labels").get(0).asText());
        assertEquals(0.1, json.get("label").get("probas").get(1).asDouble(), 1e-12);
        assertEquals("(0, 0, 2)", json.get("db_version").asText());
        assertEquals("APT Alpha_x", result.getTopLabel());
    }
}
