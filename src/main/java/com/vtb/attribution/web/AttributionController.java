package com.vtb.attribution.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.vtb.attribution.model.AttributionService;
import com.vtb.attribution.models.AttributionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST API контроллер атрибуции
 *
 * POST /api/v1/attribution
 * Content-Type: application/json
 * {"incident": "malware-fysbis attack-pattern-T1571"} или STIX бандл инцидента
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AttributionController {

    private final AttributionService attributionService;

    @PostMapping("/attribution")
    public ResponseEntity<?> attribute(@RequestBody(required = false) JsonNode request) {
        if (request == null || request.isNull()) {
            return ResponseEntity.ok(attributionService.predict((String) null));
        }

        AttributionResult result;
        if (request.has("objects")) {
            log.debug("Получен инцидент в виде STIX бандла: {} объектов", request.get("objects").size());
            result = attributionService.predict(request);
        } else if (request.has("incident")) {
            JsonNode incident = request.get("incident");
            // не строка обрабатывается как пустой ввод
            result = attributionService.predict(incident.isTextual() ? incident.asText() : null);
        } else if (request.isTextual()) {
            result = attributionService.predict(request.asText());
        } else {
            return ResponseEntity.badRequest()
                .body(Map.of("error", "Ожидается поле incident или STIX бандл с полем objects"));
        }
        return ResponseEntity.ok(result);
    }

    @GetMapping("/attribution/version")
    public ResponseEntity<Map<String, Object>> version() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("db_version", attributionService.getDbVersion().toString());
        body.put("state", attributionService.getState().name());
        return ResponseEntity.ok(body);
    }
}
