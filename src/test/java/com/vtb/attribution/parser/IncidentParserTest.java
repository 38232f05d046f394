package com.vtb.attribution.parser;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;

import static com.vtb.attribution.StixFixtures.MAPPER;
import static com.vtb.attribution.StixFixtures.attackPattern;
import static com.vtb.attribution.StixFixtures.json;
import static com.vtb.attribution.StixFixtures.named;
import static com.vtb.attribution.StixFixtures.resource;
import static org.junit.jupiter.api.Assertions.*;

class IncidentParserTest {

    @Test
    void testIncidentFixtureMatchesExpectedString() throws Exception {
        String expected = Files.readString(resource("incidents/incident_str.txt")).strip();

        assertEquals(expected, IncidentParser.toIncidentString(json("incidents/incident.json")));
    }

    @Test
    void testObjectOrderPreservedAndUnknownTypesSkipped() {
        ObjectNode bundle = MAPPER.createObjectNode();
        ArrayNode objects = bundle.putArray("objects");
        objects.add(named("malware", "malware--1", "Shadow Pad"));
        objects.add(named("campaign", "campaign--1", "Operation X"));
        objects.add(attackPattern("attack-pattern--1", "T1105"));

        assertEquals("malware-ShadowPad attack-pattern-T1105", IncidentParser.toIncidentString(bundle));
    }

    @Test
    void testEmptyIncident() {
        assertEquals("", IncidentParser.toIncidentString(MAPPER.createObjectNode()));
        assertEquals("", IncidentParser.toIncidentString(null));
    }
}
