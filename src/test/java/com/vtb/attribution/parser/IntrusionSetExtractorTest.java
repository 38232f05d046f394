package com.vtb.attribution.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.vtb.attribution.models.Entity;
import com.vtb.attribution.models.IntrusionSetProfile;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.vtb.attribution.StixFixtures.attackPattern;
import static com.vtb.attribution.StixFixtures.bundles;
import static com.vtb.attribution.StixFixtures.intrusionSet;
import static com.vtb.attribution.StixFixtures.named;
import static com.vtb.attribution.StixFixtures.object;
import static com.vtb.attribution.StixFixtures.relationship;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты для построения профиля группировки
 */
class IntrusionSetExtractorTest {

    private static final String APT = "intrusion-set--apt-1";

    @Test
    void testBundleWithoutIntrusionSet() {
        List<JsonNode> bundle = List.of(
            named("tool", "tool--1", "Mimikatz"),
            relationship("tool--1", "uses", "malware--1"));

        assertTrue(IntrusionSetExtractor.extract(bundle).isEmpty(), "Без intrusion-set профиля нет");
        assertTrue(IntrusionSetExtractor.extract(List.of()).isEmpty());
        assertTrue(IntrusionSetExtractor.extract(null).isEmpty());
    }

    @Test
    void testRelationshipDirection() {
        List<JsonNode> bundle = List.of(
            intrusionSet(APT, "APT One"),
            attackPattern("attack-pattern--1", "T1003.001"),
            object("indicator", "indicator--1"),
            relationship(APT, "uses", "attack-pattern--1"),
            relationship("indicator--1", "indicates", APT));

        IntrusionSetProfile profile = IntrusionSetExtractor.extract(bundle).orElseThrow();

        Entity technique = profile.getAttackPatterns().get(0);
        assertEquals("attack-pattern-T1003", technique.getSemanticId());
        assertEquals("uses", technique.getRelation());
        assertFalse(technique.isSubject(), "Группировка источник отношения: сущность не субъект");

        Entity indicator = profile.getIndicators().get(0);
        assertEquals("indicator--1", indicator.getSemanticId());
        assertEquals("indicates", indicator.getRelation());
        assertTrue(indicator.isSubject(), "Группировка цель отношения: сущность субъект");
    }

    @Test
    void testRepeatedRelationshipsDeduplicated() {
        List<JsonNode> bundle = List.of(
            intrusionSet(APT, "APT One"),
            named("malware", "malware--1", "Plug X"),
            relationship(APT, "uses", "malware--1"),
            relationship(APT, "delivers", "malware--1"),
            relationship("malware--1", "attributed-to", APT));

        IntrusionSetProfile profile = IntrusionSetExtractor.extract(bundle).orElseThrow();
        assertEquals(1, profile.getMalwares().size());
        assertEquals("malware-PlugX", profile.getMalwares().get(0).getSemanticId());
        assertEquals("uses", profile.getMalwares().get(0).getRelation(), "Сохраняется первое отношение");
    }

    @Test
    void testOnlyDirectlyRelatedEntities() {
        List<JsonNode> bundle = List.of(
            intrusionSet(APT, "APT One"),
            named("tool", "tool--1", "PsExec"),
            named("malware", "malware--2", "Emotet"),
            relationship(APT, "uses", "tool--1"),
            relationship("tool--1", "drops", "malware--2"));

        IntrusionSetProfile profile = IntrusionSetExtractor.extract(bundle).orElseThrow();
        assertEquals(1, profile.size());
        assertTrue(profile.getMalwares().isEmpty(), "Опосредованно связанное ВПО не попадает в профиль");
    }

    @Test
    void testUnknownReferencesAndTypesSkipped() {
        List<JsonNode> bundle = List.of(
            intrusionSet(APT, "APT One"),
            object("campaign", "campaign--1"),
            relationship(APT, "uses", "tool--missing"),
            relationship("campaign--1", "attributed-to", APT));

        Optional<IntrusionSetProfile> profile = IntrusionSetExtractor.extract(bundle);
        assertTrue(profile.isPresent());
        assertTrue(profile.get().isEmpty());
        assertEquals("APT One_" + APT, profile.get().label());
    }

    @Test
    void testFirstIntrusionSetWins() {
        List<JsonNode> bundle = List.of(
            intrusionSet(APT, "APT One"),
            intrusionSet("intrusion-set--apt-2", "APT Two"),
            named("tool", "tool--1", "PsExec"),
            relationship("intrusion-set--apt-2", "uses", "tool--1"));

        IntrusionSetProfile profile = IntrusionSetExtractor.extract(bundle).orElseThrow();
        assertEquals(APT, profile.getIdentifier());
        assertTrue(profile.isEmpty());
    }

    @Test
    void testIntrusionSetWithoutIdHasEmptyProfile() {
        List<JsonNode> bundle = new ArrayList<>();
        bundle.add(named("intrusion-set", "", "Nameless"));
        bundle.add(named("tool", "tool--1", "PsExec"));
        bundle.add(relationship("", "uses", "tool--1"));

        IntrusionSetProfile profile = IntrusionSetExtractor.extract(bundle).orElseThrow();
        assertTrue(profile.isEmpty());
    }

    @Test
    void testExtractionIsIdempotent() {
        List<JsonNode> bundle = bundles().get(0);
        IntrusionSetProfile first = IntrusionSetExtractor.extract(bundle).orElseThrow();
        IntrusionSetProfile second = IntrusionSetExtractor.extract(bundle).orElseThrow();

        assertEquals(new HashSet<>(first.getAttackPatterns()), new HashSet<>(second.getAttackPatterns()));
        assertEquals(new HashSet<>(first.otherEntities()), new HashSet<>(second.otherEntities()));
        assertEquals(first.size(), second.size());
    }

    @Test
    void testFixtureBundles() {
        Map<String, IntrusionSetProfile> profiles = IntrusionSetExtractor.extractAll(bundles());
        assertEquals(3, profiles.size());

        IntrusionSetProfile alpha = profiles.values().stream()
            .filter(profile -> "APT Alpha".equals(profile.getName()))
            .findFirst()
            .orElseThrow();
        assertEquals(10, alpha.getAttackPatterns().size());
        assertEquals(3, alpha.getTools().size());
        assertEquals(2, alpha.getMalwares().size());
        assertEquals(19, alpha.size());
        assertTrue(alpha.getTools().stream().anyMatch(tool -> "tool-CobaltStrike".equals(tool.getSemanticId())));
        assertTrue(alpha.getIndicators().get(0).isSubject());

        IntrusionSetProfile gamma = profiles.values().stream()
            .filter(profile -> "APT Gamma".equals(profile.getName()))
            .findFirst()
            .orElseThrow();
        long t1204 = gamma.getAttackPatterns().stream()
            .filter(technique -> "attack-pattern-T1204".equals(technique.getSemanticId()))
            .count();
        assertEquals(2, t1204, "Разные подтехники с одной техникой остаются разными сущностями");
    }

    @Test
    void testLabelCollisionLastBundleWins() {
        List<JsonNode> first = List.of(
            intrusionSet(APT, "APT One"),
            named("tool", "tool--1", "PsExec"),
            relationship(APT, "uses", "tool--1"));
        List<JsonNode> second = List.of(
            intrusionSet(APT, "APT One"),
            named("malware", "malware--1", "Ryuk"),
            relationship(APT, "uses", "malware--1"));

        Map<String, IntrusionSetProfile> profiles = IntrusionSetExtractor.extractAll(List.of(first, second));
        assertEquals(1, profiles.size());
        IntrusionSetProfile profile = profiles.get("APT One_" + APT);
        assertTrue(profile.getTools().isEmpty());
        assertEquals(1, profile.getMalwares().size());
    }
}
