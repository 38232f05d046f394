package com.vtb.attribution.generator;

import com.vtb.attribution.config.AttributionConfig;
import com.vtb.attribution.models.Entity;
import com.vtb.attribution.models.EntityType.SamplingCategory;
import com.vtb.attribution.models.IntrusionSetProfile;
import com.vtb.attribution.models.SyntheticIncident;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Генератор синтетических инцидентов по профилю группировки.
 *
 * Размер инцидента берётся из {@link IncidentSizeDistribution} и ограничивается
 * числом сущностей профиля, затем делится между категориями по долям.
 * Техники, инструменты и ВПО выбираются с возвращением и затем дедуплицируются,
 * поэтому их фактическое число может быть меньше доли. Прочие сущности выбираются
 * без возвращения.
 */
public class IncidentGenerator {

    private final IncidentSizeDistribution sizeDistribution;
    private final Map<SamplingCategory, Double> fractions;
    private final RandomGenerator random;

    public IncidentGenerator() {
        this(AttributionConfig.defaults().getGenerator(), new Well19937c());
    }

    public IncidentGenerator(AttributionConfig.Generator settings, RandomGenerator random) {
        this.sizeDistribution = new IncidentSizeDistribution(
            settings.getMinSize(), settings.getMaxSize(), settings.getAlpha(), settings.getBeta());
        this.fractions = new EnumMap<>(SamplingCategory.class);
        AttributionConfig.Fractions configured = settings.getFractions();
        fractions.put(SamplingCategory.ATTACK_PATTERNS, configured.getAttackPatterns());
        fractions.put(SamplingCategory.TOOLS, configured.getTools());
        fractions.put(SamplingCategory.MALWARES, configured.getMalwares());
        fractions.put(SamplingCategory.OTHER, configured.getOther());
        this.random = random;
    }

    public SyntheticIncident generateIncident(IntrusionSetProfile profile) {
        return SyntheticIncident.builder()
            .label(profile.label())
            .tokens(generate(profile))
            .build();
    }

    /**
     * Семантические идентификаторы инцидента случайного размера.
     */
    public List<String> generate(IntrusionSetProfile profile) {
        return generate(profile, sizeDistribution.sample(random));
    }

    /**
     * Семантические идентификаторы инцидента с заданным целевым размером
     * (ограничивается числом сущностей профиля).
     */
    public List<String> generate(IntrusionSetProfile profile, int targetSize) {
        List<String> content = new ArrayList<>();
        if (profile == null || profile.isEmpty()) {
            return content;
        }
        int size = Math.min(targetSize, profile.size());

        content.addAll(sampleWithReplacement(profile.getAttackPatterns(), share(size, SamplingCategory.ATTACK_PATTERNS)));
        content.addAll(sampleWithReplacement(profile.getTools(), share(size, SamplingCategory.TOOLS)));
        content.addAll(sampleWithReplacement(profile.getMalwares(), share(size, SamplingCategory.MALWARES)));
        content.addAll(sampleWithoutReplacement(profile.otherEntities(), share(size, SamplingCategory.OTHER)));
        return content;
    }

    public IncidentSizeDistribution getSizeDistribution() {
        return sizeDistribution;
    }

    int share(int size, SamplingCategory category) {
        return (int) Math.ceil(size * fractions.get(category));
    }

    private List<String> sampleWithReplacement(List<Entity> source, int draws) {
        if (source.isEmpty() || draws <= 0) {
            return Collections.emptyList();
        }
        Set<Entity> selection = new LinkedHashSet<>();
        for (int i = 0; i < draws; i++) {
            selection.add(source.get(random.nextInt(source.size())));
        }
        List<String> result = new ArrayList<>(selection.size());
        for (Entity entity : selection) {
            result.add(entity.getSemanticId());
        }
        return result;
    }

    private List<String> sampleWithoutReplacement(List<Entity> source, int draws) {
        int count = Math.min(source.size(), draws);
        if (count <= 0) {
            return Collections.emptyList();
        }
        List<Entity> pool = new ArrayList<>(source);
        List<String> result = new ArrayList<>(count);
        // частичная перетасовка Фишера-Йетса
        for (int i = 0; i < count; i++) {
            int j = i + random.nextInt(pool.size() - i);
            Collections.swap(pool, i, j);
            result.add(pool.get(i).getSemanticId());
        }
        return result;
    }
}
