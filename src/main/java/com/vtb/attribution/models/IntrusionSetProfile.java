package com.vtb.attribution.models;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Профиль группировки: все сущности, связанные с ней отношениями бандла,
 * разложенные по типам.
 *
 * Экземпляр неизменяем, собирается через {@link Builder}.
 */
@Getter
public final class IntrusionSetProfile {

    private final String identifier;
    private final String name;
    private final List<Entity> attackPatterns;
    private final List<Entity> malwares;
    private final List<Entity> tools;
    private final List<Entity> identities;
    private final List<Entity> locations;
    private final List<Entity> vulnerabilities;
    private final List<Entity> indicators;

    private IntrusionSetProfile(Builder builder) {
        this.identifier = builder.identifier;
        this.name = builder.name;
        this.attackPatterns = freeze(builder, EntityType.ATTACK_PATTERN);
        this.malwares = freeze(builder, EntityType.MALWARE);
        this.tools = freeze(builder, EntityType.TOOL);
        this.identities = freeze(builder, EntityType.IDENTITY);
        this.locations = freeze(builder, EntityType.LOCATION);
        this.vulnerabilities = freeze(builder, EntityType.VULNERABILITY);
        this.indicators = freeze(builder, EntityType.INDICATOR);
    }

    public static Builder builder(String identifier) {
        return new Builder(identifier);
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Сущности заданного типа.
     */
    public List<Entity> entities(EntityType type) {
        return switch (type) {
            case ATTACK_PATTERN -> attackPatterns;
            case MALWARE -> malwares;
            case TOOL -> tools;
            case IDENTITY -> identities;
            case LOCATION -> locations;
            case VULNERABILITY -> vulnerabilities;
            case INDICATOR -> indicators;
        };
    }

    /**
     * Общее число различных сущностей во всех семи категориях.
     */
    public int size() {
        return attackPatterns.size() + malwares.size() + tools.size() + identities.size()
            + locations.size() + vulnerabilities.size() + indicators.size();
    }

    /**
     * Индикаторы, уязвимости, identity и локации одним списком (в этом порядке).
     */
    public List<Entity> otherEntities() {
        List<Entity> other = new ArrayList<>(indicators.size() + vulnerabilities.size()
            + identities.size() + locations.size());
        other.addAll(indicators);
        other.addAll(vulnerabilities);
        other.addAll(identities);
        other.addAll(locations);
        return other;
    }

    /**
     * Метка класса для обучения: имя группировки и её идентификатор.
     */
    public String label() {
        return (name != null ? name : "") + "_" + identifier;
    }

    private static List<Entity> freeze(Builder builder, EntityType type) {
        return Collections.unmodifiableList(new ArrayList<>(builder.entities.get(type)));
    }

    /**
     * Накопитель сущностей профиля. Повторное добавление сущности
     * с тем же (тип, идентификатор) игнорируется.
     */
    public static final class Builder {
        private final String identifier;
        private String name;
        private final Map<EntityType, Set<Entity>> entities = new EnumMap<>(EntityType.class);

        private Builder(String identifier) {
            this.identifier = identifier;
            for (EntityType type : EntityType.values()) {
                entities.put(type, new LinkedHashSet<>());
            }
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /**
         * @return false, если такая сущность уже была добавлена
         */
        public boolean addEntity(Entity entity) {
            return entities.get(entity.getEntityType()).add(entity);
        }

        public IntrusionSetProfile build() {
            return new IntrusionSetProfile(this);
        }
    }
}
