package com.vtb.attribution.models;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Value;

/**
 * Объект, связанный с группировкой одним из отношений бандла.
 *
 * Идентичность сущности определяется парой (тип, идентификатор):
 * повторные отношения к тому же объекту не создают дубликатов.
 */
@Value
@Builder
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Entity {
    @EqualsAndHashCode.Include
    String identifier;
    @EqualsAndHashCode.Include
    EntityType entityType;
    String semanticId;
    /** true, если группировка является целью отношения (target_ref). */
    boolean subject;
    String relation;
}
