package com.ofacwatch.screening.index;

import com.ofacwatch.screening.domain.SanctionEntity;

import java.util.List;
import java.util.Set;

/**
 * A list entity with its distinct normalized names and the union of their blocking keys.
 */
public record IndexedEntity(SanctionEntity entity, List<String> normalizedNames, Set<String> blockingKeys) {

    public IndexedEntity {
        normalizedNames = List.copyOf(normalizedNames);
        blockingKeys = Set.copyOf(blockingKeys);
    }

    public String id() {
        return entity.id();
    }
}
