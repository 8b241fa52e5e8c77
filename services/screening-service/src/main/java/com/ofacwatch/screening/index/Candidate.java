package com.ofacwatch.screening.index;

import com.ofacwatch.screening.domain.SanctionEntity;

/**
 * An entity returned by a blocked lookup.
 *
 * @param preScore fraction of the query's blocking keys shared with the entity, in [0,1]
 */
public record Candidate(IndexedEntity indexed, double preScore) {

    public SanctionEntity entity() {
        return indexed.entity();
    }
}
