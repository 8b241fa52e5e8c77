package com.ofacwatch.screening.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One immutable record of the sanctions list. Superseded wholesale when a new snapshot loads.
 *
 * @param id          stable identifier (SDN uid)
 * @param primaryName name as listed, possibly in "LAST, First" form
 * @param aliases     known aliases in list order
 * @param kind        person, organization, vessel or other
 * @param listing     list name, programs and listing date
 */
public record SanctionEntity(
        String id,
        String primaryName,
        List<String> aliases,
        EntityKind kind,
        ListingMetadata listing
) {

    public SanctionEntity {
        Objects.requireNonNull(id, "id");
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
        kind = kind == null ? EntityKind.OTHER : kind;
        listing = listing == null ? ListingMetadata.unknown() : listing;
    }

    /**
     * Primary name followed by every alias.
     */
    public List<String> allNames() {
        List<String> names = new ArrayList<>(aliases.size() + 1);
        if (primaryName != null) {
            names.add(primaryName);
        }
        names.addAll(aliases);
        return Collections.unmodifiableList(names);
    }
}
