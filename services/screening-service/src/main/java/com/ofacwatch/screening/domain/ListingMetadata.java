package com.ofacwatch.screening.domain;

import java.time.LocalDate;
import java.util.List;

/**
 * Where an entity was listed: list name (e.g. SDN), sanctions programs and the listing date.
 */
public record ListingMetadata(String listName, List<String> programs, LocalDate listingDate) {

    public ListingMetadata {
        programs = programs == null ? List.of() : List.copyOf(programs);
    }

    public static ListingMetadata unknown() {
        return new ListingMetadata(null, List.of(), null);
    }
}
