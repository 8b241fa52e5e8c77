package com.ofacwatch.screening.domain;

import java.util.Locale;

/**
 * Kind of a listed party. Only {@link #PERSON} is screened by default.
 */
public enum EntityKind {
    PERSON,
    ORGANIZATION,
    VESSEL,
    OTHER;

    /**
     * Map the {@code sdnType} element of the SDN XML to a kind.
     */
    public static EntityKind fromSdnType(String sdnType) {
        if (sdnType == null || sdnType.isBlank()) {
            return OTHER;
        }
        return switch (sdnType.trim().toLowerCase(Locale.ROOT)) {
            case "individual" -> PERSON;
            case "entity" -> ORGANIZATION;
            case "vessel" -> VESSEL;
            default -> OTHER;
        };
    }
}
