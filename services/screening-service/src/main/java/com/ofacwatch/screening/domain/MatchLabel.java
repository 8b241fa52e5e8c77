package com.ofacwatch.screening.domain;

/**
 * Classification labels, declared in ascending order of strength.
 */
public enum MatchLabel {
    NONE("Sin coincidencia"),
    CANDIDATE("Candidato por contexto"),
    MATCH("Posible match OFAC");

    private final String displayName;

    MatchLabel(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isReportable() {
        return this != NONE;
    }
}
