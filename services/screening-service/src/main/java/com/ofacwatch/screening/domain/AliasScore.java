package com.ofacwatch.screening.domain;

/**
 * Similarity of the query against one normalized name of an entity.
 */
public record AliasScore(String alias, double score) {
}
