package com.ofacwatch.screening.index;

import com.ofacwatch.screening.domain.SanctionEntity;
import com.ofacwatch.screening.exception.MalformedSnapshotException;
import com.ofacwatch.screening.normalize.NameNormalizer;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only lookup structure over one snapshot of the sanctions list.
 *
 * <p>Built once per snapshot generation and never mutated. Candidate retrieval goes
 * through an inverted index of blocking keys, so a lookup only touches entities that
 * share at least one key with the query.</p>
 */
public final class SanctionsIndex {

    private static final Comparator<Candidate> CANDIDATE_ORDER = Comparator
            .comparingDouble(Candidate::preScore).reversed()
            .thenComparing(candidate -> candidate.indexed().id());

    private final long generation;
    private final Instant builtAt;
    private final Map<String, IndexedEntity> entitiesById;
    private final Map<String, List<String>> postings;
    private final BlockingKeyStrategy blockingStrategy;

    private SanctionsIndex(long generation,
                           Instant builtAt,
                           Map<String, IndexedEntity> entitiesById,
                           Map<String, List<String>> postings,
                           BlockingKeyStrategy blockingStrategy) {
        this.generation = generation;
        this.builtAt = builtAt;
        this.entitiesById = entitiesById;
        this.postings = postings;
        this.blockingStrategy = blockingStrategy;
    }

    /**
     * Build an index over a snapshot.
     *
     * @throws MalformedSnapshotException if the snapshot is empty, an entity has an empty
     *                                    primary name or two entities share an identifier
     */
    public static SanctionsIndex build(List<SanctionEntity> entities,
                                       NameNormalizer normalizer,
                                       BlockingKeyStrategy blockingStrategy,
                                       long generation) throws MalformedSnapshotException {
        if (entities == null || entities.isEmpty()) {
            throw new MalformedSnapshotException("Snapshot contains no entities");
        }

        Map<String, IndexedEntity> byId = new LinkedHashMap<>();
        Map<String, List<String>> postings = new HashMap<>();

        for (SanctionEntity entity : entities) {
            String primary = normalizer.normalize(entity.primaryName());
            if (primary.isEmpty()) {
                throw new MalformedSnapshotException("Entity " + entity.id() + " has an empty primary name");
            }
            if (byId.containsKey(entity.id())) {
                throw new MalformedSnapshotException("Duplicate entity id " + entity.id());
            }

            Set<String> names = new LinkedHashSet<>();
            names.add(primary);
            for (String alias : entity.aliases()) {
                String normalized = normalizer.normalize(alias);
                if (!normalized.isEmpty()) {
                    names.add(normalized);
                }
            }

            Set<String> keys = new LinkedHashSet<>();
            for (String name : names) {
                keys.addAll(blockingStrategy.generateKeys(name));
            }

            byId.put(entity.id(), new IndexedEntity(entity, new ArrayList<>(names), keys));
            for (String key : keys) {
                postings.computeIfAbsent(key, k -> new ArrayList<>()).add(entity.id());
            }
        }

        return new SanctionsIndex(generation, Instant.now(),
                Collections.unmodifiableMap(byId), Collections.unmodifiableMap(postings), blockingStrategy);
    }

    /**
     * Every entity sharing at least one blocking key with the query, best pre-score first.
     */
    public List<Candidate> candidates(String normalizedName) {
        Set<String> queryKeys = blockingStrategy.generateKeys(normalizedName);
        if (queryKeys.isEmpty()) {
            return List.of();
        }

        Map<String, Integer> sharedKeys = new HashMap<>();
        for (String key : queryKeys) {
            for (String entityId : postings.getOrDefault(key, List.of())) {
                sharedKeys.merge(entityId, 1, Integer::sum);
            }
        }

        List<Candidate> candidates = new ArrayList<>(sharedKeys.size());
        sharedKeys.forEach((entityId, shared) -> candidates.add(
                new Candidate(entitiesById.get(entityId), (double) shared / queryKeys.size())));
        candidates.sort(CANDIDATE_ORDER);
        return candidates;
    }

    public Optional<IndexedEntity> find(String entityId) {
        return Optional.ofNullable(entitiesById.get(entityId));
    }

    public Collection<IndexedEntity> entities() {
        return entitiesById.values();
    }

    public int size() {
        return entitiesById.size();
    }

    public long generation() {
        return generation;
    }

    public Instant builtAt() {
        return builtAt;
    }
}
