package com.ofacwatch.screening.index;

import java.util.Set;

/**
 * Strategy interface for generating blocking keys from normalized names.
 * Blocking keys narrow the candidate set for fuzzy matching so a lookup does not
 * compare a mention against the whole list.
 *
 * <p>Names that share at least one blocking key are potential candidates. Keys that
 * are too fine lose recall for misspelled names; that loss is accepted, not hidden.</p>
 */
public interface BlockingKeyStrategy {

    /**
     * @param normalizedName output of the name normalizer
     * @return blocking keys, never null, empty for an empty name
     */
    Set<String> generateKeys(String normalizedName);
}
