package com.ofacwatch.screening.relevance;

import com.ofacwatch.screening.domain.RawDocument;
import com.ofacwatch.screening.domain.SourceConfig;

/**
 * Supplies the context flag that lets a mid-score mention become a CANDIDATE.
 */
public interface RelevanceGate {

    boolean isRelevant(RawDocument document, SourceConfig source);
}
