package com.ofacwatch.screening.relevance;

import com.ofacwatch.screening.domain.RawDocument;
import com.ofacwatch.screening.domain.SourceConfig;

import java.util.List;
import java.util.Locale;

/**
 * A document is relevant when its text contains one of the source's keyword filters,
 * or one of the global keywords when the source defines none. No keywords means nothing is relevant.
 */
public class KeywordRelevanceGate implements RelevanceGate {

    private final List<String> defaultKeywords;

    public KeywordRelevanceGate(List<String> defaultKeywords) {
        this.defaultKeywords = lowerAll(defaultKeywords);
    }

    @Override
    public boolean isRelevant(RawDocument document, SourceConfig source) {
        List<String> keywords = source != null && !source.keywordFilters().isEmpty()
                ? lowerAll(source.keywordFilters())
                : defaultKeywords;
        if (keywords.isEmpty() || document == null) {
            return false;
        }
        String text = document.text().toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> lowerAll(List<String> keywords) {
        if (keywords == null) {
            return List.of();
        }
        return keywords.stream()
                .filter(keyword -> keyword != null && !keyword.isBlank())
                .map(keyword -> keyword.trim().toLowerCase(Locale.ROOT))
                .toList();
    }
}
