package com.ofacwatch.screening.classify;

/**
 * Context signals available to the classifier.
 *
 * @param keywordRelevant the mention's document passed the keyword relevance gate
 */
public record ClassificationContext(boolean keywordRelevant) {

    public static ClassificationContext relevant() {
        return new ClassificationContext(true);
    }

    public static ClassificationContext notRelevant() {
        return new ClassificationContext(false);
    }
}
