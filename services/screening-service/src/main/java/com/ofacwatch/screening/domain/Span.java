package com.ofacwatch.screening.domain;

/**
 * A PERSON span returned by the extractor.
 *
 * @param offset character offset of the span in the document text
 */
public record Span(String text, int offset) {
}
