package com.ofacwatch.screening.extract;

import com.ofacwatch.screening.domain.Span;

import java.util.List;

/**
 * Finds PERSON spans in free text. Implementations must be pure functions of the text
 * and return an empty list rather than fail.
 */
public interface EntityExtractor {

    List<Span> extractPersons(String text);
}
