package com.ofacwatch.screening.source;

import com.ofacwatch.screening.domain.RawDocument;
import com.ofacwatch.screening.domain.SourceConfig;
import com.ofacwatch.screening.exception.FetchException;

import java.util.List;

/**
 * Retrieves the current items of a source.
 */
public interface SourceFetcher {

    /**
     * @throws FetchException on network or parsing failure
     */
    List<RawDocument> fetch(SourceConfig source) throws FetchException;
}
