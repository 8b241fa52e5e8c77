package com.ofacwatch.screening.source;

import com.ofacwatch.screening.domain.RawDocument;
import com.ofacwatch.screening.domain.SourceConfig;
import com.ofacwatch.screening.domain.SourceType;
import com.ofacwatch.screening.exception.FetchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * Fetches an RSS or Atom feed over HTTP.
 */
@Slf4j
@RequiredArgsConstructor
public class RssSourceFetcher implements SourceFetcher {

    private final RestTemplate restTemplate;
    private final RssFeedParser parser;

    @Override
    public List<RawDocument> fetch(SourceConfig source) throws FetchException {
        if (source.type() != SourceType.RSS) {
            throw new FetchException(source.sourceId(), "Unsupported source type " + source.type(), null);
        }
        if (source.url() == null || source.url().isBlank()) {
            throw new FetchException(source.sourceId(), "Source has no url", null);
        }

        String body;
        try {
            body = restTemplate.getForObject(source.url(), String.class);
        } catch (RestClientException e) {
            throw new FetchException(source.sourceId(), "Failed to fetch " + source.url() + ": " + e.getMessage(), e);
        }
        if (body == null || body.isBlank()) {
            log.info("Source {} returned an empty body", source.sourceId());
            return List.of();
        }

        try {
            return parser.parse(source.sourceId(), body);
        } catch (RuntimeException e) {
            throw new FetchException(source.sourceId(), "Unparseable feed from " + source.url(), e);
        }
    }
}
