package com.ofacwatch.screening.domain;

import org.apache.commons.codec.digest.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * A fetched item (feed entry, post) before extraction.
 *
 * @param publishedAt publication time when the source provides a parseable one, else null
 */
public record RawDocument(String sourceId, String text, String url, Instant publishedAt) {

    private static final int ITEM_ID_TEXT_PREFIX = 300;

    public RawDocument {
        text = text == null ? "" : text;
        url = url == null ? "" : url;
    }

    /**
     * Stable identifier of the item: SHA-256 of source id, url and the first 300 characters of text.
     */
    public String itemId() {
        String prefix = text.length() > ITEM_ID_TEXT_PREFIX ? text.substring(0, ITEM_ID_TEXT_PREFIX) : text;
        String material = nullToEmpty(sourceId) + "|" + url + "|" + prefix + "|";
        return DigestUtils.sha256Hex(material.getBytes(StandardCharsets.UTF_8));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
