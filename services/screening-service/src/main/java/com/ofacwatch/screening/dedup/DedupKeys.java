package com.ofacwatch.screening.dedup;

import org.apache.commons.codec.digest.DigestUtils;

import java.nio.charset.StandardCharsets;

/**
 * Derives dedup keys from (source item, entity) pairs.
 */
public final class DedupKeys {

    private DedupKeys() {
    }

    public static String of(String sourceItemId, String entityId) {
        String material = nullToEmpty(sourceItemId) + "|" + nullToEmpty(entityId) + "|";
        return DigestUtils.sha256Hex(material.getBytes(StandardCharsets.UTF_8));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
