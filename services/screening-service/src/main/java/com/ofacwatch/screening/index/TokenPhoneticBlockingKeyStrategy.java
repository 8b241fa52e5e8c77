package com.ofacwatch.screening.index;

import org.apache.commons.codec.language.DoubleMetaphone;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Generates three kinds of keys:
 * <ul>
 *   <li>{@code t:<token>} for every token of at least three letters</li>
 *   <li>{@code p:<code>} the Double Metaphone code of the same tokens, so "smyth" meets "smith"</li>
 *   <li>{@code b:<first letter>:<length bucket>} one coarse key for the whole name</li>
 * </ul>
 * A query sharing no token, no phonetic code and no first-letter bucket with an alias
 * will not find it (e.g. transliterations that change the first letter and every consonant).
 */
public class TokenPhoneticBlockingKeyStrategy implements BlockingKeyStrategy {

    static final int MIN_TOKEN_LENGTH = 3;
    static final int LENGTH_BUCKET_WIDTH = 4;

    private final DoubleMetaphone doubleMetaphone = new DoubleMetaphone();

    @Override
    public Set<String> generateKeys(String normalizedName) {
        Set<String> keys = new LinkedHashSet<>();
        if (normalizedName == null || normalizedName.isBlank()) {
            return keys;
        }
        for (String token : normalizedName.split(" ")) {
            if (token.length() < MIN_TOKEN_LENGTH) {
                continue;
            }
            keys.add("t:" + token);
            String code = doubleMetaphone.doubleMetaphone(token);
            if (code != null && !code.isEmpty()) {
                keys.add("p:" + code);
            }
        }
        String compact = normalizedName.replace(" ", "");
        if (!compact.isEmpty()) {
            keys.add("b:" + compact.charAt(0) + ":" + compact.length() / LENGTH_BUCKET_WIDTH);
        }
        return keys;
    }
}
