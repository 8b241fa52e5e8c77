package com.ofacwatch.screening.normalize;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Canonicalizes person names before matching.
 *
 * <p>Steps, in order:
 * <ol>
 *   <li>"Last, First" becomes "First Last" when exactly one comma separates two non-empty parts</li>
 *   <li>lowercase, NFKD decomposition, combining marks removed</li>
 *   <li>apostrophes dropped ("O'Brien" becomes "obrien"), every other non-letter becomes a space</li>
 *   <li>spelling variants mapped to their canonical token</li>
 *   <li>honorifics dropped, unless only honorifics remain</li>
 *   <li>whitespace collapsed</li>
 * </ol>
 *
 * <p>The output is a fixed point: {@code normalize(normalize(x)).equals(normalize(x))}.
 * Instances are immutable and thread-safe.
 */
public class NameNormalizer {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern APOSTROPHES = Pattern.compile("['’‘`´]");
    private static final Pattern NON_LETTERS = Pattern.compile("[^\\p{IsAlphabetic}]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    static final Set<String> HONORIFICS = Set.of(
            "mr", "mrs", "ms", "miss", "mx", "dr", "prof", "sir", "dame", "lord", "lady",
            "sr", "sra", "srta", "don", "dona", "doctor", "ing", "lic",
            "sheikh", "shaykh", "sheik", "imam", "mullah", "haji", "hajji",
            "gen", "general", "col", "colonel", "maj", "major", "capt", "captain", "lt", "sgt",
            "president", "presidente", "minister", "ministro", "senator", "senador", "hon", "rev");

    private final Map<String, String> variants;

    public NameNormalizer() {
        this(Map.of());
    }

    /**
     * @param nameVariants spelling variant to canonical token, e.g. {@code mohammed -> muhammad}
     * @throws IllegalArgumentException if a canonical token is itself a variant, which would break idempotence
     */
    public NameNormalizer(Map<String, String> nameVariants) {
        Map<String, String> cleaned = new HashMap<>();
        if (nameVariants != null) {
            nameVariants.forEach((variant, canonical) -> {
                String key = foldToken(variant);
                String value = foldToken(canonical);
                if (!key.isEmpty() && !value.isEmpty() && !key.equals(value)) {
                    cleaned.put(key, value);
                }
            });
        }
        for (String canonical : cleaned.values()) {
            if (cleaned.containsKey(canonical)) {
                throw new IllegalArgumentException("Canonical name token '" + canonical + "' is also mapped as a variant");
            }
        }
        this.variants = Collections.unmodifiableMap(cleaned);
    }

    public String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        String value = fold(reorderFamilyFirst(raw));
        value = NON_LETTERS.matcher(value).replaceAll(" ").trim();
        if (value.isEmpty()) {
            return "";
        }

        List<String> tokens = new ArrayList<>();
        for (String token : WHITESPACE.split(value)) {
            if (!token.isEmpty()) {
                tokens.add(variants.getOrDefault(token, token));
            }
        }
        return String.join(" ", dropHonorifics(tokens));
    }

    public Map<String, String> getVariants() {
        return variants;
    }

    private static String reorderFamilyFirst(String raw) {
        int comma = raw.indexOf(',');
        if (comma < 0 || raw.indexOf(',', comma + 1) >= 0) {
            return raw;
        }
        String family = raw.substring(0, comma).trim();
        String given = raw.substring(comma + 1).trim();
        if (family.isEmpty() || given.isEmpty()) {
            return raw;
        }
        return given + " " + family;
    }

    private static List<String> dropHonorifics(List<String> tokens) {
        List<String> kept = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            if (!HONORIFICS.contains(token)) {
                kept.add(token);
            }
        }
        return kept.isEmpty() ? tokens : kept;
    }

    // Lowercase twice: compatibility decomposition can surface uppercase letters (e.g. U+2103).
    private static String fold(String value) {
        String lowered = value.toLowerCase(Locale.ROOT);
        String decomposed = Normalizer.normalize(lowered, Normalizer.Form.NFKD);
        String stripped = COMBINING_MARKS.matcher(decomposed).replaceAll("");
        return APOSTROPHES.matcher(stripped.toLowerCase(Locale.ROOT)).replaceAll("");
    }

    private static String foldToken(String token) {
        if (token == null) {
            return "";
        }
        return NON_LETTERS.matcher(fold(token)).replaceAll("");
    }
}
