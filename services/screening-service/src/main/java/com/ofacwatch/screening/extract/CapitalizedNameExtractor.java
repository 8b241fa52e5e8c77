package com.ofacwatch.screening.extract;

import com.ofacwatch.screening.domain.Span;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristic person extractor: runs of at least two capitalized words, optionally joined by
 * name particles (de, del, bin, al, van, ...). Words that never start a person name
 * (articles, weekdays, months, institutions) split a run.
 *
 * <p>A word ending in a period closes the name unless it is an initial or a known
 * abbreviation, so a name never runs into the next sentence.</p>
 *
 * <p>Spans are deduplicated case-insensitively in order of appearance; spans shorter than
 * {@code minLength} characters are dropped.</p>
 */
public class CapitalizedNameExtractor implements EntityExtractor {

    private static final String WORD = "\\p{Lu}[\\p{L}'’\\-]*\\.?";
    private static final String PARTICLE = "(?:de|del|de la|da|dos|do|di|du|la|le|van|von|der|bin|ibn|al|el|abu|y)";
    private static final Pattern NAME_RUN = Pattern.compile(
            WORD + "(?:\\s+(?:" + PARTICLE + "\\s+)?" + WORD + ")+");

    private static final Pattern POSSESSIVE = Pattern.compile("['’]s$");

    private static final Set<String> NON_NAME_WORDS = Set.of(
            "the", "a", "an", "in", "on", "at", "for", "of", "and", "but", "or", "with", "by", "from", "to",
            "el", "la", "los", "las", "en", "con", "por", "para", "del", "un", "una",
            "monday", "tuesday", "wednesday", "thursday", "friday", "saturday", "sunday",
            "january", "february", "march", "april", "may", "june", "july", "august",
            "september", "october", "november", "december",
            "treasury", "department", "ministry", "office", "council", "court", "bank", "government",
            "secretary", "judge", "prosecutor", "attorney", "general", "police", "army", "news",
            "united", "states", "nations", "union", "reuters", "ofac", "sdn", "eu", "us", "uk");

    // Abbreviations that end in a period without ending the sentence
    private static final Set<String> ABBREVIATIONS = Set.of(
            "mr", "mrs", "ms", "dr", "sr", "sra", "jr", "st", "gen", "col", "lt", "capt", "sgt", "gov", "sen",
            "rep", "prof", "rev", "hon", "sheikh");

    private final int minLength;

    public CapitalizedNameExtractor() {
        this(3);
    }

    public CapitalizedNameExtractor(int minLength) {
        this.minLength = minLength;
    }

    @Override
    public List<Span> extractPersons(String text) {
        List<Span> spans = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return spans;
        }
        Set<String> seen = new HashSet<>();
        Matcher matcher = NAME_RUN.matcher(text);
        while (matcher.find()) {
            for (Span span : splitOnNonNameWords(matcher.group(), matcher.start())) {
                String key = span.text().toLowerCase(Locale.ROOT);
                if (span.text().length() >= minLength && seen.add(key)) {
                    spans.add(span);
                }
            }
        }
        return spans;
    }

    private static List<Span> splitOnNonNameWords(String run, int runOffset) {
        List<Span> parts = new ArrayList<>();
        String[] words = run.split("\\s+");
        int cursor = 0;
        int partStart = -1;
        int partEnd = -1;
        int wordsInPart = 0;
        for (String word : words) {
            int wordStart = run.indexOf(word, cursor);
            cursor = wordStart + word.length();
            String bare = word.replaceAll("[.’'\\-]+$", "").toLowerCase(Locale.ROOT);
            boolean capitalized = Character.isUpperCase(word.charAt(0));
            if (capitalized && NON_NAME_WORDS.contains(bare)) {
                addPart(parts, run, runOffset, partStart, partEnd, wordsInPart);
                partStart = -1;
                wordsInPart = 0;
                continue;
            }
            if (partStart < 0) {
                if (!capitalized) {
                    continue;
                }
                partStart = wordStart;
            }
            if (capitalized) {
                partEnd = cursor;
                wordsInPart++;
                if (endsSentence(word)) {
                    addPart(parts, run, runOffset, partStart, partEnd, wordsInPart);
                    partStart = -1;
                    wordsInPart = 0;
                }
            }
        }
        addPart(parts, run, runOffset, partStart, partEnd, wordsInPart);
        return parts;
    }

    private static boolean endsSentence(String word) {
        if (!word.endsWith(".")) {
            return false;
        }
        String bare = word.substring(0, word.length() - 1);
        return bare.length() > 1 && !ABBREVIATIONS.contains(bare.toLowerCase(Locale.ROOT));
    }

    private static void addPart(List<Span> parts, String run, int runOffset, int start, int end, int capitalizedWords) {
        if (start < 0 || capitalizedWords < 2) {
            return;
        }
        String text = POSSESSIVE.matcher(run.substring(start, end).replaceAll("[\\s.]+$", "")).replaceAll("");
        parts.add(new Span(text, runOffset + start));
    }
}
