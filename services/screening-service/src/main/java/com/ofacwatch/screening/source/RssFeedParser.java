package com.ofacwatch.screening.source;

import com.ofacwatch.screening.domain.RawDocument;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns RSS 2.0 {@code <item>} and Atom {@code <entry>} elements into raw documents.
 *
 * <p>Title and description are joined into the document text; HTML inside the description is
 * reduced to its text. Items with neither title nor description are skipped.</p>
 */
@Slf4j
public class RssFeedParser {

    private final int maxTextLength;

    public RssFeedParser(int maxTextLength) {
        this.maxTextLength = maxTextLength;
    }

    public List<RawDocument> parse(String sourceId, String xml) {
        Document feed = Jsoup.parse(xml == null ? "" : xml, "", Parser.xmlParser());
        List<RawDocument> documents = new ArrayList<>();

        for (Element item : feed.getElementsByTag("item")) {
            addDocument(documents, sourceId,
                    childText(item, "title"),
                    childText(item, "description"),
                    childText(item, "link"),
                    childText(item, "pubDate"));
        }
        for (Element entry : feed.getElementsByTag("entry")) {
            String summary = childText(entry, "summary");
            addDocument(documents, sourceId,
                    childText(entry, "title"),
                    summary.isEmpty() ? childText(entry, "content") : summary,
                    atomLink(entry),
                    firstNonEmpty(childText(entry, "published"), childText(entry, "updated")));
        }

        log.debug("Parsed {} documents from source {}", documents.size(), sourceId);
        return documents;
    }

    private void addDocument(List<RawDocument> documents, String sourceId,
                             String title, String description, String link, String published) {
        String body = Jsoup.parse(description).text();
        if (title.isEmpty() && body.isEmpty()) {
            return;
        }
        String text = collapse(title + " " + body);
        if (text.length() > maxTextLength) {
            text = text.substring(0, maxTextLength);
        }
        documents.add(new RawDocument(sourceId, text, link, parseDate(published)));
    }

    static Instant parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return ZonedDateTime.parse(value.trim(), DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(value.trim()).toInstant();
            } catch (DateTimeParseException ignored) {
                log.trace("Unparseable publication date '{}'", value);
                return null;
            }
        }
    }

    private static String atomLink(Element entry) {
        for (Element link : entry.getElementsByTag("link")) {
            String rel = link.attr("rel");
            if (link.hasAttr("href") && (rel.isEmpty() || "alternate".equals(rel))) {
                return link.attr("href");
            }
        }
        return childText(entry, "link");
    }

    private static String childText(Element parent, String tag) {
        for (Element child : parent.children()) {
            if (child.normalName().equals(tag.toLowerCase(Locale.ROOT))) {
                return collapse(child.text());
            }
        }
        return "";
    }

    private static String firstNonEmpty(String first, String second) {
        return first.isEmpty() ? second : first;
    }

    private static String collapse(String value) {
        return value == null ? "" : value.replaceAll("\\s+", " ").trim();
    }
}
