package com.ofacwatch.screening.sync;

import com.ofacwatch.screening.domain.EntityKind;
import com.ofacwatch.screening.domain.ListingMetadata;
import com.ofacwatch.screening.domain.SanctionEntity;
import com.ofacwatch.screening.exception.MalformedSnapshotException;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.jsoup.select.Elements;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses the OFAC {@code sdn.xml} file.
 *
 * <p>Each {@code sdnEntry} becomes one entity. Names are kept in the list's "LAST, First"
 * form; the normalizer puts them in reading order. The list publish date is used as the
 * listing date since entries carry none of their own.</p>
 */
@Slf4j
public class SdnXmlParser {

    static final String LIST_NAME = "SDN";
    private static final DateTimeFormatter PUBLISH_DATE = DateTimeFormatter.ofPattern("MM/dd/yyyy", Locale.ROOT);

    public List<SanctionEntity> parse(byte[] xml) throws MalformedSnapshotException {
        if (xml == null || xml.length == 0) {
            throw new MalformedSnapshotException("SDN document is empty");
        }

        Document document;
        try {
            document = Jsoup.parse(new String(xml, StandardCharsets.UTF_8), "", Parser.xmlParser());
        } catch (RuntimeException e) {
            throw new MalformedSnapshotException("SDN document is not parseable XML", e);
        }

        Elements entries = document.getElementsByTag("sdnEntry");
        if (entries.isEmpty()) {
            throw new MalformedSnapshotException("SDN document contains no sdnEntry elements");
        }

        LocalDate publishDate = publishDate(document);
        List<SanctionEntity> entities = new ArrayList<>(entries.size());
        for (Element entry : entries) {
            entities.add(toEntity(entry, publishDate));
        }
        log.info("Parsed {} SDN entries published {}", entities.size(), publishDate);
        return entities;
    }

    private SanctionEntity toEntity(Element entry, LocalDate publishDate) throws MalformedSnapshotException {
        String uid = child(entry, "uid");
        if (uid.isEmpty()) {
            throw new MalformedSnapshotException("sdnEntry without uid");
        }

        List<String> programs = new ArrayList<>();
        Element programList = childElement(entry, "programList");
        if (programList != null) {
            for (Element program : programList.children()) {
                if (!program.text().isBlank()) {
                    programs.add(program.text().trim());
                }
            }
        }

        List<String> aliases = new ArrayList<>();
        Element akaList = childElement(entry, "akaList");
        if (akaList != null) {
            for (Element aka : akaList.children()) {
                String alias = listedName(aka);
                if (!alias.isEmpty()) {
                    aliases.add(alias);
                }
            }
        }

        return new SanctionEntity(
                uid,
                listedName(entry),
                aliases,
                EntityKind.fromSdnType(child(entry, "sdnType")),
                new ListingMetadata(LIST_NAME, programs, publishDate));
    }

    private static String listedName(Element element) {
        String last = child(element, "lastName");
        String first = child(element, "firstName");
        if (last.isEmpty()) {
            return first;
        }
        return first.isEmpty() ? last : last + ", " + first;
    }

    private static LocalDate publishDate(Document document) {
        Elements dates = document.getElementsByTag("Publish_Date");
        if (dates.isEmpty()) {
            return null;
        }
        try {
            return LocalDate.parse(dates.first().text().trim(), PUBLISH_DATE);
        } catch (DateTimeParseException e) {
            log.warn("Unrecognized SDN publish date '{}'", dates.first().text());
            return null;
        }
    }

    private static Element childElement(Element parent, String tag) {
        String wanted = tag.toLowerCase(Locale.ROOT);
        for (Element child : parent.children()) {
            if (child.normalName().equals(wanted)) {
                return child;
            }
        }
        return null;
    }

    private static String child(Element parent, String tag) {
        Element child = childElement(parent, tag);
        return child == null ? "" : child.text().trim();
    }
}
