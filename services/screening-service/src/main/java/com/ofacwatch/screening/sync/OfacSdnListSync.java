package com.ofacwatch.screening.sync;

import com.ofacwatch.screening.domain.SanctionEntity;
import com.ofacwatch.screening.exception.ListSyncException;
import com.ofacwatch.screening.exception.MalformedSnapshotException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Downloads the OFAC SDN list. The zipped XML is tried first, the plain XML file second.
 */
@Slf4j
@RequiredArgsConstructor
public class OfacSdnListSync implements ListSync {

    private final RestTemplate restTemplate;
    private final SdnXmlParser parser;
    private final String zipUrl;
    private final String xmlUrl;

    @Override
    public List<SanctionEntity> currentSnapshot() throws ListSyncException, MalformedSnapshotException {
        byte[] xml = null;
        Exception zipFailure = null;

        if (zipUrl != null && !zipUrl.isBlank()) {
            try {
                xml = unzipFirstXml(download(zipUrl));
            } catch (RestClientException | IOException e) {
                log.warn("SDN zip download from {} failed, falling back to plain XML: {}", zipUrl, e.getMessage());
                zipFailure = e;
            }
        }

        if (xml == null) {
            if (xmlUrl == null || xmlUrl.isBlank()) {
                throw new ListSyncException("No usable SDN source configured", zipFailure);
            }
            try {
                xml = download(xmlUrl);
            } catch (RestClientException e) {
                ListSyncException failure = new ListSyncException("SDN download from " + xmlUrl + " failed", e);
                if (zipFailure != null) {
                    failure.addSuppressed(zipFailure);
                }
                throw failure;
            }
        }

        return parser.parse(xml);
    }

    private byte[] download(String url) {
        log.debug("Downloading SDN list from {}", url);
        byte[] body = restTemplate.getForObject(url, byte[].class);
        if (body == null || body.length == 0) {
            throw new RestClientException("Empty response from " + url);
        }
        return body;
    }

    static byte[] unzipFirstXml(byte[] zip) throws IOException {
        try (ZipInputStream in = new ZipInputStream(new ByteArrayInputStream(zip))) {
            ZipEntry entry;
            while ((entry = in.getNextEntry()) != null) {
                if (!entry.isDirectory() && entry.getName().toLowerCase(Locale.ROOT).endsWith(".xml")) {
                    return in.readAllBytes();
                }
            }
        }
        throw new IOException("Archive contains no XML entry");
    }
}
