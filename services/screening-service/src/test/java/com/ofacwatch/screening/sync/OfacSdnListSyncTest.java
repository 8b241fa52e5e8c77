package com.ofacwatch.screening.sync;

import com.ofacwatch.screening.domain.SanctionEntity;
import com.ofacwatch.screening.exception.ListSyncException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.io.ByteArrayOutputStream;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("OfacSdnListSync")
class OfacSdnListSyncTest {

    private static final String ZIP_URL = "https://example.org/sdn_xml.zip";
    private static final String XML_URL = "https://example.org/sdn.xml";

    @Mock
    private RestTemplate restTemplate;

    private OfacSdnListSync sync() {
        return new OfacSdnListSync(restTemplate, new SdnXmlParser(), ZIP_URL, XML_URL);
    }

    private static byte[] zip(byte[] xml) throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipOutputStream out = new ZipOutputStream(bytes)) {
            out.putNextEntry(new ZipEntry("README.txt"));
            out.write("not the list".getBytes());
            out.closeEntry();
            out.putNextEntry(new ZipEntry("SDN.XML"));
            out.write(xml);
            out.closeEntry();
        }
        return bytes.toByteArray();
    }

    @Test
    @DisplayName("Should read the XML entry of the zipped list")
    void shouldReadZippedList() throws Exception {
        when(restTemplate.getForObject(ZIP_URL, byte[].class)).thenReturn(zip(SdnXmlParserTest.sample()));

        List<SanctionEntity> entities = sync().currentSnapshot();

        assertThat(entities).hasSize(3);
        verify(restTemplate, never()).getForObject(XML_URL, byte[].class);
    }

    @Test
    @DisplayName("Should fall back to the plain XML file when the zip download fails")
    void shouldFallBackToPlainXml() throws Exception {
        when(restTemplate.getForObject(ZIP_URL, byte[].class)).thenThrow(new ResourceAccessException("timeout"));
        when(restTemplate.getForObject(XML_URL, byte[].class)).thenReturn(SdnXmlParserTest.sample());

        assertThat(sync().currentSnapshot()).extracting(SanctionEntity::id).containsExactly("1001", "1002", "1003");
    }

    @Test
    @DisplayName("Should fail with a sync error when both downloads fail")
    void shouldFailWhenBothDownloadsFail() {
        when(restTemplate.getForObject(ZIP_URL, byte[].class)).thenThrow(new ResourceAccessException("timeout"));
        when(restTemplate.getForObject(XML_URL, byte[].class)).thenThrow(new ResourceAccessException("refused"));

        assertThatThrownBy(() -> sync().currentSnapshot())
                .isInstanceOf(ListSyncException.class)
                .satisfies(e -> assertThat(e.getSuppressed()).hasSize(1));
    }
}
