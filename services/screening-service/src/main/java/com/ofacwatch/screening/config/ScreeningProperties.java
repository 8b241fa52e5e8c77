package com.ofacwatch.screening.config;

import com.ofacwatch.screening.domain.EntityKind;
import com.ofacwatch.screening.domain.SourceConfig;
import com.ofacwatch.screening.domain.SourceType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Screening service configuration, bound from {@code ofacwatch.screening.*}.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "ofacwatch.screening")
public class ScreeningProperties {

    /**
     * Classification thresholds. Checked again when the classifier is built.
     */
    @Valid
    private Thresholds thresholds = new Thresholds();

    /**
     * Upper bound on a single source fetch
     */
    @NotNull
    private Duration fetchTimeout = Duration.ofSeconds(15);

    /**
     * Upper bound on extraction of one document
     */
    @NotNull
    private Duration extractTimeout = Duration.ofSeconds(10);

    /**
     * Fetch interval for sources that do not set their own
     */
    @NotNull
    private Duration defaultFetchInterval = Duration.ofMinutes(3);

    @Valid
    private Snapshot snapshot = new Snapshot();

    @Valid
    private List<Source> sources = new ArrayList<>();

    /**
     * Context keywords for sources without their own filter list
     */
    private List<String> keywords = new ArrayList<>();

    /**
     * Entity kinds mentions are screened against
     */
    private Set<EntityKind> screenedKinds = EnumSet.of(EntityKind.PERSON);

    @Valid
    private Scheduler scheduler = new Scheduler();

    @Valid
    private Feed feed = new Feed();

    @Valid
    private Dedup dedup = new Dedup();

    @Valid
    private Search search = new Search();

    @Valid
    private Fetch fetch = new Fetch();

    @Valid
    private Extraction extraction = new Extraction();

    /**
     * Spelling variant to canonical token, e.g. mohammed: muhammad
     */
    private Map<String, String> nameVariants = new HashMap<>();

    public List<SourceConfig> toSourceConfigs() {
        List<SourceConfig> configs = new ArrayList<>(sources.size());
        for (Source source : sources) {
            configs.add(new SourceConfig(
                    source.getId(),
                    source.getType(),
                    source.getUrl(),
                    source.getFetchInterval() != null ? source.getFetchInterval() : defaultFetchInterval,
                    source.getKeywords()));
        }
        return configs;
    }

    @Data
    public static class Thresholds {
        private double high = 0.92;
        private double low = 0.75;
    }

    @Data
    public static class Snapshot {
        /**
         * Refresh the sanctions list on a schedule. Off in tests.
         */
        private boolean enabled = true;
        private Duration refreshInterval = Duration.ofHours(12);
        private Duration initialDelay = Duration.ZERO;
        private String zipUrl = "https://www.treasury.gov/ofac/downloads/sdn_xml.zip";
        private String xmlUrl = "https://www.treasury.gov/ofac/downloads/sdn.xml";
        @NotNull
        private Duration downloadTimeout = Duration.ofSeconds(120);
    }

    @Data
    public static class Source {
        @NotBlank
        private String id;
        private SourceType type = SourceType.RSS;
        @NotBlank
        private String url;
        private Duration fetchInterval;
        private List<String> keywords = new ArrayList<>();
    }

    @Data
    public static class Scheduler {
        private boolean enabled = true;
        @Min(1)
        private int poolSize = 4;
        private Duration initialDelay = Duration.ofSeconds(5);
        private Duration shutdownAwait = Duration.ofSeconds(30);
    }

    @Data
    public static class Feed {
        @Min(1)
        private int resultsLimit = 300;
    }

    @Data
    public static class Dedup {
        /**
         * memory or redis
         */
        @NotBlank
        private String store = "memory";
        private String redisHashKey = "ofacwatch:alerts";
    }

    @Data
    public static class Search {
        private double minScore = 0.80;
        @Min(1)
        @Max(50)
        private int maxLimit = 50;
    }

    @Data
    public static class Fetch {
        @Min(1)
        private int maxTextLength = 4000;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private String userAgent = "ofacwatch/1.0";
    }

    @Data
    public static class Extraction {
        @Min(1)
        private int minNameLength = 3;
    }
}
