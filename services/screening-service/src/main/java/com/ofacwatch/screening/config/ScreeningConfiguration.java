package com.ofacwatch.screening.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ofacwatch.screening.classify.ScreeningClassifier;
import com.ofacwatch.screening.dedup.DedupStore;
import com.ofacwatch.screening.dedup.InMemoryDedupStore;
import com.ofacwatch.screening.dedup.RedisDedupStore;
import com.ofacwatch.screening.exception.InvalidThresholdConfigException;
import com.ofacwatch.screening.extract.CapitalizedNameExtractor;
import com.ofacwatch.screening.extract.EntityExtractor;
import com.ofacwatch.screening.index.BlockingKeyStrategy;
import com.ofacwatch.screening.index.IndexSnapshotManager;
import com.ofacwatch.screening.index.TokenPhoneticBlockingKeyStrategy;
import com.ofacwatch.screening.match.MatchScorer;
import com.ofacwatch.screening.metrics.ScreeningMetrics;
import com.ofacwatch.screening.normalize.NameNormalizer;
import com.ofacwatch.screening.pipeline.ScreeningPipeline;
import com.ofacwatch.screening.pipeline.TimeBoundedInvoker;
import com.ofacwatch.screening.presenter.AlertFeedPresenter;
import com.ofacwatch.screening.relevance.KeywordRelevanceGate;
import com.ofacwatch.screening.relevance.RelevanceGate;
import com.ofacwatch.screening.scheduler.PollingScheduler;
import com.ofacwatch.screening.search.SanctionsSearchService;
import com.ofacwatch.screening.source.RssFeedParser;
import com.ofacwatch.screening.source.RssSourceFetcher;
import com.ofacwatch.screening.source.SourceFetcher;
import com.ofacwatch.screening.sync.ListSync;
import com.ofacwatch.screening.sync.OfacSdnListSync;
import com.ofacwatch.screening.sync.SdnXmlParser;
import com.ofacwatch.screening.sync.SnapshotRefreshJob;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Wires the screening components together.
 */
@Configuration
@Slf4j
public class ScreeningConfiguration {

    @Bean
    public NameNormalizer nameNormalizer(ScreeningProperties properties) {
        return new NameNormalizer(properties.getNameVariants());
    }

    @Bean
    public BlockingKeyStrategy blockingKeyStrategy() {
        return new TokenPhoneticBlockingKeyStrategy();
    }

    @Bean
    public MatchScorer matchScorer(NameNormalizer normalizer) {
        return new MatchScorer(normalizer);
    }

    @Bean
    public ScreeningClassifier screeningClassifier(ScreeningProperties properties) throws InvalidThresholdConfigException {
        ScreeningProperties.Thresholds thresholds = properties.getThresholds();
        return new ScreeningClassifier(thresholds.getHigh(), thresholds.getLow());
    }

    @Bean
    public IndexSnapshotManager indexSnapshotManager() {
        return new IndexSnapshotManager();
    }

    @Bean
    public EntityExtractor entityExtractor(ScreeningProperties properties) {
        return new CapitalizedNameExtractor(properties.getExtraction().getMinNameLength());
    }

    @Bean
    public RelevanceGate relevanceGate(ScreeningProperties properties) {
        return new KeywordRelevanceGate(properties.getKeywords());
    }

    @Bean
    public SourceFetcher sourceFetcher(RestTemplateBuilder builder, ScreeningProperties properties) {
        ScreeningProperties.Fetch fetch = properties.getFetch();
        return new RssSourceFetcher(
                builder.setConnectTimeout(fetch.getConnectTimeout())
                        .setReadTimeout(properties.getFetchTimeout())
                        .defaultHeader("User-Agent", fetch.getUserAgent())
                        .build(),
                new RssFeedParser(fetch.getMaxTextLength()));
    }

    @Bean
    public ListSync listSync(RestTemplateBuilder builder, ScreeningProperties properties) {
        ScreeningProperties.Snapshot snapshot = properties.getSnapshot();
        return new OfacSdnListSync(
                builder.setConnectTimeout(properties.getFetch().getConnectTimeout())
                        .setReadTimeout(snapshot.getDownloadTimeout())
                        .defaultHeader("User-Agent", properties.getFetch().getUserAgent())
                        .build(),
                new SdnXmlParser(),
                snapshot.getZipUrl(),
                snapshot.getXmlUrl());
    }

    @Bean
    public SnapshotRefreshJob snapshotRefreshJob(ListSync listSync,
                                                 NameNormalizer normalizer,
                                                 BlockingKeyStrategy blockingKeyStrategy,
                                                 IndexSnapshotManager snapshotManager,
                                                 ScreeningMetrics metrics,
                                                 ScreeningProperties properties) {
        return new SnapshotRefreshJob(listSync, normalizer, blockingKeyStrategy, snapshotManager, metrics,
                properties.getSnapshot().isEnabled());
    }

    @Bean
    @ConditionalOnProperty(prefix = "ofacwatch.screening.dedup", name = "store", havingValue = "memory", matchIfMissing = true)
    public DedupStore inMemoryDedupStore() {
        log.info("Using in-memory dedup store; alerts are not remembered across restarts");
        return new InMemoryDedupStore();
    }

    @Bean
    @ConditionalOnProperty(prefix = "ofacwatch.screening.dedup", name = "store", havingValue = "redis")
    public DedupStore redisDedupStore(StringRedisTemplate redisTemplate,
                                      ObjectMapper objectMapper,
                                      ScreeningProperties properties) {
        log.info("Using Redis dedup store at hash {}", properties.getDedup().getRedisHashKey());
        return new RedisDedupStore(redisTemplate, objectMapper, properties.getDedup().getRedisHashKey());
    }

    @Bean
    public AlertFeedPresenter alertFeedPresenter(ScreeningProperties properties) {
        return new AlertFeedPresenter(properties.getFeed().getResultsLimit());
    }

    @Bean(destroyMethod = "shutdown")
    public TimeBoundedInvoker timeBoundedInvoker(TimeLimiterRegistry timeLimiterRegistry) {
        return new TimeBoundedInvoker(timeLimiterRegistry);
    }

    @Bean
    public ScreeningPipeline screeningPipeline(SourceFetcher sourceFetcher,
                                               EntityExtractor entityExtractor,
                                               RelevanceGate relevanceGate,
                                               NameNormalizer normalizer,
                                               MatchScorer matchScorer,
                                               ScreeningClassifier classifier,
                                               DedupStore dedupStore,
                                               AlertFeedPresenter presenter,
                                               ScreeningMetrics metrics,
                                               TimeBoundedInvoker invoker,
                                               ScreeningProperties properties) {
        return ScreeningPipeline.builder()
                .fetcher(sourceFetcher)
                .extractor(entityExtractor)
                .relevanceGate(relevanceGate)
                .normalizer(normalizer)
                .scorer(matchScorer)
                .classifier(classifier)
                .dedupStore(dedupStore)
                .presenter(presenter)
                .metrics(metrics)
                .invoker(invoker)
                .screenedKinds(properties.getScreenedKinds())
                .build();
    }

    @Bean
    public PollingScheduler pollingScheduler(ScreeningPipeline pipeline,
                                             IndexSnapshotManager snapshotManager,
                                             ScreeningMetrics metrics,
                                             @Qualifier("taskScheduler") ThreadPoolTaskScheduler taskScheduler,
                                             ScreeningProperties properties) {
        ScreeningProperties.Scheduler scheduler = properties.getScheduler();
        return new PollingScheduler(properties.toSourceConfigs(), pipeline, snapshotManager, metrics, taskScheduler,
                scheduler.isEnabled(), scheduler.getInitialDelay(), scheduler.getShutdownAwait());
    }

    @Bean
    public SanctionsSearchService sanctionsSearchService(IndexSnapshotManager snapshotManager,
                                                         NameNormalizer normalizer,
                                                         MatchScorer matchScorer,
                                                         ScreeningProperties properties) {
        return new SanctionsSearchService(snapshotManager, normalizer, matchScorer, properties.getSearch().getMinScore());
    }
}
