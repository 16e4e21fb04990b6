package org.smileyface.campuscrawler.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.campuscrawler.crawler.CrawlerProperties;
import org.smileyface.campuscrawler.crawler.LinkDiscoverer;
import org.smileyface.campuscrawler.crawler.UrlNormalizer;
import org.smileyface.campuscrawler.extractor.ContentExtractor;
import org.smileyface.campuscrawler.fetch.JsoupPageLoader;
import org.smileyface.campuscrawler.fetch.PageFetcher;
import org.smileyface.campuscrawler.fetch.PageLoader;
import org.smileyface.campuscrawler.fetch.RateLimiter;
import org.smileyface.campuscrawler.fetch.Sleeper;
import org.smileyface.campuscrawler.persist.JsonFileStatePersister;
import org.smileyface.campuscrawler.persist.RedisStatePersister;
import org.smileyface.campuscrawler.persist.StatePersister;
import org.smileyface.campuscrawler.writer.DocumentWriter;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Wires the crawl pipeline from {@link CrawlerProperties}. Invalid settings fail application startup
 * with an {@link IllegalArgumentException}.
 */
@Configuration
public class BeanConfig {

    private static final Logger log = LogManager.getLogger(BeanConfig.class);

    @Value("${crawler.checkpoint.type:file}")
    private String checkpointType;

    @Bean
    public UrlNormalizer urlNormalizer(CrawlerProperties properties) {
        String root = properties.getRootUrl();
        if (root == null || root.isBlank()) {
            throw new IllegalArgumentException("crawler.root-url must not be blank");
        }
        UrlNormalizer normalizer = new UrlNormalizer(properties);
        if (normalizer.normalize(root) == null) {
            throw new IllegalArgumentException("crawler.root-url " + root + " is not inside the allowed domains "
                    + normalizer.getAllowedDomains());
        }
        return normalizer;
    }

    @Bean
    public LinkDiscoverer linkDiscoverer(UrlNormalizer urlNormalizer) {
        return new LinkDiscoverer(urlNormalizer);
    }

    @Bean
    public ContentExtractor contentExtractor(CrawlerProperties properties) {
        return new ContentExtractor(properties.buildExtractionRules());
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    public PageLoader pageLoader(CrawlerProperties properties) {
        return new JsoupPageLoader(properties.getUserAgent());
    }

    @Bean
    public PageFetcher pageFetcher(PageLoader pageLoader, Sleeper sleeper, CrawlerProperties properties) {
        if (properties.getMaxAttempts() < 1) {
            throw new IllegalArgumentException("crawler.max-attempts must be at least 1: " + properties.getMaxAttempts());
        }
        return new PageFetcher(pageLoader, sleeper, properties.getMaxAttempts(), properties.getBackoffPolicy(),
                properties.getBackoffUnit(), properties.getRequestTimeoutMs());
    }

    @Bean
    public RateLimiter rateLimiter(Sleeper sleeper, CrawlerProperties properties) {
        return new RateLimiter(sleeper, properties.getPolitenessDelay());
    }

    @Bean
    public DocumentWriter documentWriter(CrawlerProperties properties) {
        return new DocumentWriter(Path.of(properties.getOutputDir()), properties.getMinContentLength(),
                properties.getMaxFilenameLength());
    }

    /**
     * Selects the StatePersister implementation based on the configuration property
     * {@code crawler.checkpoint.type}. Supported values:
     * - "file" (default): uses {@link JsonFileStatePersister} on {@code crawler.state-file}
     * - "redis": uses {@link RedisStatePersister} when a {@link StringRedisTemplate} is available;
     *   falls back to the file persister otherwise.
     */
    @Bean
    public StatePersister statePersister(ObjectProvider<StringRedisTemplate> redisProvider,
                                         ObjectProvider<ObjectMapper> mapperProvider,
                                         CrawlerProperties properties) {
        ObjectMapper mapper = mapperProvider.getIfAvailable(ObjectMapper::new);
        String kind = checkpointType == null ? "file" : checkpointType.trim().toLowerCase(Locale.ROOT);
        if ("redis".equals(kind)) {
            StringRedisTemplate template = redisProvider.getIfAvailable();
            if (template != null) {
                log.info("Checkpoints stored in Redis under namespace {}", properties.getCheckpointNamespace());
                return new RedisStatePersister(template, mapper, properties.getCheckpointNamespace());
            }
            log.warn("crawler.checkpoint.type=redis but no Redis connection is configured, using {}",
                    properties.getStateFile());
        }
        return new JsonFileStatePersister(Path.of(properties.getStateFile()), mapper);
    }
}
