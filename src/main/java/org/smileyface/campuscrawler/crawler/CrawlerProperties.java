package org.smileyface.campuscrawler.crawler;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.campuscrawler.extractor.BlankLineRule;
import org.smileyface.campuscrawler.extractor.ClassOrIdPatternRule;
import org.smileyface.campuscrawler.extractor.ContentRule;
import org.smileyface.campuscrawler.extractor.DuplicateLineRule;
import org.smileyface.campuscrawler.extractor.ElementStyleRule;
import org.smileyface.campuscrawler.extractor.ExtractionRules;
import org.smileyface.campuscrawler.extractor.JunkLabelRule;
import org.smileyface.campuscrawler.extractor.LineRule;
import org.smileyface.campuscrawler.extractor.MinCharacterRule;
import org.smileyface.campuscrawler.extractor.SymbolOnlyRule;
import org.smileyface.campuscrawler.extractor.TagNameContentRule;
import org.smileyface.campuscrawler.fetch.BackoffPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Configuration properties for the campus crawler: crawl scope, politeness, retry policy,
 * output locations and the boilerplate-stripping rule set.
 */
@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {

    private static final Logger log = LogManager.getLogger(CrawlerProperties.class);

    public static final String DEFAULT_CONFIG_RESOURCE = "CampusCrawlerConfig.json";

    public static final String DEFAULT_CHECKPOINT_NAMESPACE = "campus-crawler";

    static final List<String> DEFAULT_ALLOWED_DOMAINS = List.of("www.bracu.ac.bd", "bracu.ac.bd");

    static final List<String> DEFAULT_SKIP_EXTENSIONS = List.of(
            ".jpg", ".jpeg", ".png", ".gif", ".svg", ".webp", ".ico",
            ".pdf", ".zip", ".rar", ".7z",
            ".doc", ".docx", ".ppt", ".pptx", ".xls", ".xlsx",
            ".css", ".js", ".json", ".xml",
            ".mp3", ".mp4", ".avi", ".mov", ".wmv");

    static final List<String> DEFAULT_SEED_PATHS = List.of(
            "/",
            "/about",
            "/about/overview",
            "/about/mission-vision",
            "/about/history",
            "/about/governance",
            "/about/accreditation",
            "/academics",
            "/academics/programs",
            "/academics/undergraduate-programs",
            "/academics/graduate-programs",
            "/academics/departments",
            "/admissions",
            "/admissions/undergraduate",
            "/admissions/graduate",
            "/admissions/international-students",
            "/admissions/tuition-fees",
            "/admissions/scholarships-and-financial-aid",
            "/research",
            "/research/centers",
            "/research/publications",
            "/student-life",
            "/student-life/clubs",
            "/student-life/residential-life",
            "/student-life/career-services",
            "/campus",
            "/faculty",
            "/contact");

    /** Site root the seed paths are resolved against. */
    private String rootUrl = "https://www.bracu.ac.bd/";

    /** Hosts a URL must belong to (exact, case-insensitive match). */
    private Set<String> allowedDomains = new LinkedHashSet<>(DEFAULT_ALLOWED_DOMAINS);

    /** Path suffixes of non-text resources that are never fetched. */
    private List<String> skipExtensions = new ArrayList<>(DEFAULT_SKIP_EXTENSIONS);

    /** Known-important paths enqueued at crawl start. */
    private List<String> seedPaths = new ArrayList<>(DEFAULT_SEED_PATHS);

    /** Fetch attempts per URL before it is abandoned. */
    private int maxAttempts = 2;

    /** Unit of the delay between failed attempts. */
    private long backoffUnitMs = 2000;

    private BackoffPolicy backoffPolicy = BackoffPolicy.LINEAR;

    /** Pause after every fetch. */
    private long politenessDelayMs = 1000;

    /** Fetch timeout in milliseconds. */
    private int requestTimeoutMs = 30000;

    /** User agent used when fetching pages. */
    private String userAgent = "SmileyfaceCampusCrawler/0.1";

    /** Directory the corpus files are written to. */
    private String outputDir = "university_docs";

    /** Checkpoint file used by the file-based state persister. */
    private String stateFile = "crawl_state.json";

    /** Cleaned text must be longer than this many characters to be written. */
    private int minContentLength = 150;

    /** Save a checkpoint after every this many successful fetches. */
    private int checkpointInterval = 10;

    /** Length cap of the derived file name, without the ".txt" suffix. */
    private int maxFilenameLength = 80;

    /** Default page budget when none is given on the command line. */
    private int maxPages = 300;

    /** Key prefix of the checkpoint when it is kept in Redis. */
    private String checkpointNamespace = DEFAULT_CHECKPOINT_NAMESPACE;

    /** Boilerplate-stripping rules. */
    private ContentRulesConfig contentRules = new ContentRulesConfig();

    /**
     * Loads default values from classpath resource CampusCrawlerConfig.json if available.
     * Spring will still bind/override values from application properties as usual.
     */
    public CrawlerProperties() {
        this(DEFAULT_CONFIG_RESOURCE);
    }

    /**
     * Loads default values from the given classpath resource; a missing resource keeps the
     * built-in defaults.
     */
    public CrawlerProperties(String configResource) {
        if (configResource == null || configResource.isBlank()) {
            return;
        }
        try (InputStream in = CrawlerProperties.class.getClassLoader().getResourceAsStream(configResource)) {
            if (in != null) {
                ObjectMapper mapper = new ObjectMapper()
                        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
                apply(mapper.readValue(in, CampusCrawlerConfig.class));
                log.debug("Loaded crawler defaults from {}", configResource);
            }
        } catch (Exception e) {
            // Keep built-in defaults when the file is malformed; do not fail application startup
            log.error("Failed to load crawler configuration from classpath resource {}", configResource, e);
        }
    }

    private void apply(CampusCrawlerConfig cfg) {
        if (cfg.rootUrl != null && !cfg.rootUrl.isBlank()) this.rootUrl = cfg.rootUrl;
        if (cfg.allowedDomains != null) setAllowedDomains(cfg.allowedDomains);
        if (cfg.skipExtensions != null) setSkipExtensions(cfg.skipExtensions);
        if (cfg.seedPaths != null) setSeedPaths(cfg.seedPaths);
        if (cfg.maxAttempts != null && cfg.maxAttempts > 0) this.maxAttempts = cfg.maxAttempts;
        if (cfg.backoffUnitMs != null && cfg.backoffUnitMs >= 0) this.backoffUnitMs = cfg.backoffUnitMs;
        if (cfg.backoffPolicy != null) this.backoffPolicy = cfg.backoffPolicy;
        if (cfg.politenessDelayMs != null && cfg.politenessDelayMs >= 0) this.politenessDelayMs = cfg.politenessDelayMs;
        if (cfg.requestTimeoutMs != null && cfg.requestTimeoutMs > 0) this.requestTimeoutMs = cfg.requestTimeoutMs;
        if (cfg.userAgent != null && !cfg.userAgent.isBlank()) this.userAgent = cfg.userAgent;
        if (cfg.outputDir != null && !cfg.outputDir.isBlank()) this.outputDir = cfg.outputDir;
        if (cfg.stateFile != null && !cfg.stateFile.isBlank()) this.stateFile = cfg.stateFile;
        if (cfg.minContentLength != null && cfg.minContentLength >= 0) this.minContentLength = cfg.minContentLength;
        if (cfg.checkpointInterval != null && cfg.checkpointInterval > 0) this.checkpointInterval = cfg.checkpointInterval;
        if (cfg.maxFilenameLength != null && cfg.maxFilenameLength > 0) this.maxFilenameLength = cfg.maxFilenameLength;
        if (cfg.maxPages != null && cfg.maxPages > 0) this.maxPages = cfg.maxPages;
        if (cfg.checkpointNamespace != null && !cfg.checkpointNamespace.isBlank()) this.checkpointNamespace = cfg.checkpointNamespace;
        if (cfg.contentRules != null) this.contentRules = cfg.contentRules;
    }

    public String getRootUrl() {
        return rootUrl;
    }

    public void setRootUrl(String rootUrl) {
        this.rootUrl = rootUrl;
    }

    public Set<String> getAllowedDomains() {
        return allowedDomains;
    }

    public void setAllowedDomains(Set<String> allowedDomains) {
        Set<String> domains = new LinkedHashSet<>();
        if (allowedDomains != null) {
            for (String d : allowedDomains) {
                if (d != null && !d.isBlank()) domains.add(d.trim().toLowerCase(Locale.ROOT));
            }
        }
        this.allowedDomains = domains;
    }

    public List<String> getSkipExtensions() {
        return skipExtensions;
    }

    public void setSkipExtensions(List<String> skipExtensions) {
        this.skipExtensions = skipExtensions != null ? new ArrayList<>(skipExtensions) : new ArrayList<>();
    }

    public List<String> getSeedPaths() {
        return seedPaths;
    }

    public void setSeedPaths(List<String> seedPaths) {
        this.seedPaths = seedPaths != null ? new ArrayList<>(seedPaths) : new ArrayList<>();
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public long getBackoffUnitMs() {
        return backoffUnitMs;
    }

    public void setBackoffUnitMs(long backoffUnitMs) {
        this.backoffUnitMs = backoffUnitMs;
    }

    public BackoffPolicy getBackoffPolicy() {
        return backoffPolicy;
    }

    public void setBackoffPolicy(BackoffPolicy backoffPolicy) {
        this.backoffPolicy = backoffPolicy != null ? backoffPolicy : BackoffPolicy.LINEAR;
    }

    public long getPolitenessDelayMs() {
        return politenessDelayMs;
    }

    public void setPolitenessDelayMs(long politenessDelayMs) {
        this.politenessDelayMs = politenessDelayMs;
    }

    public int getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(int requestTimeoutMs) {
        this.requestTimeoutMs = requestTimeoutMs;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public String getStateFile() {
        return stateFile;
    }

    public void setStateFile(String stateFile) {
        this.stateFile = stateFile;
    }

    public int getMinContentLength() {
        return minContentLength;
    }

    public void setMinContentLength(int minContentLength) {
        this.minContentLength = minContentLength;
    }

    public int getCheckpointInterval() {
        return checkpointInterval;
    }

    public void setCheckpointInterval(int checkpointInterval) {
        this.checkpointInterval = checkpointInterval;
    }

    public int getMaxFilenameLength() {
        return maxFilenameLength;
    }

    public void setMaxFilenameLength(int maxFilenameLength) {
        this.maxFilenameLength = maxFilenameLength;
    }

    public int getMaxPages() {
        return maxPages;
    }

    public void setMaxPages(int maxPages) {
        this.maxPages = maxPages;
    }

    public String getCheckpointNamespace() {
        return checkpointNamespace;
    }

    public void setCheckpointNamespace(String checkpointNamespace) {
        this.checkpointNamespace = (checkpointNamespace == null || checkpointNamespace.isBlank())
                ? DEFAULT_CHECKPOINT_NAMESPACE : checkpointNamespace;
    }

    public ContentRulesConfig getContentRules() {
        return contentRules;
    }

    public void setContentRules(ContentRulesConfig contentRules) {
        this.contentRules = contentRules != null ? contentRules : new ContentRulesConfig();
    }

    public Duration getBackoffUnit() {
        return Duration.ofMillis(Math.max(0, backoffUnitMs));
    }

    public Duration getPolitenessDelay() {
        return Duration.ofMillis(Math.max(0, politenessDelayMs));
    }

    /**
     * Builds the ordered extraction rule set from {@link #contentRules}: structural tags, then
     * class/id noise containers, then inline-style noise; followed by the line rules blank,
     * duplicate, minimum length, junk label and symbol-only.
     */
    public ExtractionRules buildExtractionRules() {
        ContentRulesConfig cfg = contentRules != null ? contentRules : new ContentRulesConfig();
        List<ContentRule> elementRules = new ArrayList<>();
        if (cfg.getNoiseTags() != null && !cfg.getNoiseTags().isEmpty()) {
            elementRules.add(new TagNameContentRule(cfg.getNoiseTags()));
        }
        if (cfg.getNoisePattern() != null && !cfg.getNoisePattern().isBlank()) {
            elementRules.add(new ClassOrIdPatternRule(cfg.getNoisePattern(), cfg.getContainerTags()));
        }
        if (cfg.getNoiseStyles() != null) {
            for (String style : cfg.getNoiseStyles()) {
                if (style != null && !style.isBlank()) elementRules.add(new ElementStyleRule(style));
            }
        }

        List<LineRule> lineRules = new ArrayList<>();
        lineRules.add(new BlankLineRule());
        lineRules.add(new DuplicateLineRule());
        lineRules.add(new MinCharacterRule(cfg.getMinLineLength()));
        lineRules.add(new JunkLabelRule(cfg.getJunkLabels()));
        lineRules.add(new SymbolOnlyRule());
        return new ExtractionRules(elementRules, lineRules);
    }

    // --------- Nested config DTOs for JSON mapping ---------
    public static class CampusCrawlerConfig {
        public String rootUrl;
        public Set<String> allowedDomains;
        public List<String> skipExtensions;
        public List<String> seedPaths;
        public Integer maxAttempts;
        public Long backoffUnitMs;
        public BackoffPolicy backoffPolicy;
        public Long politenessDelayMs;
        public Integer requestTimeoutMs;
        public String userAgent;
        public String outputDir;
        public String stateFile;
        public Integer minContentLength;
        public Integer checkpointInterval;
        public Integer maxFilenameLength;
        public Integer maxPages;
        public String checkpointNamespace;
        public ContentRulesConfig contentRules;
    }

    public static class ContentRulesConfig {

        private List<String> noiseTags = new ArrayList<>(List.of(
                "script", "style", "nav", "footer", "header", "aside", "form",
                "iframe", "noscript", "svg", "button", "select", "option"));

        private List<String> containerTags = new ArrayList<>(List.of("div", "section", "ul", "aside"));

        private String noisePattern = "(menu|nav|sidebar|breadcrumb|search|social|footer|widget|"
                + "cookie|popup|modal|banner|advertisement|ad-|slick|carousel)";

        /** Inline style fragments marking hidden content, e.g. "display:none". None by default. */
        private List<String> noiseStyles = new ArrayList<>();

        private int minLineLength = 10;

        private List<String> junkLabels = new ArrayList<>(List.of(
                "Apply Now", "Read More", "Learn More", "Click Here",
                "Skip to main", "Search form", "Toggle navigation",
                "Back to top", "Follow us", "Share this"));

        public ContentRulesConfig() {} // for JSON mapping

        public List<String> getNoiseTags() { return noiseTags; }
        public void setNoiseTags(List<String> noiseTags) { this.noiseTags = noiseTags; }

        public List<String> getContainerTags() { return containerTags; }
        public void setContainerTags(List<String> containerTags) { this.containerTags = containerTags; }

        public String getNoisePattern() { return noisePattern; }
        public void setNoisePattern(String noisePattern) { this.noisePattern = noisePattern; }

        public List<String> getNoiseStyles() { return noiseStyles; }
        public void setNoiseStyles(List<String> noiseStyles) { this.noiseStyles = noiseStyles; }

        public int getMinLineLength() { return minLineLength; }
        public void setMinLineLength(int minLineLength) { this.minLineLength = minLineLength; }

        public List<String> getJunkLabels() { return junkLabels; }
        public void setJunkLabels(List<String> junkLabels) { this.junkLabels = junkLabels; }
    }
}
