package org.smileyface.campuscrawler.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.campuscrawler.crawler.CrawlerProperties;
import org.smileyface.campuscrawler.service.CrawlReport;
import org.smileyface.campuscrawler.service.CrawlState;
import org.smileyface.campuscrawler.service.CrawlerService;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Command line entry point:
 * <pre>
 *   campus-crawler [--max-pages=N | --max-pages N] [--resume]
 * </pre>
 * {@code --max-pages} defaults to {@code crawler.max-pages}; {@code --resume} continues from the last
 * checkpoint. The exit code is 0 after a finished crawl, 1 when the crawl was interrupted and 2 for
 * invalid arguments.
 */
@Component
@ConditionalOnProperty(name = "crawler.cli.enabled", havingValue = "true", matchIfMissing = true)
public class CrawlCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CrawlCommandRunner.class);

    static final String MAX_PAGES_OPTION = "max-pages";
    static final String RESUME_OPTION = "resume";

    static final int EXIT_OK = 0;
    static final int EXIT_INTERRUPTED = 1;
    static final int EXIT_USAGE = 2;

    private final CrawlerService crawlerService;
    private final CrawlerProperties properties;

    private volatile int exitCode = EXIT_OK;
    private volatile CrawlReport lastReport;

    public CrawlCommandRunner(CrawlerService crawlerService, CrawlerProperties properties) {
        this.crawlerService = crawlerService;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        int maxPages;
        try {
            maxPages = parseMaxPages(args);
        } catch (IllegalArgumentException e) {
            log.error("{}. Usage: [--max-pages=N | --max-pages N] (N > 0) [--resume]", e.getMessage());
            exitCode = EXIT_USAGE;
            return;
        }
        boolean resume = args.containsOption(RESUME_OPTION);

        log.info("Starting crawl of {} (maxPages={}, resume={})", properties.getRootUrl(), maxPages, resume);
        CrawlReport report = crawlerService.crawl(maxPages, resume);
        lastReport = report;
        exitCode = report.getState() == CrawlState.INTERRUPTED ? EXIT_INTERRUPTED : EXIT_OK;
        log.info("Crawl finished: {} pages fetched, {} saved, {} skipped, {} failed; {} visited, {} still queued",
                report.getPagesFetched(), report.getPagesSaved(), report.getPagesSkipped(),
                report.getFetchFailures() + report.getWriteFailures(), report.getVisitedCount(), report.getQueuedCount());
    }

    /**
     * Reads the page budget from {@code --max-pages=N} or {@code --max-pages N}; the last occurrence wins.
     * Spring's option parser does not pair the space-separated form with its value, so the raw
     * arguments are scanned instead.
     */
    int parseMaxPages(ApplicationArguments args) {
        String flag = "--" + MAX_PAGES_OPTION;
        String[] source = args.getSourceArgs();
        boolean present = false;
        String raw = null;
        for (int i = 0; i < source.length; i++) {
            String arg = source[i];
            if (arg.equals(flag)) {
                present = true;
                raw = i + 1 < source.length && !source[i + 1].startsWith("--") ? source[++i] : null;
            } else if (arg.startsWith(flag + "=")) {
                present = true;
                raw = arg.substring(flag.length() + 1);
            }
        }
        if (!present) {
            return properties.getMaxPages();
        }
        if (raw == null) {
            throw new IllegalArgumentException("Missing --max-pages value");
        }
        int value;
        try {
            value = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid --max-pages value '" + raw + "'", e);
        }
        if (value < 1) {
            throw new IllegalArgumentException("--max-pages must be positive, got " + value);
        }
        return value;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    public CrawlReport getLastReport() {
        return lastReport;
    }
}
