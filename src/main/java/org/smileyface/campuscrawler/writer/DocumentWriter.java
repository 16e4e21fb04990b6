package org.smileyface.campuscrawler.writer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.campuscrawler.util.CrawlerUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Persists the cleaned text of a page as one UTF-8 file in the output corpus:
 * <pre>
 * Source URL: {url}
 * Page Title: {title}
 *
 * {text}
 * </pre>
 * The header layout and the file naming are read by the downstream ingestion job.
 */
public class DocumentWriter {

    private static final Logger log = LoggerFactory.getLogger(DocumentWriter.class);

    private static final String TEMPLATE = "Source URL: %s\nPage Title: %s\n\n%s";

    private final Path outputDir;
    private final int minContentLength;
    private final int maxFilenameLength;

    public DocumentWriter(Path outputDir, int minContentLength, int maxFilenameLength) {
        this.outputDir = Objects.requireNonNull(outputDir, "outputDir");
        this.minContentLength = Math.max(0, minContentLength);
        if (maxFilenameLength < 1) {
            throw new IllegalArgumentException("maxFilenameLength must be positive: " + maxFilenameLength);
        }
        this.maxFilenameLength = maxFilenameLength;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    /**
     * Writes a document unless the text is too short to be worth keeping.
     *
     * @param sourceUrl   normalized URL of the page
     * @param title       page title, may be empty
     * @param cleanedText extracted text
     * @return true if a file was written, false if the text has at most the minimum length
     * @throws IOException if the output directory or the file could not be written
     */
    public boolean write(String sourceUrl, String title, String cleanedText) throws IOException {
        int length = CrawlerUtils.charCount(cleanedText);
        if (length <= minContentLength) {
            log.info("Skipped {} ({} characters, minimum is {})", sourceUrl, length, minContentLength + 1);
            return false;
        }
        Files.createDirectories(outputDir);
        Path target = resolvePath(sourceUrl);
        String content = TEMPLATE.formatted(sourceUrl, title == null ? "" : title, cleanedText);
        Files.writeString(target, content, StandardCharsets.UTF_8);
        log.info("Saved {} ({} characters) to {}", sourceUrl, length, target.getFileName());
        return true;
    }

    public Path resolvePath(String sourceUrl) {
        return outputDir.resolve(CrawlerUtils.toSafeFilename(sourceUrl, maxFilenameLength));
    }
}
