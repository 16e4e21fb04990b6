package org.smileyface.campuscrawler.extractor;

import org.junit.jupiter.api.Test;
import org.smileyface.campuscrawler.crawler.CrawlerProperties;
import org.smileyface.campuscrawler.model.ExtractedPage;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ContentExtractorTest {

    private final ContentExtractor extractor = new ContentExtractor(new CrawlerProperties().buildExtractionRules());

    @Test
    void extract_nullOrBlankHtml_returnsEmptyPage() {
        assertThat(extractor.extract(null)).isEqualTo(ExtractedPage.EMPTY);
        assertThat(extractor.extract("   ")).isEqualTo(ExtractedPage.EMPTY);
    }

    @Test
    void extract_samplePage_stripsBoilerplate() throws IOException {
        ExtractedPage page = extractor.extract(readResource("sample-page.html"));

        assertThat(page.title()).isEqualTo("Computer Science and Engineering");
        List<String> lines = page.cleanedText().lines().toList();
        assertThat(lines).contains(
                "Department of Computer Science and Engineering",
                "The department offers undergraduate and graduate programs in computing.",
                "Research groups work on machine learning, systems and theory.");
        assertThat(page.cleanedText())
                .doesNotContain("tracking")
                .doesNotContain("color: red")
                .doesNotContain("Header banner")
                .doesNotContain("Admissions")
                .doesNotContain("Menu text")
                .doesNotContain("cookies")
                .doesNotContain("Copyright")
                .doesNotContain("Read More")
                .doesNotContain("----------")
                .doesNotContain("Short");
    }

    @Test
    void extract_keepsFirstOccurrenceOfRepeatedLines() {
        String html = """
                <html><body>
                  <p>Admissions are open for Fall 2024</p>
                  <p>Tuition and fees are listed below</p>
                  <div><span>Admissions are open for Fall 2024</span></div>
                </body></html>
                """;

        ExtractedPage page = extractor.extract(html);

        assertThat(page.cleanedText()).isEqualTo(
                "Admissions are open for Fall 2024\nTuition and fees are listed below");
    }

    @Test
    void extract_everyKeptLineIsTrimmedAndLongEnough() {
        String html = "<body><p>   padded line with spaces   </p><p>tiny</p><p>  </p></body>";

        ExtractedPage page = extractor.extract(html);

        assertThat(page.cleanedText()).isEqualTo("padded line with spaces");
    }

    @Test
    void extract_elementRulesRunInOrderOverWholeDocument() {
        ExtractionRules rules = new ExtractionRules(
                List.of(new TagNameContentRule("aside"), new ElementStyleRule("display:none")),
                List.of(new BlankLineRule(), new DuplicateLineRule()));
        String html = """
                <body>
                  <aside><p>Sidebar paragraph</p></aside>
                  <p style="display: none">Hidden paragraph</p>
                  <p>Visible paragraph</p>
                </body>
                """;

        ExtractedPage page = new ContentExtractor(rules).extract(html);

        assertThat(page.cleanedText()).isEqualTo("Visible paragraph");
    }

    @Test
    void extract_withoutLineRulesStillCollapsesRepeatedLines() {
        ContentExtractor plain = new ContentExtractor(new ExtractionRules(List.of(), List.of(new BlankLineRule())));

        ExtractedPage page = plain.extract("<html><head><title>T</title></head><body><p>a</p><p>a</p></body></html>");

        assertThat(page.title()).isEqualTo("T");
        assertThat(page.cleanedText()).isEqualTo("T\na");
    }

    @Test
    void extract_missingTitleIsEmpty() {
        assertThat(extractor.extract("<p>Some paragraph with enough text</p>").title()).isEmpty();
    }

    private static String readResource(String name) throws IOException {
        try (InputStream in = ContentExtractorTest.class.getClassLoader().getResourceAsStream(name)) {
            assertThat(in).as("test resource " + name).isNotNull();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
