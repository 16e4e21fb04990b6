package org.smileyface.campuscrawler.model;

/**
 * Title and boilerplate-free text extracted from one page.
 *
 * @param title       trimmed {@code <title>} text, empty when absent
 * @param cleanedText kept lines joined with '\n'
 */
public record ExtractedPage(String title, String cleanedText) {

    public static final ExtractedPage EMPTY = new ExtractedPage("", "");

    public ExtractedPage {
        title = title == null ? "" : title;
        cleanedText = cleanedText == null ? "" : cleanedText;
    }
}
