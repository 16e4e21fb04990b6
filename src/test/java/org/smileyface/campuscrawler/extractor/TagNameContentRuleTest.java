package org.smileyface.campuscrawler.extractor;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class TagNameContentRuleTest {

    @Test
    void isMatched_matchesAnyConfiguredTagCaseInsensitively() {
        Document doc = Jsoup.parse("<NAV>menu</NAV><footer>f</footer><p>text</p>");
        TagNameContentRule rule = new TagNameContentRule(" Nav ", "FOOTER");

        assertThat(rule.getTagNames()).containsExactlyInAnyOrder("nav", "footer");
        assertThat(rule.isMatched(doc.selectFirst("nav"))).isTrue();
        assertThat(rule.isMatched(doc.selectFirst("footer"))).isTrue();
        assertThat(rule.isMatched(doc.selectFirst("p"))).isFalse();
        assertThat(rule.isMatched(null)).isFalse();
    }

    @Test
    void constructor_rejectsEmptyOrBlankNames() {
        assertThatThrownBy(() -> new TagNameContentRule(List.of())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TagNameContentRule("p", " ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TagNameContentRule((String[]) null)).isInstanceOf(IllegalArgumentException.class);
    }
}
