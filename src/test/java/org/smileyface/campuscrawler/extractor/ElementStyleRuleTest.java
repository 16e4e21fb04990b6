package org.smileyface.campuscrawler.extractor;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ElementStyleRuleTest {

    @Test
    void isMatched_ignoresCaseAndSpaces() {
        Document doc = Jsoup.parse("""
                <div id='a' style='DISPLAY: none; color: red'>hidden</div>
                <div id='b' style='display:block'>shown</div>
                <div id='c'>no style</div>
                """);
        ElementStyleRule rule = new ElementStyleRule("display:none");

        assertThat(rule.isMatched(doc.getElementById("a"))).isTrue();
        assertThat(rule.isMatched(doc.getElementById("b"))).isFalse();
        assertThat(rule.isMatched(doc.getElementById("c"))).isFalse();
        assertThat(rule.isMatched(null)).isFalse();
    }

    @Test
    void constructor_rejectsBlankFragment() {
        assertThatThrownBy(() -> new ElementStyleRule("  ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ElementStyleRule(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
