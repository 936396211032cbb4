package io.storyloom.core.text;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class MarkdownStripperTest {

    @Test
    void shouldRemoveHeadingsAndEmphasis() {
        assertThat(MarkdownStripper.strip("# Title\n\nSome **bold**, __strong__ and *italic* ~~old~~ text."))
                .isEqualTo("Title\n\nSome bold, strong and italic old text.");
    }

    @Test
    void shouldKeepLinkAndImageText() {
        assertThat(MarkdownStripper.strip("[the map](http://x.io) and ![a lighthouse](img.png)"))
                .isEqualTo("the map and a lighthouse");
    }

    @Test
    void shouldKeepCodeContent() {
        assertThat(MarkdownStripper.strip("Run `loom()` now:\n```java\nweave();\n```"))
                .isEqualTo("Run loom() now:\nweave();");
    }

    @Test
    void shouldRemoveListMarkersQuotesAndRules() {
        assertThat(MarkdownStripper.strip("> said the keeper\n\n- one\n* two\n1. three\n\n---\nend"))
                .isEqualTo("said the keeper\n\none\ntwo\nthree\n\nend");
    }

    @Test
    void shouldCollapseBlankLinesAndDropHtml() {
        assertThat(MarkdownStripper.strip("<p>a</p>\r\n\r\n\r\n\r\nb<br/>")).isEqualTo("a\n\nb");
    }

    @Test
    void shouldKeepUnderscoresInsideWords() {
        assertThat(MarkdownStripper.strip("see snake_case_word and _this_"))
                .isEqualTo("see snake_case_word and this");
    }

    @Test
    void shouldUnescapeMarkdownCharacters() {
        assertThat(MarkdownStripper.strip("2 \\* 3 \\# 4")).isEqualTo("2 * 3 # 4");
    }

    @Test
    void shouldReturnEmptyForNullOrEmpty() {
        assertThat(MarkdownStripper.strip(null)).isEmpty();
        assertThat(MarkdownStripper.strip("")).isEmpty();
    }
}
