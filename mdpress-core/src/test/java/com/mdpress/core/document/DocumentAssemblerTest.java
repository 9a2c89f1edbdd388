package com.mdpress.core.document;

import com.mdpress.core.block.Block;
import com.mdpress.core.block.BlockKind;
import com.mdpress.core.html.HtmlStyles;
import com.mdpress.core.html.StyleProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DocumentAssembler} and {@link DefaultHtmlShell}.
 */
class DocumentAssemblerTest {

    private static final List<Block> BLOCKS = List.of(
        new Block(BlockKind.HEADER, "<h1>T</h1>"),
        new Block(BlockKind.PARAGRAPH, "<p>body</p>"));

    private DocumentAssembler assembler;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);
        BylineRenderer byline = new BylineRenderer(HtmlStyles.of(StyleProfile.PLAIN), clock,
            ZoneOffset.ofHours(7), DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"));
        assembler = new DocumentAssembler(byline, new BlockFormatter(), new DefaultHtmlShell("en", "./styles/style.css"));
    }

    @Test
    void assemble_noMetadata_containsOnlyBlocks() {
        Document document = assembler.assemble("T", Map.of(), BLOCKS);

        assertThat(document.title()).isEqualTo("T");
        assertThat(document.content()).isEqualTo("  <h1>T</h1>\n  <p>body</p>");
    }

    @Test
    void assemble_withMetadata_startsWithByline() {
        Document document = assembler.assemble("T", Map.of("author", "Bar"), BLOCKS);

        assertThat(document.content()).isEqualTo(
            "<section><p>Written by Bar</p>\n<section><p>at 2024-01-01 07:00:00</p></section></section>\n"
                + "  <h1>T</h1>\n  <p>body</p>");
        assertThat(document.metadata()).containsExactly(Map.entry("author", "Bar"));
    }

    @Test
    void render_withoutTemplate_usesDefaultShell() {
        Document document = assembler.assemble("My Page", Map.of(), List.of(new Block(BlockKind.PARAGRAPH, "<p>x</p>")));

        String page = assembler.render(document, null);

        assertThat(page).isEqualTo("""
            <!DOCTYPE html>
            <html lang="en">
            <head>
                <meta charset="UTF-8">
                <meta name="viewport" content="width=device-width, initial-scale=1.0">
                <title>My Page</title>
                <link rel="stylesheet" href="./styles/style.css" />
            </head>
            <body>
                  <p>x</p>
            </body>
            </html>""");
    }

    @Test
    void render_withTemplate_substitutesDocument() {
        Document document = assembler.assemble("T", Map.of("author", "Bar"), List.of());
        HtmlTemplate template = HtmlTemplate.of("t", "<title>{{title}}</title><footer>{{author}}</footer>{{content}}");

        String page = assembler.render(document, template);

        assertThat(page).startsWith("<title>T</title><footer>Bar</footer><section>");
    }

    @Test
    void defaultShell_blankStylesheet_omitsLink() {
        String page = new DefaultHtmlShell("de", "").render("T", "C");

        assertThat(page)
            .contains("<html lang=\"de\">")
            .contains("<title>T</title>\n</head>")
            .doesNotContain("<link");
    }
}
