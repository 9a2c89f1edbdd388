package com.mdpress.core.convert;

import com.mdpress.core.block.Block;
import com.mdpress.core.block.BlockSegmenter;
import com.mdpress.core.config.ConverterConfig;
import com.mdpress.core.document.BlockFormatter;
import com.mdpress.core.document.BylineRenderer;
import com.mdpress.core.document.DefaultHtmlShell;
import com.mdpress.core.document.Document;
import com.mdpress.core.document.DocumentAssembler;
import com.mdpress.core.document.HtmlTemplate;
import com.mdpress.core.frontmatter.FrontMatter;
import com.mdpress.core.frontmatter.FrontMatterExtractor;
import com.mdpress.core.html.HtmlStyles;
import com.mdpress.core.inline.InlineFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * In-memory Markdown to HTML engine.
 *
 * <p>Pipeline: front matter extraction, block segmentation (with inline
 * formatting and list nesting), document assembly, page rendering.
 *
 * <p>An instance only holds immutable collaborators built from its
 * {@link ConverterConfig}; all parsing state is created per call, so one
 * converter can process any number of documents.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * MarkdownConverter converter = new MarkdownConverter(ConverterConfig.defaults());
 * Document document = converter.toDocument("# Title\n\nHello **world**", "notes");
 * String page = converter.render(document, null);
 * }</pre>
 */
public class MarkdownConverter {

    private static final Logger log = LoggerFactory.getLogger(MarkdownConverter.class);

    public static final String TITLE_KEY = "title";

    private final BlockSegmenter segmenter;
    private final DocumentAssembler assembler;

    public MarkdownConverter(ConverterConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * Creates a converter with an explicit clock for the synthesized byline time.
     *
     * @param config converter configuration
     * @param clock clock used when metadata has no {@code datetime}
     */
    public MarkdownConverter(ConverterConfig config, Clock clock) {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(clock, "clock must not be null");

        HtmlStyles styles = HtmlStyles.of(config.style());
        this.segmenter = new BlockSegmenter(styles, new InlineFormatter(styles), config.fences().unterminated());
        this.assembler = new DocumentAssembler(
            new BylineRenderer(styles, clock, config.byline().offset(), config.byline().formatter()),
            new BlockFormatter(),
            new DefaultHtmlShell(config.html().lang(), config.html().stylesheet())
        );
    }

    /**
     * Segments a body that has no front matter.
     *
     * @param body document body
     * @return blocks in document order
     */
    public List<Block> segment(String body) {
        return segmenter.segment(normalizeLineEndings(body));
    }

    /**
     * Converts Markdown into an assembled document.
     *
     * @param markdown full document text, front matter included
     * @param fallbackTitle title used when metadata has no {@code title}
     * @return assembled document
     */
    public Document toDocument(String markdown, String fallbackTitle) {
        Objects.requireNonNull(markdown, "markdown must not be null");
        Objects.requireNonNull(fallbackTitle, "fallbackTitle must not be null");

        FrontMatter frontMatter = FrontMatterExtractor.extract(normalizeLineEndings(markdown));
        List<Block> blocks = segmenter.segment(frontMatter.body());

        String title = frontMatter.metadata().getOrDefault(TITLE_KEY, fallbackTitle);
        log.debug("Converted document '{}' ({} metadata entries, {} blocks)",
            title, frontMatter.metadata().size(), blocks.size());
        return assembler.assemble(title, frontMatter.metadata(), blocks);
    }

    /**
     * Renders a document into a page.
     *
     * @param document assembled document
     * @param template template, or null for the default page
     * @return HTML page
     */
    public String render(Document document, HtmlTemplate template) {
        return assembler.render(document, template);
    }

    /**
     * Converts Markdown straight into a page.
     *
     * @param markdown full document text
     * @param fallbackTitle title used when metadata has no {@code title}
     * @param template template, or null for the default page
     * @return HTML page
     */
    public String toHtml(String markdown, String fallbackTitle, HtmlTemplate template) {
        return render(toDocument(markdown, fallbackTitle), template);
    }

    private static String normalizeLineEndings(String text) {
        return text.replace("\r\n", "\n");
    }
}
