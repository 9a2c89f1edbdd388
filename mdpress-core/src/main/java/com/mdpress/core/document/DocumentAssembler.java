package com.mdpress.core.document;

import com.mdpress.core.block.Block;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Combines title, metadata and blocks into the final page.
 *
 * <p>Assembly runs in two steps:
 * <ol>
 *   <li>{@link #assemble} prepends the byline (when metadata exists) and joins
 *       the indented blocks into the document content</li>
 *   <li>{@link #render} substitutes the document into a template, or into the
 *       {@link DefaultHtmlShell} when no template is given</li>
 * </ol>
 */
public class DocumentAssembler {

    private static final Logger log = LoggerFactory.getLogger(DocumentAssembler.class);

    private final BylineRenderer bylineRenderer;
    private final BlockFormatter blockFormatter;
    private final DefaultHtmlShell defaultShell;

    public DocumentAssembler(BylineRenderer bylineRenderer, BlockFormatter blockFormatter, DefaultHtmlShell defaultShell) {
        this.bylineRenderer = Objects.requireNonNull(bylineRenderer, "bylineRenderer must not be null");
        this.blockFormatter = Objects.requireNonNull(blockFormatter, "blockFormatter must not be null");
        this.defaultShell = Objects.requireNonNull(defaultShell, "defaultShell must not be null");
    }

    /**
     * Builds the document content.
     *
     * @param title resolved title
     * @param metadata author-supplied metadata
     * @param blocks body blocks in order
     * @return assembled document
     */
    public Document assemble(String title, Map<String, String> metadata, List<Block> blocks) {
        List<Block> all = new ArrayList<>(blocks.size() + 1);
        bylineRenderer.render(metadata).ifPresent(all::add);
        all.addAll(blocks);
        return new Document(title, metadata, blockFormatter.join(all));
    }

    /**
     * Renders the final page.
     *
     * @param document assembled document
     * @param template template, or null for the default shell
     * @return HTML page
     */
    public String render(Document document, HtmlTemplate template) {
        if (template == null) {
            return defaultShell.render(document.title(), document.content());
        }
        log.debug("Applying template: {}", template.source());
        return template.apply(document.title(), document.metadata(), document.content());
    }
}
