package com.mdpress.core.block;

import com.mdpress.core.html.ElementKind;
import com.mdpress.core.html.HtmlStyles;
import com.mdpress.core.inline.InlineFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Walks a document body line by line and cuts it into HTML blocks.
 *
 * <p>The segmenter is a two-state machine ({@code normal}, {@code in-fence}):
 * <ul>
 *   <li><b>Fence line</b> (trimmed line starting with three backticks) toggles
 *       the state. Opening flushes the paragraph buffer, closes open lists and
 *       records the language tag. Closing emits one code block.</li>
 *   <li><b>Inside a fence</b> lines are kept verbatim.</li>
 *   <li><b>Blank line</b> flushes the paragraph buffer, then closes open lists
 *       unless the next line is itself a list item.</li>
 *   <li><b>List item</b> moves the {@link ListStack}; a freshly opened list
 *       flushes a pending paragraph first.</li>
 *   <li><b>Any other line</b> closes open lists and is buffered as a header or
 *       as inline-formatted text.</li>
 * </ul>
 *
 * <p>Buffered fragments are space-joined into one block. The block is wrapped
 * in a paragraph only when its first fragment is plain text.
 *
 * <p>Instances hold no per-document state and may be reused; every call to
 * {@link #segment(String)} works on a fresh list stack and fresh buffers.
 */
public class BlockSegmenter {

    private static final Logger log = LoggerFactory.getLogger(BlockSegmenter.class);

    private final HtmlStyles styles;
    private final InlineFormatter inlineFormatter;
    private final UnterminatedFencePolicy fencePolicy;

    public BlockSegmenter(HtmlStyles styles, InlineFormatter inlineFormatter, UnterminatedFencePolicy fencePolicy) {
        this.styles = Objects.requireNonNull(styles, "styles must not be null");
        this.inlineFormatter = Objects.requireNonNull(inlineFormatter, "inlineFormatter must not be null");
        this.fencePolicy = Objects.requireNonNull(fencePolicy, "fencePolicy must not be null");
    }

    /**
     * Segments a document body into blocks.
     *
     * @param body body text with LF line endings, front matter already removed
     * @return blocks in document order
     */
    public List<Block> segment(String body) {
        Objects.requireNonNull(body, "body must not be null");
        List<Block> blocks = new Segmentation(body.split("\n", -1)).run();
        log.debug("Segmented body into {} blocks", blocks.size());
        return blocks;
    }

    /**
     * State of a single segmentation call.
     */
    private final class Segmentation {

        private final String[] lines;
        private final ListStack lists = new ListStack(styles);
        private final List<Fragment> pending = new ArrayList<>();
        private final List<String> codeLines = new ArrayList<>();
        private final List<Block> blocks = new ArrayList<>();

        private boolean inFence;
        private String language = "";

        Segmentation(String[] lines) {
            this.lines = lines;
        }

        List<Block> run() {
            for (int i = 0; i < lines.length; i++) {
                String line = lines[i];

                if (LinePatterns.isFence(line)) {
                    if (inFence) {
                        closeFence();
                    } else {
                        openFence(line);
                    }
                    continue;
                }

                if (inFence) {
                    codeLines.add(line);
                    continue;
                }

                if (line.isBlank()) {
                    flushParagraph();
                    boolean nextIsListItem = i + 1 < lines.length && LinePatterns.isListItem(lines[i + 1]);
                    if (!nextIsListItem) {
                        closeLists();
                    }
                } else {
                    processLine(line);
                }
            }
            finish();
            return blocks;
        }

        private void openFence(String line) {
            flushParagraph();
            closeLists();
            inFence = true;
            language = LinePatterns.fenceLanguage(line);
            log.debug("Opened code fence (language: '{}')", language);
        }

        private void closeFence() {
            blocks.add(new Block(BlockKind.CODE, renderCode()));
            codeLines.clear();
            inFence = false;
        }

        private void processLine(String line) {
            Optional<LinePatterns.ListItemLine> item = LinePatterns.matchListItem(line);
            if (item.isPresent()) {
                processListItem(item.get());
                return;
            }

            List<String> closing = lists.closeAll();
            Optional<LinePatterns.HeaderLine> header = LinePatterns.matchHeader(line);
            String html = header
                .map(h -> styles.openHeading(h.level())
                    + inlineFormatter.format(h.text())
                    + styles.closeHeading(h.level()))
                .orElseGet(() -> inlineFormatter.format(line));

            // Lines that end a list stay in the list's region
            if (!closing.isEmpty()) {
                pending.add(new Fragment(FragmentKind.LIST, String.join("\n", closing) + "\n" + html));
            } else if (header.isPresent()) {
                pending.add(new Fragment(FragmentKind.HEADER, html));
            } else {
                pending.add(new Fragment(FragmentKind.TEXT, html));
            }
        }

        private void processListItem(LinePatterns.ListItemLine item) {
            ListTransition transition = lists.enter(item.indent(), item.ordered());
            if (transition.startsNewList() && !pending.isEmpty()) {
                flushParagraph();
            }

            List<String> parts = transition.tags();
            parts.add(styles.openTag(ElementKind.LIST_ITEM)
                + inlineFormatter.format(item.content())
                + styles.closeTag(ElementKind.LIST_ITEM));
            pending.add(new Fragment(FragmentKind.LIST, String.join("\n", parts)));
        }

        private void flushParagraph() {
            if (pending.isEmpty()) {
                return;
            }
            String content = pending.stream()
                .map(Fragment::html)
                .collect(Collectors.joining(" "));

            Block block = switch (pending.get(0).kind()) {
                case HEADER -> new Block(BlockKind.HEADER, content);
                case LIST -> new Block(BlockKind.LIST, content);
                case TEXT -> new Block(BlockKind.PARAGRAPH,
                    styles.openTag(ElementKind.PARAGRAPH) + content + styles.closeTag(ElementKind.PARAGRAPH));
            };
            blocks.add(block);
            pending.clear();
        }

        private void closeLists() {
            List<String> closing = lists.closeAll();
            if (!closing.isEmpty()) {
                blocks.add(new Block(BlockKind.LIST, String.join("\n", closing)));
            }
        }

        private void finish() {
            if (inFence) {
                if (fencePolicy == UnterminatedFencePolicy.FLUSH) {
                    log.warn("Code fence opened but never closed; emitting {} buffered lines", codeLines.size());
                    blocks.add(new Block(BlockKind.CODE, renderCode()));
                } else {
                    log.warn("Code fence opened but never closed; discarding {} buffered lines", codeLines.size());
                }
                codeLines.clear();
                inFence = false;
            }
            flushParagraph();
            closeLists();
        }

        private String renderCode() {
            String pre = styles.openTag(ElementKind.CODE_BLOCK);
            String code = styles.openCodeBody(language);
            String codeEnd = styles.closeTag(ElementKind.CODE_BLOCK_BODY);
            String preEnd = styles.closeTag(ElementKind.CODE_BLOCK);
            if (styles.indentsCodeBlocks()) {
                return pre + "\n  " + code + "\n    "
                    + String.join("\n    ", codeLines)
                    + "\n  " + codeEnd + "\n" + preEnd;
            }
            return pre + code + "\n"
                + String.join("\n", codeLines)
                + "\n" + codeEnd + preEnd;
        }
    }
}
