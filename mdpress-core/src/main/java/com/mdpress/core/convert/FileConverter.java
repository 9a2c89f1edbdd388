package com.mdpress.core.convert;

import com.mdpress.core.document.Document;
import com.mdpress.core.document.HtmlTemplate;
import com.mdpress.core.renderer.OutputRenderer;
import com.mdpress.core.renderer.OutputRenderers;
import com.mdpress.core.renderer.RenderContext;
import com.mdpress.core.renderer.RenderedDocument;
import com.mdpress.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Converts a Markdown file into an HTML file.
 *
 * <p>This is the top-level entry point: it never throws. Every failure is
 * logged and reported as a {@link ConversionResult} tagged with a
 * {@link ConversionErrorKind}:
 * <ul>
 *   <li>{@code MISSING_INPUT} - input absent or unreadable</li>
 *   <li>{@code MISSING_TEMPLATE} - template path given but unreadable</li>
 *   <li>{@code INVALID_TEMPLATE} - template without {@code {{content}}}</li>
 *   <li>{@code GENERIC_FAILURE} - anything else, including write errors</li>
 * </ul>
 *
 * <p>The page is handed to the renderer only after it is completely built,
 * so a failed conversion never writes output.
 */
public class FileConverter {

    private static final Logger log = LoggerFactory.getLogger(FileConverter.class);

    private final MarkdownConverter converter;
    private final OutputRenderer renderer;

    /**
     * Creates a converter writing through the {@code filesystem} renderer.
     *
     * @param converter in-memory engine
     */
    public FileConverter(MarkdownConverter converter) {
        this(converter, OutputRenderers.find(OutputRenderers.FILESYSTEM));
    }

    public FileConverter(MarkdownConverter converter, OutputRenderer renderer) {
        this.converter = Objects.requireNonNull(converter, "converter must not be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
    }

    /**
     * Converts one file.
     *
     * @param input Markdown input file
     * @param output HTML output destination
     * @param templatePath optional template, null for the default page
     * @return conversion outcome
     */
    public ConversionResult convert(Path input, Path output, Path templatePath) {
        Objects.requireNonNull(input, "input must not be null");
        Objects.requireNonNull(output, "output must not be null");

        try {
            log.debug("Converting {} -> {}", input, output);
            String markdown = readInput(input);
            HtmlTemplate template = templatePath != null ? loadTemplate(templatePath) : null;

            Document document = converter.toDocument(markdown, FileUtils.getBaseName(input));
            String html = converter.render(document, template);

            renderer.render(new RenderedDocument(document.title(), html),
                new RenderContext(output.toString(), Map.of()));
            log.info("Converted {} -> {}", input, output);
            return ConversionResult.succeeded(output);

        } catch (ConversionException e) {
            log.error("Conversion of {} failed ({}): {}", input, e.getKind(), e.getMessage());
            return ConversionResult.failed(output, e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Conversion of {} failed", input, e);
            String message = e.getMessage() != null ? e.getMessage() : e.toString();
            return ConversionResult.failed(output, ConversionErrorKind.GENERIC_FAILURE, message);
        }
    }

    private static String readInput(Path input) {
        if (!FileUtils.isReadableFile(input)) {
            throw new ConversionException(ConversionErrorKind.MISSING_INPUT, "Input file not found: " + input);
        }
        try {
            return FileUtils.readString(input);
        } catch (IOException e) {
            throw new ConversionException(ConversionErrorKind.MISSING_INPUT,
                "Failed to read input file: " + input + " (" + e.getMessage() + ")", e);
        }
    }

    private static HtmlTemplate loadTemplate(Path templatePath) {
        if (!FileUtils.isReadableFile(templatePath)) {
            throw new ConversionException(ConversionErrorKind.MISSING_TEMPLATE,
                "Template file not found: " + templatePath);
        }
        try {
            return HtmlTemplate.load(templatePath);
        } catch (IOException e) {
            throw new ConversionException(ConversionErrorKind.MISSING_TEMPLATE,
                "Failed to read template file: " + templatePath + " (" + e.getMessage() + ")", e);
        } catch (HtmlTemplate.InvalidTemplateException e) {
            throw new ConversionException(ConversionErrorKind.INVALID_TEMPLATE,
                "Error applying template: " + e.getMessage(), e);
        }
    }
}
