package com.mdpress.core.renderer.impl;

import com.mdpress.core.renderer.OutputRenderer;
import com.mdpress.core.renderer.RenderContext;
import com.mdpress.core.renderer.RenderedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Renderer that prints the page to standard output.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.trailingNewline} - Print a newline after the page ("true"/"false", default: "true")</li>
 * </ul>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(RenderedDocument document, RenderContext context) {
        boolean trailingNewline = Boolean.parseBoolean(
            context.getSettingOrDefault("console.trailingNewline", "true"));
        logger.debug("Printing '{}' to console", document.title());

        PrintStream out = System.out;
        if (trailingNewline) {
            out.println(document.html());
        } else {
            out.print(document.html());
        }
        out.flush();
        if (out.checkError()) {
            throw new IllegalStateException("Failed to write to standard output");
        }
    }
}
