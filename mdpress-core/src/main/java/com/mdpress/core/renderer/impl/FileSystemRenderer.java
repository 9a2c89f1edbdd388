package com.mdpress.core.renderer.impl;

import com.mdpress.core.renderer.OutputRenderer;
import com.mdpress.core.renderer.RenderContext;
import com.mdpress.core.renderer.RenderedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;

/**
 * Renderer that writes the page to a UTF-8 file.
 *
 * <p>Parent directories are created as needed and an existing file is
 * overwritten. The page is first written to a temporary file next to the
 * target and then moved into place, so a failed write never leaves a
 * truncated target behind. On POSIX file systems the page keeps the
 * permissions of the file it replaces, and a new page gets {@code rw-r--r--}.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * RenderContext context = new RenderContext("site/post.html", Map.of());
 * new FileSystemRenderer().render(new RenderedDocument("post", html), context);
 * // Creates: site/post.html
 * }</pre>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    private static final Set<PosixFilePermission> DEFAULT_PERMISSIONS = PosixFilePermissions.fromString("rw-r--r--");

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(RenderedDocument document, RenderContext context) {
        Path targetPath = Paths.get(context.target()).toAbsolutePath();
        Path parentDir = targetPath.getParent();
        logger.debug("Writing '{}' to: {}", document.title(), targetPath);

        Path tempFile = null;
        try {
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            tempFile = Files.createTempFile(parentDir, ".mdpress-", ".tmp");
            Files.writeString(tempFile, document.html(), StandardCharsets.UTF_8);
            applyPermissions(tempFile, targetPath);
            move(tempFile, targetPath);
            logger.info("Wrote file: {} ({} chars)", targetPath, document.html().length());
        } catch (IOException e) {
            deleteQuietly(tempFile);
            throw new IllegalStateException("Failed to write file: " + targetPath, e);
        }
    }

    // Temporary files are created owner-only
    private static void applyPermissions(Path tempFile, Path target) throws IOException {
        if (!Files.getFileStore(tempFile).supportsFileAttributeView(PosixFileAttributeView.class)) {
            return;
        }
        Set<PosixFilePermission> permissions = Files.isRegularFile(target)
            ? Files.getPosixFilePermissions(target)
            : DEFAULT_PERMISSIONS;
        Files.setPosixFilePermissions(tempFile, permissions);
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path tempFile) {
        if (tempFile == null) {
            return;
        }
        try {
            Files.deleteIfExists(tempFile);
        } catch (IOException e) {
            logger.warn("Failed to delete temporary file {}: {}", tempFile, e.getMessage());
        }
    }
}
