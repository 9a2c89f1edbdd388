package com.mdpress.core.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private FileUtils() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Reads a file as a UTF-8 string.
     *
     * @param path path to file
     * @return file content as string
     * @throws IOException if reading fails
     */
    public static String readString(Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    /**
     * Checks if a path is a readable regular file.
     *
     * @param path path to check
     * @return true if the file exists and can be read
     */
    public static boolean isReadableFile(Path path) {
        return Files.isRegularFile(path) && Files.isReadable(path);
    }

    /**
     * Gets the file name without its last extension.
     *
     * <p>{@code notes/post.md} gives {@code post}, {@code archive.tar.gz} gives
     * {@code archive.tar}, and a dot-file such as {@code .notes} is kept whole.
     *
     * @param path file path
     * @return base name
     */
    public static String getBaseName(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return "";
        }
        String name = fileName.toString();
        int lastDot = name.lastIndexOf('.');
        return lastDot > 0 ? name.substring(0, lastDot) : name;
    }
}
