package com.mdpress.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileUtils}.
 */
class FileUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void getBaseName_stripsLastExtension() {
        assertThat(FileUtils.getBaseName(Paths.get("notes/post.md"))).isEqualTo("post");
        assertThat(FileUtils.getBaseName(Paths.get("archive.tar.gz"))).isEqualTo("archive.tar");
    }

    @Test
    void getBaseName_withoutExtensionOrDotFile_keepsName() {
        assertThat(FileUtils.getBaseName(Paths.get("README"))).isEqualTo("README");
        assertThat(FileUtils.getBaseName(Paths.get(".notes"))).isEqualTo(".notes");
    }

    @Test
    void isReadableFile_distinguishesFilesFromDirectories() throws IOException {
        Path file = Files.writeString(tempDir.resolve("a.md"), "x");

        assertThat(FileUtils.isReadableFile(file)).isTrue();
        assertThat(FileUtils.isReadableFile(tempDir)).isFalse();
        assertThat(FileUtils.isReadableFile(tempDir.resolve("missing.md"))).isFalse();
    }

    @Test
    void readString_decodesUtf8() throws IOException {
        Path file = Files.writeString(tempDir.resolve("a.md"), "héllo");

        assertThat(FileUtils.readString(file)).isEqualTo("héllo");
    }

    @Test
    void constructor_throwsAssertionError() {
        assertThatThrownBy(() -> {
            var constructor = FileUtils.class.getDeclaredConstructor();
            constructor.setAccessible(true);
            constructor.newInstance();
        })
        .cause()
        .isInstanceOf(AssertionError.class);
    }
}
